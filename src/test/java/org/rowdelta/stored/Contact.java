/*
 * Copyright 2026 The RowDelta Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rowdelta.stored;

/**
 * Test bean fetched by the toy query engine.
 *
 * @author RowDelta Authors
 */
public class Contact {
    private long mId;
    private String mGroup;
    private String mName;
    private int mRank;
    private String mNote;
    private Location mLocation;

    public Contact() {
    }

    public Contact(long id, String group, String name, int rank) {
        mId = id;
        mGroup = group;
        mName = name;
        mRank = rank;
    }

    public long getId() {
        return mId;
    }

    public void setId(long id) {
        mId = id;
    }

    public String getGroup() {
        return mGroup;
    }

    public void setGroup(String group) {
        mGroup = group;
    }

    public String getName() {
        return mName;
    }

    public void setName(String name) {
        mName = name;
    }

    public int getRank() {
        return mRank;
    }

    public void setRank(int rank) {
        mRank = rank;
    }

    public String getNote() {
        return mNote;
    }

    public void setNote(String note) {
        mNote = note;
    }

    public Location getLocation() {
        return mLocation;
    }

    public void setLocation(Location location) {
        mLocation = location;
    }

    public Contact copy() {
        Contact copy = new Contact(mId, mGroup, mName, mRank);
        copy.mNote = mNote;
        copy.mLocation = mLocation;
        return copy;
    }

    @Override
    public String toString() {
        return "Contact {id=" + mId + ", group=" + mGroup + ", name=" + mName
            + ", rank=" + mRank + '}';
    }
}
