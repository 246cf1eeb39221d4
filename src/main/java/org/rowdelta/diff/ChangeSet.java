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

package org.rowdelta.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.rowdelta.ChangeEvent;
import org.rowdelta.RowChange;
import org.rowdelta.SectionChange;
import org.rowdelta.layout.Layout;

/**
 * Result of a {@link DiffEngine#diff diff}: the section changes and row
 * changes, in the order they must be applied, and the new layout they lead
 * to.
 *
 * @author RowDelta Authors
 */
public final class ChangeSet {
    private final List<SectionChange> mSectionChanges;
    private final List<RowChange> mRowChanges;
    private final Layout mLayout;

    ChangeSet(List<SectionChange> sectionChanges, List<RowChange> rowChanges, Layout layout) {
        mSectionChanges = Collections.unmodifiableList(sectionChanges);
        mRowChanges = Collections.unmodifiableList(rowChanges);
        mLayout = layout;
    }

    /**
     * Returns section deletes in descending index order, followed by section
     * inserts in ascending index order.
     */
    public List<SectionChange> getSectionChanges() {
        return mSectionChanges;
    }

    /**
     * Returns row deletes, then moves and inserts, then updates.
     */
    public List<RowChange> getRowChanges() {
        return mRowChanges;
    }

    /**
     * Returns all section changes followed by all row changes.
     */
    public List<ChangeEvent> getEvents() {
        List<ChangeEvent> events = new ArrayList<ChangeEvent>(size());
        events.addAll(mSectionChanges);
        events.addAll(mRowChanges);
        return events;
    }

    /**
     * Returns the layout obtained by applying all changes.
     */
    public Layout getLayout() {
        return mLayout;
    }

    public boolean isEmpty() {
        return mSectionChanges.isEmpty() && mRowChanges.isEmpty();
    }

    public int size() {
        return mSectionChanges.size() + mRowChanges.size();
    }

    @Override
    public String toString() {
        return "ChangeSet {sections=" + mSectionChanges + ", rows=" + mRowChanges + '}';
    }
}
