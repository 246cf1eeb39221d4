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

package org.rowdelta.cache.map;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.rowdelta.cache.AbstractLayoutStore;
import org.rowdelta.layout.Layout;

/**
 * Layout store which keeps records in memory for the lifetime of the
 * process. Layouts are immutable, so records are kept as given, values
 * included.
 *
 * @author RowDelta Authors
 */
public class MapLayoutStore extends AbstractLayoutStore {
    private final ConcurrentMap<String, Record> mRecords;

    public MapLayoutStore() {
        mRecords = new ConcurrentHashMap<String, Record>();
    }

    public boolean isDurable() {
        return false;
    }

    /**
     * Returns the amount of stored records.
     */
    public int size() {
        return mRecords.size();
    }

    @Override
    protected Layout doRead(String name, String signature) {
        Record record = mRecords.get(name);
        if (record == null || !record.mSignature.equals(signature)) {
            return null;
        }
        return record.mLayout;
    }

    @Override
    protected void doWrite(String name, String signature, Layout layout) {
        mRecords.put(name, new Record(signature, layout));
    }

    @Override
    protected void doDelete(String name) {
        mRecords.remove(name);
    }

    @Override
    protected void doDeleteAll() {
        mRecords.clear();
    }

    private static class Record {
        final String mSignature;
        final Layout mLayout;

        Record(String signature, Layout layout) {
            mSignature = signature;
            mLayout = layout;
        }
    }
}
