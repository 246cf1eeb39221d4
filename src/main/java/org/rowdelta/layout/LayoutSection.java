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

package org.rowdelta.layout;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.rowdelta.RowIdentity;

/**
 * Immutable section of a {@link Layout}: a name and an ordered list of rows.
 * Equality compares the name and the row identifiers in order.
 *
 * @author RowDelta Authors
 */
public final class LayoutSection {
    private final String mName;
    private final List<RowIdentity> mRows;

    /**
     * @param name section name, or null for the single section of ungrouped
     * results
     * @param rows rows of the section, in order
     */
    public LayoutSection(String name, Collection<RowIdentity> rows) {
        mName = name;
        mRows = Collections.unmodifiableList(new ArrayList<RowIdentity>(rows));
    }

    /**
     * Returns the section name, or null if results are not grouped.
     */
    public String getName() {
        return mName;
    }

    public List<RowIdentity> getRows() {
        return mRows;
    }

    public int getRowCount() {
        return mRows.size();
    }

    public RowIdentity getRow(int index) {
        return mRows.get(index);
    }

    @Override
    public int hashCode() {
        return (mName == null ? 0 : mName.hashCode()) * 31 + mRows.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof LayoutSection) {
            LayoutSection other = (LayoutSection) obj;
            return (mName == null ? other.mName == null : mName.equals(other.mName))
                && mRows.equals(other.mRows);
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append(mName == null ? "<ungrouped>" : mName).append(": [");
        for (int i=0; i<mRows.size(); i++) {
            if (i > 0) {
                b.append(", ");
            }
            b.append(mRows.get(i).getId());
        }
        return b.append(']').toString();
    }
}
