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

package org.rowdelta;

/**
 * Immutable address of a row: a section index and a row index within that
 * section. Index paths order by section, then by row.
 *
 * @author RowDelta Authors
 */
public final class IndexPath implements Comparable<IndexPath> {
    public static IndexPath of(int section, int row) {
        return new IndexPath(section, row);
    }

    private final int mSection;
    private final int mRow;

    /**
     * @throws IllegalArgumentException if either index is negative
     */
    public IndexPath(int section, int row) {
        if (section < 0 || row < 0) {
            throw new IllegalArgumentException("Negative index: (" + section + ", " + row + ')');
        }
        mSection = section;
        mRow = row;
    }

    public int getSection() {
        return mSection;
    }

    public int getRow() {
        return mRow;
    }

    public int compareTo(IndexPath other) {
        if (mSection != other.mSection) {
            return mSection < other.mSection ? -1 : 1;
        }
        if (mRow != other.mRow) {
            return mRow < other.mRow ? -1 : 1;
        }
        return 0;
    }

    @Override
    public int hashCode() {
        return mSection * 31 + mRow;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof IndexPath) {
            IndexPath other = (IndexPath) obj;
            return mSection == other.mSection && mRow == other.mRow;
        }
        return false;
    }

    @Override
    public String toString() {
        return "(" + mSection + ", " + mRow + ')';
    }
}
