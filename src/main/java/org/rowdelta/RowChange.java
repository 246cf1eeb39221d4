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
 * Change to a single row. Only the affected row is reported: rows which shift
 * because another row was inserted, deleted or moved before them get no event
 * of their own.
 *
 * @author RowDelta Authors
 */
public abstract class RowChange extends ChangeEvent {
    private final RowIdentity mRow;

    RowChange(RowIdentity row) {
        if (row == null) {
            throw new IllegalArgumentException();
        }
        mRow = row;
    }

    /**
     * Returns the affected row. Deleted rows are reported as last known;
     * all others as they appear in the new layout.
     */
    public RowIdentity getRow() {
        return mRow;
    }

    static IndexPath check(IndexPath path) {
        if (path == null) {
            throw new IllegalArgumentException("Index path cannot be null");
        }
        return path;
    }

    /**
     * A row was added at the given index path.
     */
    public static final class Insert extends RowChange {
        private final IndexPath mIndexPath;

        public Insert(RowIdentity row, IndexPath indexPath) {
            super(row);
            mIndexPath = check(indexPath);
        }

        public IndexPath getIndexPath() {
            return mIndexPath;
        }

        @Override
        public ChangeType getType() {
            return ChangeType.INSERT;
        }

        @Override
        public <R, P> R accept(ChangeVisitor<R, P> visitor, P param) {
            return visitor.visit(this, param);
        }

        @Override
        public String toString() {
            return "InsertRow {id=" + getRow().getId() + ", at=" + mIndexPath + '}';
        }
    }

    /**
     * A row was removed from the given index path.
     */
    public static final class Delete extends RowChange {
        private final IndexPath mIndexPath;

        public Delete(RowIdentity row, IndexPath indexPath) {
            super(row);
            mIndexPath = check(indexPath);
        }

        public IndexPath getIndexPath() {
            return mIndexPath;
        }

        @Override
        public ChangeType getType() {
            return ChangeType.DELETE;
        }

        @Override
        public <R, P> R accept(ChangeVisitor<R, P> visitor, P param) {
            return visitor.visit(this, param);
        }

        @Override
        public String toString() {
            return "DeleteRow {id=" + getRow().getId() + ", at=" + mIndexPath + '}';
        }
    }

    /**
     * A row changed position. The destination is addressed as if the row had
     * already been removed from its source. A moved row is assumed updated as
     * well, and gets no separate update event.
     */
    public static final class Move extends RowChange {
        private final IndexPath mFrom;
        private final IndexPath mTo;

        public Move(RowIdentity row, IndexPath from, IndexPath to) {
            super(row);
            mFrom = check(from);
            mTo = check(to);
        }

        public IndexPath getFromIndexPath() {
            return mFrom;
        }

        public IndexPath getToIndexPath() {
            return mTo;
        }

        @Override
        public ChangeType getType() {
            return ChangeType.MOVE;
        }

        @Override
        public <R, P> R accept(ChangeVisitor<R, P> visitor, P param) {
            return visitor.visit(this, param);
        }

        @Override
        public String toString() {
            return "MoveRow {id=" + getRow().getId() + ", from=" + mFrom + ", to=" + mTo + '}';
        }
    }

    /**
     * A row kept its position but its state changed.
     */
    public static final class Update extends RowChange {
        private final IndexPath mIndexPath;

        public Update(RowIdentity row, IndexPath indexPath) {
            super(row);
            mIndexPath = check(indexPath);
        }

        public IndexPath getIndexPath() {
            return mIndexPath;
        }

        @Override
        public ChangeType getType() {
            return ChangeType.UPDATE;
        }

        @Override
        public <R, P> R accept(ChangeVisitor<R, P> visitor, P param) {
            return visitor.visit(this, param);
        }

        @Override
        public String toString() {
            return "UpdateRow {id=" + getRow().getId() + ", at=" + mIndexPath + '}';
        }
    }
}
