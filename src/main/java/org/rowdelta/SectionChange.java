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

import org.rowdelta.layout.LayoutSection;

/**
 * Insertion or deletion of a whole section. Section changes of a batch are
 * always reported before its row changes.
 *
 * @author RowDelta Authors
 */
public abstract class SectionChange extends ChangeEvent {
    private final LayoutSection mSection;
    private final int mIndex;

    SectionChange(LayoutSection section, int index) {
        if (section == null) {
            throw new IllegalArgumentException();
        }
        if (index < 0) {
            throw new IllegalArgumentException("Negative section index: " + index);
        }
        mSection = section;
        mIndex = index;
    }

    /**
     * Returns the affected section. For an insert, this is the section as it
     * appears in the new layout. For a delete, it is the section as it
     * appeared in the previous layout.
     */
    public LayoutSection getSection() {
        return mSection;
    }

    /**
     * Returns the section name, or null for the single section of ungrouped
     * results.
     */
    public String getSectionName() {
        return mSection.getName();
    }

    public int getIndex() {
        return mIndex;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "Section {name=" + getSectionName()
            + ", index=" + mIndex + '}';
    }

    /**
     * A section appeared. It is inserted empty; its rows follow as row
     * inserts.
     */
    public static final class Insert extends SectionChange {
        public Insert(LayoutSection section, int index) {
            super(section, index);
        }

        @Override
        public ChangeType getType() {
            return ChangeType.INSERT;
        }

        @Override
        public <R, P> R accept(ChangeVisitor<R, P> visitor, P param) {
            return visitor.visit(this, param);
        }
    }

    /**
     * A section went away, taking any rows it still held with it.
     */
    public static final class Delete extends SectionChange {
        public Delete(LayoutSection section, int index) {
            super(section, index);
        }

        @Override
        public ChangeType getType() {
            return ChangeType.DELETE;
        }

        @Override
        public <R, P> R accept(ChangeVisitor<R, P> visitor, P param) {
            return visitor.visit(this, param);
        }
    }
}
