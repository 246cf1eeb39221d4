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
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.rowdelta.IndexPath;
import org.rowdelta.LayoutInvariantException;
import org.rowdelta.RowIdentity;

/**
 * Immutable, materialized structure of fetched results: ordered sections,
 * each an ordered list of row identities. Every row identifier appears at
 * most once, section names are unique, and no section is empty. An index
 * keyed by row identifier answers {@link #indexPathOf} in constant time.
 *
 * <p>Equality compares structure only: section names and row identifiers, in
 * order. Sort and tracked values of the rows are not compared.
 *
 * @see MutableLayout
 * @author RowDelta Authors
 */
public final class Layout {
    public static final Layout EMPTY = new Layout(Collections.<LayoutSection>emptyList());

    /**
     * Groups sorted rows into sections. When grouped, contiguous runs of rows
     * with the same section name form a section, in the order they appear.
     * Otherwise all rows form a single section with a null name.
     *
     * @param rows rows in fetch order
     * @param grouped true if rows are grouped by their section names
     * @throws LayoutInvariantException if a section name reappears after
     * another section began, if a grouped row has no section name, or if a
     * row identifier repeats
     */
    public static Layout group(Iterable<RowIdentity> rows, boolean grouped) {
        List<LayoutSection> sections = new ArrayList<LayoutSection>();
        Set<String> finished = new HashSet<String>();

        String currentName = null;
        List<RowIdentity> current = null;

        for (RowIdentity row : rows) {
            String name = null;
            if (grouped) {
                name = row.getSectionName();
                if (name == null) {
                    throw new LayoutInvariantException("Row has no section name: " + row);
                }
            }
            if (current == null || !equal(name, currentName)) {
                if (current != null) {
                    sections.add(new LayoutSection(currentName, current));
                    finished.add(currentName);
                }
                if (finished.contains(name)) {
                    throw new LayoutInvariantException
                        ("Section \"" + name + "\" is not contiguous; " +
                         "results must be ordered by the section key first");
                }
                current = new ArrayList<RowIdentity>();
                currentName = name;
            }
            current.add(row);
        }

        if (current != null) {
            sections.add(new LayoutSection(currentName, current));
        }

        return sections.isEmpty() ? EMPTY : new Layout(sections);
    }

    private final List<LayoutSection> mSections;
    private final Map<Object, IndexPath> mIndex;
    private final Map<String, Integer> mSectionIndex;
    private final int mRowCount;

    /**
     * @throws LayoutInvariantException if any invariant is broken
     */
    public Layout(List<LayoutSection> sections) {
        List<LayoutSection> copy = new ArrayList<LayoutSection>(sections);
        Map<Object, IndexPath> index = new HashMap<Object, IndexPath>();
        Map<String, Integer> sectionIndex = new HashMap<String, Integer>();

        for (int s=0; s<copy.size(); s++) {
            LayoutSection section = copy.get(s);
            String name = section.getName();
            if (name == null && copy.size() > 1) {
                throw new LayoutInvariantException
                    ("Only ungrouped results can have a section without a name");
            }
            if (sectionIndex.put(name, s) != null) {
                throw new LayoutInvariantException("Duplicate section: \"" + name + '"');
            }
            if (section.getRowCount() == 0) {
                throw new LayoutInvariantException("Empty section: \"" + name + '"');
            }
            List<RowIdentity> rows = section.getRows();
            for (int r=0; r<rows.size(); r++) {
                Object id = rows.get(r).getId();
                if (index.put(id, new IndexPath(s, r)) != null) {
                    throw new LayoutInvariantException("Duplicate row identifier: " + id);
                }
            }
        }

        mSections = Collections.unmodifiableList(copy);
        mIndex = index;
        mSectionIndex = sectionIndex;
        mRowCount = index.size();
    }

    public List<LayoutSection> getSections() {
        return mSections;
    }

    public int getSectionCount() {
        return mSections.size();
    }

    public LayoutSection getSection(int index) {
        return mSections.get(index);
    }

    /**
     * Returns the index of the section with the given name, or -1 if none.
     *
     * @param name section name, or null for the ungrouped section
     */
    public int sectionIndexOf(String name) {
        Integer index = mSectionIndex.get(name);
        return index == null ? -1 : index;
    }

    /**
     * Returns the total amount of rows in all sections.
     */
    public int getRowCount() {
        return mRowCount;
    }

    public boolean isEmpty() {
        return mSections.isEmpty();
    }

    /**
     * Returns the row at the given index path, or null if out of range.
     */
    public RowIdentity getRow(IndexPath path) {
        if (path == null || path.getSection() >= mSections.size()) {
            return null;
        }
        LayoutSection section = mSections.get(path.getSection());
        if (path.getRow() >= section.getRowCount()) {
            return null;
        }
        return section.getRow(path.getRow());
    }

    /**
     * Returns the row with the given identifier, or null if not present.
     */
    public RowIdentity findRow(Object id) {
        return getRow(indexPathOf(id));
    }

    /**
     * Returns the index path of the row with the given identifier, or null if
     * not present.
     */
    public IndexPath indexPathOf(Object id) {
        return id == null ? null : mIndex.get(id);
    }

    public boolean contains(Object id) {
        return id != null && mIndex.containsKey(id);
    }

    @Override
    public int hashCode() {
        return mSections.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof Layout) {
            return mSections.equals(((Layout) obj).mSections);
        }
        return false;
    }

    @Override
    public String toString() {
        return "Layout " + mSections;
    }

    private static boolean equal(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }
}
