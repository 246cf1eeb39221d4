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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.rowdelta.ChangeEvent;
import org.rowdelta.ChangeVisitor;
import org.rowdelta.IndexPath;
import org.rowdelta.LayoutInvariantException;
import org.rowdelta.RowChange;
import org.rowdelta.RowIdentity;
import org.rowdelta.SectionChange;

/**
 * Mutable working copy of a {@link Layout}, addressed by index paths. The
 * diff engine computes the index path of each event against one of these at
 * the moment the event is emitted, and applies the event before computing the
 * next. A consumer mirroring a presentation can replay the same events with
 * {@link #apply} and arrive at the same layout.
 *
 * <p>Empty sections are allowed while editing. {@link #toLayout} rejects them.
 *
 * <p>Instances are not thread-safe.
 *
 * @author RowDelta Authors
 */
public class MutableLayout {
    private final RankedList<Section> mSections;
    private final Map<String, Section> mSectionsByName;
    private final Map<Object, Placement> mPlacements;

    public MutableLayout() {
        mSections = new RankedList<Section>();
        mSectionsByName = new HashMap<String, Section>();
        mPlacements = new HashMap<Object, Placement>();
    }

    public MutableLayout(Layout layout) {
        this();
        for (LayoutSection source : layout.getSections()) {
            Section section = addSection(source.getName(), mSections.size());
            for (RowIdentity row : source.getRows()) {
                addRow(section, row, section.mRows.size());
            }
        }
    }

    public int getSectionCount() {
        return mSections.size();
    }

    public String getSectionName(int section) {
        return mSections.get(section).mName;
    }

    public int getRowCount(int section) {
        return mSections.get(section).mRows.size();
    }

    /**
     * Returns the index of the section with the given name, or -1 if none.
     */
    public int sectionIndexOf(String name) {
        Section section = mSectionsByName.get(name);
        return section == null ? -1 : mSections.indexOf(section.mNode);
    }

    /**
     * @throws IndexOutOfBoundsException if the path does not address a row
     */
    public RowIdentity getRow(IndexPath path) {
        return mSections.get(path.getSection()).mRows.get(path.getRow());
    }

    public boolean contains(Object id) {
        return mPlacements.containsKey(id);
    }

    /**
     * Returns the current index path of the row with the given identifier, or
     * null if not present.
     */
    public IndexPath indexPathOf(Object id) {
        Placement placement = mPlacements.get(id);
        if (placement == null) {
            return null;
        }
        Section section = placement.mSection;
        return new IndexPath(mSections.indexOf(section.mNode),
                             section.mRows.indexOf(placement.mNode));
    }

    /**
     * Inserts a new, empty section.
     *
     * @throws LayoutInvariantException if a section with the same name exists
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public void applySectionInsert(String name, int index) {
        if (mSectionsByName.containsKey(name)) {
            throw new LayoutInvariantException("Section already exists: \"" + name + '"');
        }
        addSection(name, index);
    }

    /**
     * Removes a section along with all of its rows.
     *
     * @return the removed section
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public LayoutSection applySectionDelete(int index) {
        Section section = mSections.remove(index);
        mSectionsByName.remove(section.mName);
        List<RowIdentity> rows = section.mRows.toList();
        for (RowIdentity row : rows) {
            mPlacements.remove(row.getId());
        }
        return new LayoutSection(section.mName, rows);
    }

    /**
     * @throws LayoutInvariantException if a row with the same identifier exists
     * @throws IndexOutOfBoundsException if the path is out of range
     */
    public void applyRowInsert(RowIdentity row, IndexPath path) {
        if (mPlacements.containsKey(row.getId())) {
            throw new LayoutInvariantException("Duplicate row identifier: " + row.getId());
        }
        addRow(mSections.get(path.getSection()), row, path.getRow());
    }

    /**
     * @return the removed row
     * @throws IndexOutOfBoundsException if the path does not address a row
     */
    public RowIdentity applyRowDelete(IndexPath path) {
        RowIdentity row = mSections.get(path.getSection()).mRows.remove(path.getRow());
        mPlacements.remove(row.getId());
        return row;
    }

    /**
     * Removes the row at the source path, then inserts it at the destination
     * path, which is addressed as if the row had already been removed.
     *
     * @return the moved row
     */
    public RowIdentity applyRowMove(IndexPath from, IndexPath to) {
        return applyRowMove(from, to, null);
    }

    /**
     * Moves a row like {@link #applyRowMove(IndexPath, IndexPath)}, replacing
     * it with a newer snapshot.
     *
     * @param replacement newer snapshot of the moved row, or null to keep the
     * existing one
     * @return the row now at the destination
     * @throws LayoutInvariantException if the replacement has another identifier
     */
    public RowIdentity applyRowMove(IndexPath from, IndexPath to, RowIdentity replacement) {
        RowIdentity row = getRow(from);
        if (replacement != null && !replacement.equals(row)) {
            throw new LayoutInvariantException
                ("Moved row " + row.getId() + " cannot become " + replacement.getId());
        }
        applyRowDelete(from);
        row = replacement == null ? row : replacement;
        applyRowInsert(row, to);
        return row;
    }

    /**
     * Replaces the row at the given path with a newer snapshot of it.
     *
     * @throws LayoutInvariantException if the identifiers differ
     */
    public void applyRowUpdate(RowIdentity row, IndexPath path) {
        RankedList.Node<RowIdentity> node =
            mSections.get(path.getSection()).mRows.nodeAt(path.getRow());
        RowIdentity existing = node.getValue();
        if (!existing.equals(row)) {
            throw new LayoutInvariantException
                ("Row at " + path + " is " + existing.getId() + ", not " + row.getId());
        }
        node.mValue = row;
    }

    /**
     * Applies one change event. Inserted sections start empty: their rows
     * arrive as row inserts of the same batch.
     */
    public void apply(ChangeEvent event) {
        event.accept(Applier.THE, this);
    }

    /**
     * Applies all events in order.
     */
    public void applyAll(Iterable<? extends ChangeEvent> events) {
        for (ChangeEvent event : events) {
            apply(event);
        }
    }

    /**
     * Returns an immutable copy of this layout.
     *
     * @throws LayoutInvariantException if a section is empty
     */
    public Layout toLayout() {
        if (mSections.size() == 0) {
            return Layout.EMPTY;
        }
        List<LayoutSection> sections = new ArrayList<LayoutSection>(mSections.size());
        for (Section section : mSections.toList()) {
            sections.add(new LayoutSection(section.mName, section.mRows.toList()));
        }
        return new Layout(sections);
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("MutableLayout [");
        List<Section> sections = mSections.toList();
        for (int i=0; i<sections.size(); i++) {
            if (i > 0) {
                b.append(", ");
            }
            Section section = sections.get(i);
            b.append(new LayoutSection(section.mName, section.mRows.toList()));
        }
        return b.append(']').toString();
    }

    private Section addSection(String name, int index) {
        Section section = new Section(name);
        section.mNode = mSections.insert(index, section);
        mSectionsByName.put(name, section);
        return section;
    }

    private void addRow(Section section, RowIdentity row, int index) {
        RankedList.Node<RowIdentity> node = section.mRows.insert(index, row);
        mPlacements.put(row.getId(), new Placement(section, node));
    }

    private static class Section {
        final String mName;
        final RankedList<RowIdentity> mRows;
        RankedList.Node<Section> mNode;

        Section(String name) {
            mName = name;
            mRows = new RankedList<RowIdentity>();
        }
    }

    /**
     * Where a row currently lives.
     */
    private static class Placement {
        final Section mSection;
        final RankedList.Node<RowIdentity> mNode;

        Placement(Section section, RankedList.Node<RowIdentity> node) {
            mSection = section;
            mNode = node;
        }
    }

    private static class Applier extends ChangeVisitor<Void, MutableLayout> {
        static final Applier THE = new Applier();

        @Override
        public Void visit(SectionChange.Insert change, MutableLayout layout) {
            layout.applySectionInsert(change.getSectionName(), change.getIndex());
            return null;
        }

        @Override
        public Void visit(SectionChange.Delete change, MutableLayout layout) {
            layout.applySectionDelete(change.getIndex());
            return null;
        }

        @Override
        public Void visit(RowChange.Insert change, MutableLayout layout) {
            layout.applyRowInsert(change.getRow(), change.getIndexPath());
            return null;
        }

        @Override
        public Void visit(RowChange.Delete change, MutableLayout layout) {
            layout.applyRowDelete(change.getIndexPath());
            return null;
        }

        @Override
        public Void visit(RowChange.Move change, MutableLayout layout) {
            layout.applyRowMove(change.getFromIndexPath(), change.getToIndexPath(),
                                change.getRow());
            return null;
        }

        @Override
        public Void visit(RowChange.Update change, MutableLayout layout) {
            layout.applyRowUpdate(change.getRow(), change.getIndexPath());
            return null;
        }
    }
}
