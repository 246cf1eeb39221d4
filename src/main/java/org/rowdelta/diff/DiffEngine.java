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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.rowdelta.IndexPath;
import org.rowdelta.LayoutInvariantException;
import org.rowdelta.RowChange;
import org.rowdelta.RowIdentity;
import org.rowdelta.SectionChange;
import org.rowdelta.layout.Layout;
import org.rowdelta.layout.LayoutSection;
import org.rowdelta.layout.MutableLayout;

/**
 * Computes the section and row changes which transform one layout into
 * another. Every index path is computed against a working copy of the
 * previous layout at the moment the change is emitted, and the change is
 * applied to the copy before the next one is computed. Replaying the changes
 * in order onto the previous layout therefore yields the current one, which
 * is verified at the end of every diff.
 *
 * <p>Sections are diffed first. Surviving sections keep their relative order
 * where possible; the others are deleted in descending index order and
 * inserted in ascending index order. Deleting a section removes its rows,
 * and inserted sections start empty.
 *
 * <p>Rows are diffed next. Rows which no longer exist are deleted. Within each
 * section, the rows which stay and whose sort values did not change are
 * preferred as anchors, and all other rows are moved or inserted next to the
 * row preceding them. Anchors whose state changed are updated last, at their
 * final index paths.
 *
 * <p>Instances are stateless and thread-safe.
 *
 * @author RowDelta Authors
 */
public class DiffEngine {
    private final Log mLog = LogFactory.getLog(getClass());

    public DiffEngine() {
    }

    /**
     * Computes the changes from the previous layout to the current one.
     *
     * @param previous layout the changes apply to
     * @param current layout the changes lead to
     * @param modifiedIds identifiers of rows known to be modified, or null if
     * none; consulted for rows whose previous values are unknown
     * @throws LayoutInvariantException if the computed changes fail to
     * reproduce the current layout
     */
    public ChangeSet diff(Layout previous, Layout current, Set<?> modifiedIds) {
        if (previous == null || current == null) {
            throw new IllegalArgumentException("Layouts cannot be null");
        }
        if (modifiedIds == null) {
            modifiedIds = Collections.emptySet();
        }

        MutableLayout cursor = new MutableLayout(previous);
        List<SectionChange> sectionChanges = new ArrayList<SectionChange>();
        List<RowChange> rowChanges = new ArrayList<RowChange>();

        diffSections(previous, current, cursor, sectionChanges);
        diffRows(previous, current, modifiedIds, cursor, rowChanges);

        Layout result;
        try {
            result = cursor.toLayout();
        } catch (LayoutInvariantException e) {
            throw new LayoutInvariantException("Changes do not produce a valid layout", e);
        }
        if (!result.equals(current)) {
            throw new LayoutInvariantException
                ("Changes produce " + result + " instead of " + current);
        }

        ChangeSet changes = new ChangeSet(sectionChanges, rowChanges, current);

        if (mLog.isDebugEnabled()) {
            mLog.debug("Diff of " + previous.getRowCount() + " to " + current.getRowCount()
                       + " rows: " + sectionChanges.size() + " section changes, "
                       + rowChanges.size() + " row changes");
        }

        return changes;
    }

    private void diffSections(Layout previous, Layout current, MutableLayout cursor,
                              List<SectionChange> changes)
    {
        // Survivors in new order, keyed by old index.
        List<Integer> survivorNewIndexes = new ArrayList<Integer>();
        List<Integer> survivorOldIndexes = new ArrayList<Integer>();
        for (int s=0; s<current.getSectionCount(); s++) {
            int oldIndex = previous.sectionIndexOf(current.getSection(s).getName());
            if (oldIndex >= 0) {
                survivorNewIndexes.add(s);
                survivorOldIndexes.add(oldIndex);
            }
        }

        int count = survivorOldIndexes.size();
        int[] keys = new int[count];
        long[] weights = new long[count];
        for (int i=0; i<count; i++) {
            keys[i] = survivorOldIndexes.get(i);
            weights[i] = 1;
        }
        boolean[] retained = WeightedSequence.select(keys, weights, previous.getSectionCount());

        Set<String> retainedNames = new HashSet<String>();
        for (int i=0; i<count; i++) {
            if (retained[i]) {
                retainedNames.add(current.getSection(survivorNewIndexes.get(i)).getName());
            }
        }

        for (int s=previous.getSectionCount(); --s>=0; ) {
            if (!retainedNames.contains(previous.getSection(s).getName())) {
                LayoutSection deleted = cursor.applySectionDelete(s);
                changes.add(new SectionChange.Delete(deleted, s));
            }
        }

        for (int s=0; s<current.getSectionCount(); s++) {
            LayoutSection section = current.getSection(s);
            if (!retainedNames.contains(section.getName())) {
                cursor.applySectionInsert(section.getName(), s);
                changes.add(new SectionChange.Insert(section, s));
            }
        }
    }

    private void diffRows(Layout previous, Layout current, Set<?> modifiedIds,
                          MutableLayout cursor, List<RowChange> changes)
    {
        // Sections of the cursor now line up with those of the current layout.

        for (int s=0; s<cursor.getSectionCount(); s++) {
            for (int r=cursor.getRowCount(s); --r>=0; ) {
                IndexPath path = new IndexPath(s, r);
                RowIdentity row = cursor.getRow(path);
                if (!current.contains(row.getId())) {
                    cursor.applyRowDelete(path);
                    changes.add(new RowChange.Delete(row, path));
                }
            }
        }

        Set<Object> anchors = selectAnchors(previous, current, modifiedIds, cursor);

        List<RowIdentity> updates = new ArrayList<RowIdentity>();

        for (int s=0; s<current.getSectionCount(); s++) {
            RowIdentity predecessor = null;
            for (RowIdentity row : current.getSection(s).getRows()) {
                Object id = row.getId();
                if (anchors.contains(id)) {
                    if (isUpdated(previous.findRow(id), row, modifiedIds)) {
                        updates.add(row);
                    }
                } else {
                    IndexPath from = cursor.indexPathOf(id);
                    if (from != null) {
                        cursor.applyRowDelete(from);
                        IndexPath to = insertionPath(cursor, s, predecessor);
                        cursor.applyRowInsert(row, to);
                        changes.add(new RowChange.Move(row, from, to));
                    } else {
                        IndexPath to = insertionPath(cursor, s, predecessor);
                        cursor.applyRowInsert(row, to);
                        changes.add(new RowChange.Insert(row, to));
                    }
                }
                predecessor = row;
            }
        }

        for (RowIdentity row : updates) {
            IndexPath path = cursor.indexPathOf(row.getId());
            cursor.applyRowUpdate(row, path);
            changes.add(new RowChange.Update(row, path));
        }
    }

    /**
     * Returns the identifiers of rows which keep their place. Within each
     * section, candidates are the rows which stay in it. A row whose sort
     * values did not change outweighs all rows of the section whose sort
     * values changed.
     */
    private Set<Object> selectAnchors(Layout previous, Layout current, Set<?> modifiedIds,
                                      MutableLayout cursor)
    {
        Set<Object> anchors = new HashSet<Object>();

        for (int s=0; s<cursor.getSectionCount(); s++) {
            LayoutSection target = current.getSection(s);
            int rowCount = cursor.getRowCount(s);

            List<RowIdentity> candidates = new ArrayList<RowIdentity>(rowCount);
            List<Integer> newIndexes = new ArrayList<Integer>(rowCount);
            for (int r=0; r<rowCount; r++) {
                RowIdentity row = cursor.getRow(new IndexPath(s, r));
                IndexPath newPath = current.indexPathOf(row.getId());
                if (newPath != null && newPath.getSection() == s) {
                    candidates.add(row);
                    newIndexes.add(newPath.getRow());
                }
            }

            int count = candidates.size();
            int[] keys = new int[count];
            long[] weights = new long[count];
            for (int i=0; i<count; i++) {
                RowIdentity row = candidates.get(i);
                keys[i] = newIndexes.get(i);
                RowIdentity newer = target.getRow(keys[i]);
                weights[i] = isSortChanged(previous.findRow(row.getId()), newer, modifiedIds)
                    ? 1 : (rowCount + 1);
            }

            boolean[] selected = WeightedSequence.select(keys, weights, target.getRowCount());
            for (int i=0; i<count; i++) {
                if (selected[i]) {
                    anchors.add(candidates.get(i).getId());
                }
            }
        }

        return anchors;
    }

    private static IndexPath insertionPath(MutableLayout cursor, int section,
                                           RowIdentity predecessor)
    {
        if (predecessor == null) {
            return new IndexPath(section, 0);
        }
        IndexPath path = cursor.indexPathOf(predecessor.getId());
        if (path == null || path.getSection() != section) {
            throw new LayoutInvariantException("Predecessor is not in place: " + predecessor);
        }
        return new IndexPath(section, path.getRow() + 1);
    }

    private static boolean isSortChanged(RowIdentity older, RowIdentity newer,
                                         Set<?> modifiedIds)
    {
        if (older == null) {
            return true;
        }
        if (!older.hasKnownValues() || !newer.hasKnownValues()) {
            return modifiedIds.contains(older.getId());
        }
        return older.isSortChanged(newer);
    }

    private static boolean isUpdated(RowIdentity older, RowIdentity newer, Set<?> modifiedIds) {
        if (older == null) {
            return false;
        }
        return modifiedIds.contains(older.getId())
            || older.isSortChanged(newer)
            || older.isTrackedChanged(newer);
    }
}
