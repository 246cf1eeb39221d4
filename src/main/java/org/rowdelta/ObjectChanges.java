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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Immutable batch of raw object-level changes, as reported by a {@link
 * QueryEngine}. Objects are live references; removed objects may no longer be
 * readable.
 *
 * @author RowDelta Authors
 */
public final class ObjectChanges<S> {
    private final List<S> mAdded;
    private final List<S> mRemoved;
    private final List<S> mModified;

    /**
     * @param added objects added to the store, or null if none
     * @param removed objects removed from the store, or null if none
     * @param modified objects whose fields were modified, or null if none
     */
    public ObjectChanges(Collection<? extends S> added,
                         Collection<? extends S> removed,
                         Collection<? extends S> modified)
    {
        mAdded = copy(added);
        mRemoved = copy(removed);
        mModified = copy(modified);
    }

    public List<S> getAdded() {
        return mAdded;
    }

    public List<S> getRemoved() {
        return mRemoved;
    }

    public List<S> getModified() {
        return mModified;
    }

    public boolean isEmpty() {
        return mAdded.isEmpty() && mRemoved.isEmpty() && mModified.isEmpty();
    }

    /**
     * Returns a batch holding the changes of this batch followed by those of
     * the given one.
     */
    public ObjectChanges<S> merge(ObjectChanges<S> next) {
        if (next == null || next.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return next;
        }
        return new ObjectChanges<S>(concat(mAdded, next.mAdded),
                                    concat(mRemoved, next.mRemoved),
                                    concat(mModified, next.mModified));
    }

    @Override
    public String toString() {
        return "ObjectChanges {added=" + mAdded.size() + ", removed=" + mRemoved.size()
            + ", modified=" + mModified.size() + '}';
    }

    private static <S> List<S> copy(Collection<? extends S> c) {
        if (c == null || c.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<S>(c));
    }

    private static <S> List<S> concat(List<S> a, List<S> b) {
        List<S> list = new ArrayList<S>(a.size() + b.size());
        list.addAll(a);
        list.addAll(b);
        return list;
    }
}
