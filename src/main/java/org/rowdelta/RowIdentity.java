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

import java.util.Arrays;

/**
 * Immutable snapshot of one fetched object: its stable identifier, the name
 * of the section it belongs to, and the values of the properties used for
 * sorting and for change tracking. Row identities are safe to pass between
 * threads, unlike the live objects they were derived from.
 *
 * <p>Equality is by identifier alone. Use {@link #isSortChanged} and {@link
 * #isTrackedChanged} to find out whether a newer snapshot of the same object
 * differs.
 *
 * <p>Identities restored from a persisted layout carry only the identifier
 * and section name. Their values are unknown, and {@link #hasKnownValues}
 * returns false.
 *
 * @see org.rowdelta.spi.RowIdentityFactory
 * @author RowDelta Authors
 */
public final class RowIdentity {
    /**
     * Returns an identity with unknown sort and tracked values, as restored
     * from a persisted layout.
     *
     * @param sectionName section name, or null if results are not grouped
     */
    public static RowIdentity restored(Object id, String sectionName) {
        return new RowIdentity(id, sectionName, null, null);
    }

    private final Object mId;
    private final String mSectionName;
    private final Object[] mSortValues;
    private final Object[] mTrackedValues;

    /**
     * @param id stable identifier, never null
     * @param sectionName section name, or null if results are not grouped
     * @param sortValues values of the sort properties in order, or null if unknown
     * @param trackedValues values of the tracked properties in order, or null if unknown
     * @throws IllegalArgumentException if id is null
     */
    public RowIdentity(Object id, String sectionName, Object[] sortValues, Object[] trackedValues) {
        if (id == null) {
            throw new IllegalArgumentException("Row identifier cannot be null");
        }
        mId = id;
        mSectionName = sectionName;
        mSortValues = sortValues == null ? null : sortValues.clone();
        mTrackedValues = trackedValues == null ? null : trackedValues.clone();
    }

    public Object getId() {
        return mId;
    }

    /**
     * Returns the section name, or null if results are not grouped.
     */
    public String getSectionName() {
        return mSectionName;
    }

    /**
     * Returns a copy of the sort property values, or null if unknown.
     */
    public Object[] getSortValues() {
        return mSortValues == null ? null : mSortValues.clone();
    }

    /**
     * Returns a copy of the tracked property values, or null if unknown.
     */
    public Object[] getTrackedValues() {
        return mTrackedValues == null ? null : mTrackedValues.clone();
    }

    public boolean hasKnownValues() {
        return mSortValues != null;
    }

    /**
     * Returns true if both identities have known values and any sort value
     * differs.
     */
    public boolean isSortChanged(RowIdentity newer) {
        if (mSortValues == null || newer.mSortValues == null) {
            return false;
        }
        return !Arrays.equals(mSortValues, newer.mSortValues);
    }

    /**
     * Returns true if both identities have known values and any tracked value
     * differs.
     */
    public boolean isTrackedChanged(RowIdentity newer) {
        if (mTrackedValues == null || newer.mTrackedValues == null) {
            return false;
        }
        return !Arrays.equals(mTrackedValues, newer.mTrackedValues);
    }

    /**
     * Returns true if the given identity has the same identifier and section,
     * and equal known values.
     */
    public boolean isSameSnapshot(RowIdentity other) {
        return mId.equals(other.mId)
            && (mSectionName == null ? other.mSectionName == null
                : mSectionName.equals(other.mSectionName))
            && Arrays.equals(mSortValues, other.mSortValues)
            && Arrays.equals(mTrackedValues, other.mTrackedValues);
    }

    @Override
    public int hashCode() {
        return mId.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof RowIdentity) {
            return mId.equals(((RowIdentity) obj).mId);
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append("RowIdentity {id=").append(mId);
        if (mSectionName != null) {
            b.append(", section=").append(mSectionName);
        }
        if (mSortValues != null) {
            b.append(", sort=").append(Arrays.toString(mSortValues));
        }
        if (mTrackedValues != null && mTrackedValues.length > 0) {
            b.append(", tracked=").append(Arrays.toString(mTrackedValues));
        }
        return b.append('}').toString();
    }
}
