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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable description of the query a {@link FetchedResultsController} is
 * bound to. Methods which refine the request return a new instance.
 *
 * <pre>
 * FetchRequest&lt;Contact&gt; request = FetchRequest.forType(Contact.class, "id")
 *     .filter("active = ?", true)
 *     .orderBy("group", "-rank", "name")
 *     .track("note");
 * </pre>
 *
 * <p>Order-by properties may be prefixed with '+' or '-' to indicate
 * ascending or descending order. If the prefix is omitted, ascending order is
 * assumed. Dotted names address properties of nested beans.
 *
 * <p>The filter expression is opaque to the controller: it is passed to the
 * {@link QueryEngine} as-is.
 *
 * @author RowDelta Authors
 */
public final class FetchRequest<S> {
    private static final String[] NO_STRINGS = new String[0];
    private static final Object[] NO_VALUES = new Object[0];

    /**
     * @param type type of fetched objects
     * @param identityProperty property which stably identifies each object
     */
    public static <S> FetchRequest<S> forType(Class<S> type, String identityProperty) {
        if (type == null) {
            throw new IllegalArgumentException("Object type cannot be null");
        }
        return new FetchRequest<S>(type, identityProperty, null, NO_VALUES,
                                   NO_STRINGS, NO_STRINGS);
    }

    /**
     * Returns the property name of an order-by property, without its
     * direction prefix.
     */
    public static String propertyName(String orderBy) {
        if (orderBy.startsWith("+") || orderBy.startsWith("-")) {
            return orderBy.substring(1);
        }
        return orderBy;
    }

    /**
     * Returns true if the order-by property has a '-' prefix.
     */
    public static boolean isDescending(String orderBy) {
        return orderBy.startsWith("-");
    }

    private final Class<S> mType;
    private final String mIdentityProperty;
    private final String mFilter;
    private final Object[] mFilterValues;
    private final String[] mOrderBy;
    private final String[] mTracked;

    private FetchRequest(Class<S> type, String identityProperty,
                         String filter, Object[] filterValues,
                         String[] orderBy, String[] tracked)
    {
        mType = type;
        mIdentityProperty = identityProperty;
        mFilter = filter;
        mFilterValues = filterValues;
        mOrderBy = orderBy;
        mTracked = tracked;
    }

    /**
     * Returns a request with the given filter expression, replacing any
     * existing filter.
     *
     * @param filter query engine filter expression, or null for all objects
     * @param values values for the filter's parameters
     */
    public FetchRequest<S> filter(String filter, Object... values) {
        return new FetchRequest<S>(mType, mIdentityProperty, filter,
                                   values == null ? NO_VALUES : values.clone(),
                                   mOrderBy, mTracked);
    }

    /**
     * Returns a request ordered by the given properties, replacing any
     * existing ordering.
     */
    public FetchRequest<S> orderBy(String... properties) {
        return new FetchRequest<S>(mType, mIdentityProperty, mFilter, mFilterValues,
                                   checkNames(properties), mTracked);
    }

    /**
     * Returns a request which also tracks the given non-sort properties.
     * Changes to tracked properties are reported as row updates.
     */
    public FetchRequest<S> track(String... properties) {
        List<String> tracked = new ArrayList<String>(Arrays.asList(mTracked));
        for (String property : checkNames(properties)) {
            if (!tracked.contains(property)) {
                tracked.add(property);
            }
        }
        return new FetchRequest<S>(mType, mIdentityProperty, mFilter, mFilterValues,
                                   mOrderBy, tracked.toArray(new String[tracked.size()]));
    }

    public Class<S> getObjectType() {
        return mType;
    }

    public String getIdentityProperty() {
        return mIdentityProperty;
    }

    /**
     * Returns the filter expression, or null if all objects match.
     */
    public String getFilter() {
        return mFilter;
    }

    public Object[] getFilterValues() {
        return mFilterValues.clone();
    }

    /**
     * Returns the order-by properties, with their direction prefixes.
     */
    public List<String> getOrderBy() {
        return Collections.unmodifiableList(Arrays.asList(mOrderBy));
    }

    public List<String> getTrackedProperties() {
        return Collections.unmodifiableList(Arrays.asList(mTracked));
    }

    @Override
    public int hashCode() {
        int hash = mType.hashCode();
        hash = hash * 31 + (mIdentityProperty == null ? 0 : mIdentityProperty.hashCode());
        hash = hash * 31 + (mFilter == null ? 0 : mFilter.hashCode());
        hash = hash * 31 + Arrays.hashCode(mFilterValues);
        hash = hash * 31 + Arrays.hashCode(mOrderBy);
        return hash * 31 + Arrays.hashCode(mTracked);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FetchRequest)) {
            return false;
        }
        FetchRequest<?> other = (FetchRequest<?>) obj;
        return mType == other.mType
            && equal(mIdentityProperty, other.mIdentityProperty)
            && equal(mFilter, other.mFilter)
            && Arrays.equals(mFilterValues, other.mFilterValues)
            && Arrays.equals(mOrderBy, other.mOrderBy)
            && Arrays.equals(mTracked, other.mTracked);
    }

    /**
     * Returns a canonical description of this request. Two requests with the
     * same description fetch the same results in the same order.
     */
    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append("FetchRequest {type=").append(mType.getName());
        b.append(", identity=").append(mIdentityProperty);
        if (mFilter != null) {
            b.append(", filter=\"").append(mFilter).append('"');
            if (mFilterValues.length > 0) {
                b.append(", values=").append(Arrays.deepToString(mFilterValues));
            }
        }
        b.append(", orderBy=").append(Arrays.toString(mOrderBy));
        if (mTracked.length > 0) {
            b.append(", track=").append(Arrays.toString(mTracked));
        }
        return b.append('}').toString();
    }

    private static boolean equal(Object a, Object b) {
        return a == null ? b == null : a.equals(b);
    }

    private static String[] checkNames(String[] properties) {
        if (properties == null) {
            return NO_STRINGS;
        }
        for (String property : properties) {
            if (property == null || propertyName(property).length() == 0) {
                throw new IllegalArgumentException("Blank property name");
            }
        }
        return properties.clone();
    }
}
