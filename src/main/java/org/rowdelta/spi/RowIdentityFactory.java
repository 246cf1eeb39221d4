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

package org.rowdelta.spi;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.cojen.util.BeanIntrospector;
import org.cojen.util.BeanProperty;
import org.cojen.util.BeanPropertyAccessor;

import org.rowdelta.FetchRequest;
import org.rowdelta.LayoutInvariantException;
import org.rowdelta.RowIdentity;

/**
 * Derives {@link RowIdentity row identities} from live objects, by reading
 * the identity property, the section name key path, the order-by properties
 * and the tracked properties of a fetch request. Properties are read as bean
 * properties, and dotted names traverse nested beans. A null value anywhere
 * along a dotted name yields null.
 *
 * <p>Instances are immutable and thread-safe.
 *
 * @author RowDelta Authors
 */
public class RowIdentityFactory<S> {
    /**
     * Returns the type of the readable bean property at the given dotted
     * name, or null if unknown or not readable.
     */
    public static Class<?> propertyType(Class<?> type, String name) {
        Map<String, BeanProperty> properties = BeanIntrospector.getAllProperties(type);
        int dotIndex = name.indexOf('.');
        String first = dotIndex < 0 ? name : name.substring(0, dotIndex);
        BeanProperty bp = properties.get(first);
        if (bp == null || bp.getReadMethod() == null) {
            return null;
        }
        if (dotIndex < 0) {
            return bp.getType();
        }
        return propertyType(bp.getType(), name.substring(dotIndex + 1));
    }

    /**
     * Checks that every property used by the request, and the section name
     * key path, name readable properties of the object type. Problems are
     * added to the messages collection.
     *
     * @param sectionNameKeyPath optional section name key path
     */
    public static void errorCheck(FetchRequest<?> request, String sectionNameKeyPath,
                                  Collection<String> messages)
    {
        Class<?> type = request.getObjectType();

        String identity = request.getIdentityProperty();
        if (identity == null) {
            messages.add("identity property is missing");
        } else {
            checkProperty(type, "identity property", identity, messages);
        }

        for (String orderBy : request.getOrderBy()) {
            checkProperty(type, "order-by property", FetchRequest.propertyName(orderBy),
                          messages);
        }

        for (String tracked : request.getTrackedProperties()) {
            checkProperty(type, "tracked property", tracked, messages);
        }

        if (sectionNameKeyPath != null) {
            checkProperty(type, "section name key path", sectionNameKeyPath, messages);
        }
    }

    private static void checkProperty(Class<?> type, String kind, String name,
                                      Collection<String> messages)
    {
        if (propertyType(type, name) == null) {
            messages.add(kind + " \"" + name + "\" is not a readable property of "
                         + type.getName());
        }
    }

    private final Accessor mIdentity;
    private final Accessor mSectionName;
    private final Accessor[] mSort;
    private final Accessor[] mTracked;

    /**
     * @param request request with a valid identity property
     * @param sectionNameKeyPath optional section name key path
     * @throws IllegalArgumentException if any property is not readable
     */
    public RowIdentityFactory(FetchRequest<S> request, String sectionNameKeyPath) {
        Class<S> type = request.getObjectType();
        if (request.getIdentityProperty() == null) {
            throw new IllegalArgumentException("Identity property is missing");
        }
        mIdentity = new Accessor(type, request.getIdentityProperty());
        mSectionName = sectionNameKeyPath == null ? null : new Accessor(type, sectionNameKeyPath);

        List<String> orderBy = request.getOrderBy();
        mSort = new Accessor[orderBy.size()];
        for (int i=0; i<mSort.length; i++) {
            mSort[i] = new Accessor(type, FetchRequest.propertyName(orderBy.get(i)));
        }

        List<String> tracked = request.getTrackedProperties();
        mTracked = new Accessor[tracked.size()];
        for (int i=0; i<mTracked.length; i++) {
            mTracked[i] = new Accessor(type, tracked.get(i));
        }
    }

    /**
     * Returns true if rows are grouped into sections.
     */
    public boolean isGrouped() {
        return mSectionName != null;
    }

    /**
     * Takes a snapshot of the given object.
     *
     * @throws LayoutInvariantException if the identity value is null
     */
    public RowIdentity identify(S obj) {
        Object id = identityOf(obj);

        String sectionName = null;
        if (mSectionName != null) {
            Object value = mSectionName.get(obj);
            sectionName = value == null ? "" : value.toString();
        }

        Object[] sortValues = new Object[mSort.length];
        for (int i=0; i<sortValues.length; i++) {
            sortValues[i] = mSort[i].get(obj);
        }

        Object[] trackedValues = new Object[mTracked.length];
        for (int i=0; i<trackedValues.length; i++) {
            trackedValues[i] = mTracked[i].get(obj);
        }

        return new RowIdentity(id, sectionName, sortValues, trackedValues);
    }

    /**
     * Returns the identity value of the given object.
     *
     * @throws LayoutInvariantException if the identity value is null
     */
    public Object identityOf(S obj) {
        if (obj == null) {
            throw new IllegalArgumentException("Object cannot be null");
        }
        Object id = mIdentity.get(obj);
        if (id == null) {
            throw new LayoutInvariantException
                ("Identity property \"" + mIdentity.mName + "\" is null: " + obj);
        }
        return id;
    }

    /**
     * Reads a dotted property name, one bean at a time.
     */
    private static class Accessor {
        final String mName;
        private final BeanPropertyAccessor[] mChain;
        private final String[] mNames;

        Accessor(Class<?> type, String name) {
            mName = name;
            List<BeanPropertyAccessor> chain = new ArrayList<BeanPropertyAccessor>();
            List<String> names = new ArrayList<String>();
            Class<?> current = type;
            for (String part : name.split("\\.")) {
                Class<?> next = propertyType(current, part);
                if (next == null) {
                    throw new IllegalArgumentException
                        ("Property \"" + name + "\" is not readable from " + type.getName());
                }
                chain.add(BeanPropertyAccessor.forClass(current));
                names.add(part);
                current = next;
            }
            mChain = chain.toArray(new BeanPropertyAccessor[chain.size()]);
            mNames = names.toArray(new String[names.size()]);
        }

        @SuppressWarnings("unchecked")
        Object get(Object bean) {
            Object value = bean;
            for (int i=0; i<mChain.length; i++) {
                if (value == null) {
                    return null;
                }
                value = mChain[i].getPropertyValue(value, mNames[i]);
            }
            return value;
        }
    }
}
