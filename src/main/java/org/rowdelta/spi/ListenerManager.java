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

import java.lang.reflect.Method;

import java.util.ArrayList;
import java.util.Arrays;

import org.rowdelta.ChangeListener;
import org.rowdelta.FetchedResultsController;
import org.rowdelta.RowChange;
import org.rowdelta.SectionChange;

/**
 * Used by controllers to manage listeners and consolidate them into a single
 * logical listener. Each callback is only dispatched to the listeners which
 * override it. This class is thread-safe, and changes to the listener set do
 * not affect a dispatch in progress.
 *
 * @author RowDelta Authors
 */
public class ListenerManager<S> extends ChangeListener<S> {
    // Bit masks returned by selectTypes.
    private static final int FOR_WILL_CHANGE = 1;
    private static final int FOR_SECTION = 2;
    private static final int FOR_OBJECT = 4;
    private static final int FOR_DID_CHANGE = 8;

    private static final Method
        WILL_CHANGE_CONTENT_METHOD,
        DID_CHANGE_SECTION_METHOD,
        DID_CHANGE_OBJECT_METHOD,
        DID_CHANGE_CONTENT_METHOD;

    static {
        Class<?> listenerClass = ChangeListener.class;
        Class[] ONE_PARAM = {FetchedResultsController.class};

        try {
            WILL_CHANGE_CONTENT_METHOD = listenerClass.getMethod("willChangeContent", ONE_PARAM);
            DID_CHANGE_SECTION_METHOD  = listenerClass.getMethod
                ("didChangeSection", FetchedResultsController.class, SectionChange.class);
            DID_CHANGE_OBJECT_METHOD   = listenerClass.getMethod
                ("didChangeObject", FetchedResultsController.class, RowChange.class);
            DID_CHANGE_CONTENT_METHOD  = listenerClass.getMethod("didChangeContent", ONE_PARAM);
        } catch (NoSuchMethodException e) {
            Error error = new NoSuchMethodError();
            error.initCause(e);
            throw error;
        }
    }

    private static final ChangeListener[] NO_LISTENERS = new ChangeListener[0];

    private final Object mLock = new Object();

    private volatile ChangeListener<? super S>[] mAll;
    private volatile ChangeListener<? super S>[] mForWillChange;
    private volatile ChangeListener<? super S>[] mForSection;
    private volatile ChangeListener<? super S>[] mForObject;
    private volatile ChangeListener<? super S>[] mForDidChange;

    @SuppressWarnings("unchecked")
    public ListenerManager() {
        mAll = mForWillChange = mForSection = mForObject = mForDidChange = NO_LISTENERS;
    }

    /**
     * @return false if the listener was already registered
     */
    public boolean addListener(ChangeListener<? super S> listener) {
        if (listener == null) {
            throw new IllegalArgumentException();
        }

        synchronized (mLock) {
            ChangeListener<? super S>[] all = add(mAll, listener);
            if (all == null) {
                return false;
            }
            mAll = all;

            int types = selectTypes(listener);

            if ((types & FOR_WILL_CHANGE) != 0) {
                mForWillChange = add(mForWillChange, listener);
            }
            if ((types & FOR_SECTION) != 0) {
                mForSection = add(mForSection, listener);
            }
            if ((types & FOR_OBJECT) != 0) {
                mForObject = add(mForObject, listener);
            }
            if ((types & FOR_DID_CHANGE) != 0) {
                mForDidChange = add(mForDidChange, listener);
            }
        }

        return true;
    }

    /**
     * @return false if the listener was not registered
     */
    public boolean removeListener(ChangeListener<? super S> listener) {
        if (listener == null) {
            throw new IllegalArgumentException();
        }

        synchronized (mLock) {
            ChangeListener<? super S>[] all = remove(mAll, listener);
            if (all == null) {
                return false;
            }
            mAll = all;

            ChangeListener<? super S>[] list;
            if ((list = remove(mForWillChange, listener)) != null) {
                mForWillChange = list;
            }
            if ((list = remove(mForSection, listener)) != null) {
                mForSection = list;
            }
            if ((list = remove(mForObject, listener)) != null) {
                mForObject = list;
            }
            if ((list = remove(mForDidChange, listener)) != null) {
                mForDidChange = list;
            }
        }

        return true;
    }

    /**
     * Unregisters all listeners.
     */
    @SuppressWarnings("unchecked")
    public void removeAllListeners() {
        synchronized (mLock) {
            mAll = mForWillChange = mForSection = mForObject = mForDidChange = NO_LISTENERS;
        }
    }

    public boolean isEmpty() {
        return mAll.length == 0;
    }

    public int size() {
        return mAll.length;
    }

    /**
     * Returns true if any registered listener is interested in individual
     * section or row changes. If not, computing them can be skipped.
     */
    public boolean isTrackingChanges() {
        return mForSection.length > 0 || mForObject.length > 0;
    }

    @Override
    public void willChangeContent(FetchedResultsController<? extends S> controller) {
        ChangeListener<? super S>[] listeners = mForWillChange;
        for (int i=0; i<listeners.length; i++) {
            listeners[i].willChangeContent(controller);
        }
    }

    @Override
    public void didChangeSection(FetchedResultsController<? extends S> controller,
                                 SectionChange change)
    {
        ChangeListener<? super S>[] listeners = mForSection;
        for (int i=0; i<listeners.length; i++) {
            listeners[i].didChangeSection(controller, change);
        }
    }

    @Override
    public void didChangeObject(FetchedResultsController<? extends S> controller,
                                RowChange change)
    {
        ChangeListener<? super S>[] listeners = mForObject;
        for (int i=0; i<listeners.length; i++) {
            listeners[i].didChangeObject(controller, change);
        }
    }

    @Override
    public void didChangeContent(FetchedResultsController<? extends S> controller) {
        ChangeListener<? super S>[] listeners = mForDidChange;
        for (int i=0; i<listeners.length; i++) {
            listeners[i].didChangeContent(controller);
        }
    }

    /**
     * Determines which callbacks the given listener overrides.
     */
    private int selectTypes(ChangeListener<? super S> listener) {
        Class<? extends ChangeListener> listenerClass = listener.getClass();

        int types = 0;

        if (overridesMethod(listenerClass, WILL_CHANGE_CONTENT_METHOD)) {
            types |= FOR_WILL_CHANGE;
        }
        if (overridesMethod(listenerClass, DID_CHANGE_SECTION_METHOD)) {
            types |= FOR_SECTION;
        }
        if (overridesMethod(listenerClass, DID_CHANGE_OBJECT_METHOD)) {
            types |= FOR_OBJECT;
        }
        if (overridesMethod(listenerClass, DID_CHANGE_CONTENT_METHOD)) {
            types |= FOR_DID_CHANGE;
        }

        return types;
    }

    private boolean overridesMethod(Class<? extends ChangeListener> listenerClass,
                                    Method method)
    {
        try {
            return !method.equals(listenerClass.getMethod(method.getName(),
                                                          method.getParameterTypes()));
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    @SuppressWarnings("unchecked")
    private static <S> ChangeListener<? super S>[] add(ChangeListener<? super S>[] listeners,
                                                       ChangeListener<? super S> listener)
    {
        ArrayList<ChangeListener<? super S>> list =
            new ArrayList<ChangeListener<? super S>>(Arrays.asList(listeners));
        if (list.contains(listener)) {
            return null;
        }
        list.add(listener);
        return list.toArray(new ChangeListener[list.size()]);
    }

    @SuppressWarnings("unchecked")
    private static <S> ChangeListener<? super S>[] remove(ChangeListener<? super S>[] listeners,
                                                          ChangeListener<? super S> listener)
    {
        ArrayList<ChangeListener<? super S>> list =
            new ArrayList<ChangeListener<? super S>>(Arrays.asList(listeners));
        if (!list.remove(listener)) {
            return null;
        }
        return list.toArray(new ChangeListener[list.size()]);
    }
}
