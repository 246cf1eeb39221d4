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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.rowdelta.cache.LayoutCache;
import org.rowdelta.cache.LayoutStore;
import org.rowdelta.cursor.TransformedCursor;
import org.rowdelta.diff.ChangeSet;
import org.rowdelta.diff.DiffEngine;
import org.rowdelta.layout.Layout;
import org.rowdelta.layout.LayoutSection;
import org.rowdelta.spi.ListenerManager;
import org.rowdelta.spi.RowIdentityFactory;

/**
 * Presents the results of a fetch request as ordered sections of rows, and
 * reports how they change as the underlying store changes. Instances are
 * created by a {@link FetchedResultsControllerBuilder}.
 *
 * <p>After a successful {@link #performFetch}, the controller subscribes to
 * the query engine. For every batch of changes the engine reports, the
 * request is executed again, the new results are compared against the cached
 * layout, and the differences are reported to the registered {@link
 * ChangeListener listeners}. Batches which arrive while one is being
 * processed are coalesced and processed next, so the changes of two batches
 * are never reported interleaved.
 *
 * <p>A controller is meant to be driven by one owning thread, or by the
 * executor it was built with. Methods are synchronized, so other threads can
 * safely call read accessors, but they may observe the layout between
 * batches.
 *
 * @see ChangeListener
 * @author RowDelta Authors
 */
public class FetchedResultsController<S> {
    /**
     * Deletes the cached layout stored under the given name, or all cached
     * layouts of the store if name is null. Deleting a layout which does not
     * exist does nothing.
     *
     * @throws CacheInUseException if a controller still uses the cache
     * @throws CacheIOException if the layout cannot be deleted
     */
    public static void deleteCacheWithName(LayoutStore store, String name)
        throws CacheIOException
    {
        if (store == null) {
            throw new IllegalArgumentException("Layout store cannot be null");
        }
        store.delete(name);
    }

    private final Log mLog = LogFactory.getLog(getClass());

    private final QueryEngine<S> mEngine;
    private final FetchRequest<S> mRequest;
    private final String mSectionNameKeyPath;
    private final String mCacheName;
    private final LayoutCache mCache;
    private final Executor mExecutor;
    private final RowIdentityFactory<S> mFactory;
    private final DiffEngine mDiffEngine;
    private final ListenerManager<S> mListeners;

    private ControllerState mState;
    private Subscription mSubscription;
    private boolean mBaselineLoaded;
    private boolean mProcessing;
    private ObjectChanges<S> mPending;

    FetchedResultsController(QueryEngine<S> engine, FetchRequest<S> request,
                             String sectionNameKeyPath, String cacheName,
                             LayoutCache cache, Executor executor,
                             RowIdentityFactory<S> factory)
    {
        mEngine = engine;
        mRequest = request;
        mSectionNameKeyPath = sectionNameKeyPath;
        mCacheName = cacheName;
        mCache = cache;
        mExecutor = executor;
        mFactory = factory;
        mDiffEngine = new DiffEngine();
        mListeners = new ListenerManager<S>();
        mState = ControllerState.UNINITIALIZED;
    }

    /**
     * Executes the fetch request and caches the resulting layout. The first
     * successful fetch also subscribes to changes.
     *
     * <p>No changes are reported for the fetch itself, except when the first
     * fetch finds a non-empty layout persisted under the cache name. That
     * layout becomes the baseline, and the changes from it to the fetched
     * layout are reported as one batch.
     *
     * @return false if the query engine failed, in which case the cached
     * layout is left untouched
     * @throws CacheIOException if the layout could not be read or written
     * @throws IllegalStateException if closed
     */
    public synchronized boolean performFetch() throws CacheIOException {
        checkNotClosed();

        if (mSubscription == null) {
            try {
                mSubscription = mEngine.subscribe(mRequest, new Handler());
            } catch (QueryExecutionException e) {
                mLog.error("Unable to subscribe to changes of " + mRequest, e);
                return false;
            }
        }

        Layout layout;
        try {
            layout = fetchLayout();
        } catch (QueryExecutionException e) {
            mLog.error("Unable to fetch " + mRequest, e);
            return false;
        }

        Layout baseline = Layout.EMPTY;
        if (!mBaselineLoaded) {
            baseline = mCache.load();
            mBaselineLoaded = true;
        }

        if (baseline.isEmpty()) {
            mCache.store(layout);
            mState = ControllerState.FETCHED;
        } else {
            if (mLog.isDebugEnabled()) {
                mLog.debug("Restored " + baseline.getRowCount() + " rows from cache \""
                           + mCacheName + '"');
            }
            Set<Object> none = Collections.emptySet();
            update(baseline, layout, none, ControllerState.FETCHED, "restored layout");
        }

        if (mLog.isDebugEnabled()) {
            mLog.debug("Fetched " + layout.getRowCount() + " rows in "
                       + layout.getSectionCount() + " sections for " + mRequest);
        }

        return true;
    }

    /**
     * Discards the cached layout and any pending change batches. The next
     * fetch or change batch rebuilds the layout without reporting changes.
     * Call this to recover when a listener failed to apply changes.
     *
     * @throws CacheIOException if the cached layout could not be deleted
     * @throws IllegalStateException if closed
     */
    public synchronized void reset() throws CacheIOException {
        checkNotClosed();
        mCache.clear();
        mPending = null;
        mState = ControllerState.RESET;
    }

    /**
     * Registers a listener, which receives changes until unregistered or
     * until this controller is closed.
     *
     * @throws IllegalArgumentException if the listener is already registered
     */
    public ListenerRegistration addListener(final ChangeListener<? super S> listener) {
        checkNotClosed();
        if (!mListeners.addListener(listener)) {
            throw new IllegalArgumentException("Listener is already registered: " + listener);
        }
        return new ListenerRegistration() {
            public void unregister() {
                mListeners.removeListener(listener);
            }
        };
    }

    /**
     * @return false if the listener was not registered
     */
    public boolean removeListener(ChangeListener<? super S> listener) {
        return mListeners.removeListener(listener);
    }

    /**
     * Unsubscribes from changes, unregisters all listeners and releases the
     * cache name. The cached layout is kept. Closing more than once has no
     * further effect.
     */
    public synchronized void close() {
        if (mState == ControllerState.CLOSED) {
            return;
        }
        mState = ControllerState.CLOSED;
        mPending = null;
        try {
            if (mSubscription != null) {
                mSubscription.unsubscribe();
                mSubscription = null;
            }
        } finally {
            mListeners.removeAllListeners();
            mCache.close();
        }
    }

    public synchronized ControllerState getState() {
        return mState;
    }

    public FetchRequest<S> getFetchRequest() {
        return mRequest;
    }

    /**
     * Returns the section name key path, or null if results are not grouped.
     */
    public String getSectionNameKeyPath() {
        return mSectionNameKeyPath;
    }

    /**
     * Returns the cache name, or null if the layout is kept in a private
     * in-memory store.
     */
    public String getCacheName() {
        return mCacheName;
    }

    public synchronized int numberOfSections() {
        return layout().getSectionCount();
    }

    /**
     * @throws IndexOutOfBoundsException if no such section
     */
    public synchronized int numberOfRows(int section) {
        return layout().getSection(section).getRowCount();
    }

    /**
     * Returns the name of the given section, or null if results are not
     * grouped.
     *
     * @throws IndexOutOfBoundsException if no such section
     */
    public synchronized String titleForHeaderInSection(int section) {
        return layout().getSection(section).getName();
    }

    public synchronized List<LayoutSection> getSections() {
        return layout().getSections();
    }

    /**
     * Returns the row at the given index path, or null if none.
     */
    public synchronized RowIdentity rowAt(IndexPath path) {
        return layout().getRow(path);
    }

    /**
     * Loads the live object at the given index path.
     *
     * @return the object, or null if there is no row at the path or its
     * object no longer exists
     */
    public S objectAt(IndexPath path) throws QueryExecutionException {
        RowIdentity row = rowAt(path);
        return row == null ? null : mEngine.tryLoad(mRequest, row.getId());
    }

    /**
     * Loads the live objects of the given section, in order. Objects which no
     * longer exist are skipped.
     *
     * @throws IndexOutOfBoundsException if no such section
     */
    public List<S> objectsInSection(int section) throws QueryExecutionException {
        List<RowIdentity> rows;
        synchronized (this) {
            rows = layout().getSection(section).getRows();
        }
        return load(rows);
    }

    /**
     * Loads the live objects of all sections, in order. Objects which no
     * longer exist are skipped.
     */
    public List<S> fetchedObjects() throws QueryExecutionException {
        List<RowIdentity> rows = new ArrayList<RowIdentity>();
        synchronized (this) {
            for (LayoutSection section : layout().getSections()) {
                rows.addAll(section.getRows());
            }
        }
        return load(rows);
    }

    /**
     * Returns the index path of the given row, or null if not present.
     */
    public synchronized IndexPath indexPathOf(RowIdentity row) {
        return row == null ? null : layout().indexPathOf(row.getId());
    }

    /**
     * Returns the index path of the row derived from the given object, or
     * null if not present.
     */
    public synchronized IndexPath indexPathOfObject(S obj) {
        return obj == null ? null : layout().indexPathOf(mFactory.identityOf(obj));
    }

    @Override
    public String toString() {
        return "FetchedResultsController {request=" + mRequest
            + (mSectionNameKeyPath == null ? "" : ", sectionNameKeyPath=" + mSectionNameKeyPath)
            + (mCacheName == null ? "" : ", cacheName=" + mCacheName)
            + ", state=" + getState() + '}';
    }

    /**
     * Processes one batch of changes, or queues it if a batch is already being
     * processed by this thread.
     */
    synchronized void processChanges(ObjectChanges<S> changes) throws ControllerException {
        if (mState == ControllerState.CLOSED || mState == ControllerState.UNINITIALIZED) {
            return;
        }

        if (mProcessing) {
            mPending = mPending == null ? changes : mPending.merge(changes);
            if (mLog.isDebugEnabled()) {
                mLog.debug("Coalesced change batch: " + mPending);
            }
            return;
        }

        mProcessing = true;
        try {
            ObjectChanges<S> batch = changes;
            while (batch != null && mState != ControllerState.CLOSED) {
                runCycle(batch);
                batch = mPending;
                mPending = null;
            }
        } finally {
            mProcessing = false;
        }
    }

    private void runCycle(ObjectChanges<S> batch) throws ControllerException {
        if (mState == ControllerState.RESET) {
            Layout layout = fetchLayout();
            mCache.store(layout);
            mState = ControllerState.FETCHED;
            mLog.debug("Rebuilt cached layout after reset");
            return;
        }

        Layout current = fetchLayout();
        update(mCache.getLayout(), current, modifiedIds(batch), ControllerState.OBSERVING, batch);
    }

    /**
     * Computes the changes from previous to current, stores current and
     * reports the changes to listeners.
     *
     * @param next state to enter once current is stored
     * @param cause describes what led to the changes, for logging
     */
    private void update(Layout previous, Layout current, Set<Object> modifiedIds,
                        ControllerState next, Object cause)
        throws CacheIOException
    {
        ControllerState prior = mState;
        mState = ControllerState.DIFFING;

        ChangeSet changes = null;
        boolean contentChanged;
        try {
            if (mListeners.isTrackingChanges()) {
                changes = mDiffEngine.diff(previous, current, modifiedIds);
                contentChanged = !changes.isEmpty();
            } else {
                contentChanged = !previous.equals(current)
                    || containsAny(current, modifiedIds);
            }

            mCache.store(current);
        } catch (CacheIOException e) {
            mState = prior;
            throw e;
        } catch (RuntimeException e) {
            mState = prior;
            throw e;
        }

        mState = next;

        if (!contentChanged) {
            return;
        }

        if (mLog.isDebugEnabled()) {
            mLog.debug("Reporting " + (changes == null ? "content" : changes.size())
                       + " changes for " + cause);
        }

        mListeners.willChangeContent(this);
        if (changes != null) {
            for (SectionChange change : changes.getSectionChanges()) {
                mListeners.didChangeSection(this, change);
            }
            for (RowChange change : changes.getRowChanges()) {
                mListeners.didChangeObject(this, change);
            }
        }
        mListeners.didChangeContent(this);
    }

    private Layout fetchLayout() throws QueryExecutionException {
        Cursor<S> results = mEngine.execute(mRequest);
        Cursor<RowIdentity> rows = new TransformedCursor<S, RowIdentity>(results) {
            @Override
            protected RowIdentity transform(S obj) {
                return mFactory.identify(obj);
            }
        };
        return Layout.group(rows.toList(), mFactory.isGrouped());
    }

    private Set<Object> modifiedIds(ObjectChanges<S> batch) {
        List<S> modified = batch.getModified();
        if (modified.isEmpty()) {
            return Collections.emptySet();
        }
        Set<Object> ids = new HashSet<Object>(modified.size());
        for (S obj : modified) {
            ids.add(mFactory.identityOf(obj));
        }
        return ids;
    }

    private static boolean containsAny(Layout layout, Set<Object> ids) {
        for (Object id : ids) {
            if (layout.contains(id)) {
                return true;
            }
        }
        return false;
    }

    private List<S> load(List<RowIdentity> rows) throws QueryExecutionException {
        List<S> objects = new ArrayList<S>(rows.size());
        for (RowIdentity row : rows) {
            S obj = mEngine.tryLoad(mRequest, row.getId());
            if (obj != null) {
                objects.add(obj);
            }
        }
        return objects;
    }

    /**
     * Returns the cached layout, or an empty layout if not fetched.
     */
    private Layout layout() {
        return mState.isFetched() ? mCache.getLayout() : Layout.EMPTY;
    }

    private void checkNotClosed() {
        if (mState == ControllerState.CLOSED) {
            throw new IllegalStateException("Controller is closed");
        }
    }

    /**
     * Receives change batches from the query engine.
     */
    private class Handler implements ChangeHandler<S> {
        public void objectsChanged(final ObjectChanges<S> changes) throws ControllerException {
            if (changes == null || changes.isEmpty()) {
                return;
            }

            if (mExecutor == null) {
                processChanges(changes);
                return;
            }

            mExecutor.execute(new Runnable() {
                public void run() {
                    try {
                        processChanges(changes);
                    } catch (ControllerException e) {
                        mLog.error("Unable to process " + changes, e);
                    } catch (RuntimeException e) {
                        mLog.error("Unable to process " + changes, e);
                        throw e;
                    }
                }
            });
        }
    }
}
