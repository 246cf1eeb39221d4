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

package org.rowdelta.cache;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.rowdelta.CacheIOException;
import org.rowdelta.layout.Layout;

/**
 * Layout record owned by one controller. The cache holds the baseline layout
 * which the next diff starts from, and mirrors it to the store whenever its
 * structure changes. Instances are obtained from {@link LayoutStore#open}.
 *
 * <p>Instances are not thread-safe.
 *
 * @author RowDelta Authors
 */
public class LayoutCache {
    private final Log mLog = LogFactory.getLog(getClass());

    private final AbstractLayoutStore mStore;
    private final String mName;
    private final String mSignature;

    private Layout mLayout;
    private Layout mWritten;
    private boolean mClosed;

    LayoutCache(AbstractLayoutStore store, String name, String signature) {
        mStore = store;
        mName = name;
        mSignature = signature;
        mLayout = Layout.EMPTY;
    }

    public String getName() {
        return mName;
    }

    public String getSignature() {
        return mSignature;
    }

    /**
     * Reads the stored record and adopts it as the baseline. Rows of a record
     * restored from durable storage have unknown values.
     *
     * @return the adopted baseline
     */
    public Layout load() throws CacheIOException {
        checkOpen();
        Layout layout = mStore.read(mName, mSignature);
        mLayout = layout;
        mWritten = layout;
        if (mLog.isDebugEnabled()) {
            mLog.debug("Loaded cache \"" + mName + "\" with " + layout.getRowCount() + " rows");
        }
        return layout;
    }

    /**
     * Returns the current baseline, which is empty if nothing has been loaded
     * or stored yet.
     */
    public Layout getLayout() {
        return mLayout;
    }

    /**
     * Replaces the baseline. The store is only written to when the structure
     * differs from what was last written, but the baseline always takes the
     * given layout with its values.
     *
     * @throws CacheIOException if writing failed, in which case the baseline
     * is left unchanged
     */
    public void store(Layout layout) throws CacheIOException {
        checkOpen();
        if (layout == null) {
            throw new IllegalArgumentException("Layout cannot be null");
        }
        if (mWritten == null || !mWritten.equals(layout)) {
            mStore.write(mName, mSignature, layout);
            mWritten = layout;
        }
        mLayout = layout;
    }

    /**
     * Deletes the stored record and empties the baseline.
     */
    public void clear() throws CacheIOException {
        checkOpen();
        mLog.info("Clearing cache \"" + mName + '"');
        mStore.clear(mName);
        mLayout = Layout.EMPTY;
        mWritten = Layout.EMPTY;
    }

    /**
     * Releases ownership of the cache name. The stored record is kept.
     */
    public void close() {
        if (!mClosed) {
            mClosed = true;
            mStore.release(mName);
        }
    }

    public boolean isClosed() {
        return mClosed;
    }

    @Override
    public String toString() {
        return "LayoutCache {name=" + mName + ", rows=" + mLayout.getRowCount()
            + (mClosed ? ", closed" : "") + '}';
    }

    private void checkOpen() {
        if (mClosed) {
            throw new IllegalStateException("Cache is closed: \"" + mName + '"');
        }
    }
}
