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

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.rowdelta.CacheIOException;
import org.rowdelta.CacheInUseException;
import org.rowdelta.layout.Layout;

/**
 * Implements cache name ownership and argument checking for layout stores.
 * Subclasses only need to move records in and out of storage.
 *
 * @author RowDelta Authors
 */
public abstract class AbstractLayoutStore implements LayoutStore {
    protected final Log mLog = LogFactory.getLog(getClass());

    private final Set<String> mOpenNames;

    protected AbstractLayoutStore() {
        mOpenNames = new HashSet<String>();
    }

    public LayoutCache open(String name, String signature) throws CacheIOException {
        checkName(name);
        if (signature == null) {
            throw new IllegalArgumentException("Signature cannot be null");
        }
        synchronized (mOpenNames) {
            if (!mOpenNames.add(name)) {
                throw new CacheInUseException(Collections.singleton(name));
            }
        }
        return new LayoutCache(this, name, signature);
    }

    public Layout read(String name, String signature) throws CacheIOException {
        checkName(name);
        Layout layout = doRead(name, signature);
        return layout == null ? Layout.EMPTY : layout;
    }

    public void write(String name, String signature, Layout layout) throws CacheIOException {
        checkName(name);
        if (layout == null) {
            throw new IllegalArgumentException("Layout cannot be null");
        }
        doWrite(name, signature, layout);
    }

    public void delete(String name) throws CacheIOException {
        synchronized (mOpenNames) {
            if (name == null) {
                if (!mOpenNames.isEmpty()) {
                    throw new CacheInUseException(mOpenNames);
                }
            } else if (mOpenNames.contains(name)) {
                throw new CacheInUseException(Collections.singleton(name));
            }
        }
        if (name == null) {
            mLog.info("Deleting all cached layouts");
            doDeleteAll();
        } else {
            checkName(name);
            mLog.info("Deleting cached layout \"" + name + '"');
            doDelete(name);
        }
    }

    public boolean isOpen(String name) {
        synchronized (mOpenNames) {
            return mOpenNames.contains(name);
        }
    }

    /**
     * Returns the names of all open caches.
     */
    public Collection<String> getOpenNames() {
        synchronized (mOpenNames) {
            return new HashSet<String>(mOpenNames);
        }
    }

    /**
     * Deletes a record on behalf of its owner.
     */
    void clear(String name) throws CacheIOException {
        doDelete(name);
    }

    void release(String name) {
        synchronized (mOpenNames) {
            mOpenNames.remove(name);
        }
    }

    /**
     * @return stored layout, or null if none exists for the signature
     */
    protected abstract Layout doRead(String name, String signature) throws CacheIOException;

    protected abstract void doWrite(String name, String signature, Layout layout)
        throws CacheIOException;

    /**
     * Deletes a record, doing nothing if it does not exist.
     */
    protected abstract void doDelete(String name) throws CacheIOException;

    protected abstract void doDeleteAll() throws CacheIOException;

    private static void checkName(String name) {
        if (name == null || name.length() == 0) {
            throw new IllegalArgumentException("Cache name must not be empty");
        }
    }
}
