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

import org.rowdelta.CacheIOException;
import org.rowdelta.CacheInUseException;
import org.rowdelta.layout.Layout;

/**
 * Keyed store of layout records, which lets a controller resume diffing from
 * the layout it last presented. Each record is stored under a cache name,
 * along with the configuration signature it was computed for. Records are
 * replaced as a whole, never partially.
 *
 * <p>A cache name is owned by at most one {@link LayoutCache} at a time, and
 * records cannot be deleted while owned.
 *
 * @see org.rowdelta.cache.map.MapLayoutStore
 * @see org.rowdelta.cache.file.FileLayoutStore
 * @author RowDelta Authors
 */
public interface LayoutStore {
    /**
     * Opens the cache with the given name, taking ownership of it until the
     * returned cache is closed. The record is not read until {@link
     * LayoutCache#load load} is called.
     *
     * @param name cache name
     * @param signature configuration signature of the owner
     * @throws CacheInUseException if the name is already open
     * @throws IllegalArgumentException if name is null or empty
     */
    LayoutCache open(String name, String signature) throws CacheIOException;

    /**
     * Reads the record stored under the given name. If no record exists, or
     * if it was written for another configuration signature, an empty layout
     * is returned.
     *
     * @throws org.rowdelta.CorruptLayoutException if the record cannot be decoded
     * @throws CacheIOException if the record cannot be read
     */
    Layout read(String name, String signature) throws CacheIOException;

    /**
     * Atomically replaces the record stored under the given name.
     *
     * @throws CacheIOException if the record cannot be written
     */
    void write(String name, String signature, Layout layout) throws CacheIOException;

    /**
     * Deletes the record stored under the given name, or all records if name
     * is null. Deleting a record which does not exist does nothing.
     *
     * @throws CacheInUseException if an affected cache is open
     * @throws CacheIOException if a record exists but cannot be deleted
     */
    void delete(String name) throws CacheIOException;

    /**
     * Returns true if a cache by the given name is currently open.
     */
    boolean isOpen(String name);

    /**
     * Returns true if records survive the process.
     */
    boolean isDurable();
}
