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

import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Represents the results of a {@link QueryEngine#execute fetch}. Cursors must
 * be closed promptly when no longer needed. As a convenience, the close
 * operation is automatically performed when the end is reached or when an
 * exception is thrown.
 *
 * <p>Cursor instances are mutable and not guaranteed to be thread-safe. Only
 * one thread should ever operate on a cursor instance.
 *
 * @author RowDelta Authors
 */
public interface Cursor<S> {
    /**
     * Call close to release any resources being held by this cursor. Further
     * operations on this cursor will behave as if there are no results.
     */
    void close() throws QueryExecutionException;

    /**
     * Returns true if this cursor has more elements.
     *
     * @throws QueryExecutionException if the query engine throws an exception
     */
    boolean hasNext() throws QueryExecutionException;

    /**
     * Returns the next element from this cursor.
     *
     * @throws QueryExecutionException if the query engine throws an exception
     * @throws NoSuchElementException if the cursor has no next element.
     */
    S next() throws QueryExecutionException;

    /**
     * Copies all remaining next elements into the given collection. As a
     * side-effect of calling this method, the cursor is closed.
     *
     * @return actual amount of results added
     * @throws QueryExecutionException if the query engine throws an exception
     */
    int copyInto(Collection<? super S> c) throws QueryExecutionException;

    /**
     * Copies all remaining next elements into a new modifiable list. As a
     * side-effect of calling this method, the cursor is closed.
     *
     * @return a new modifiable list
     * @throws QueryExecutionException if the query engine throws an exception
     */
    List<S> toList() throws QueryExecutionException;
}
