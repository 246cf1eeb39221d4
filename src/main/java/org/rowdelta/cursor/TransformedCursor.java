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

package org.rowdelta.cursor;

import java.util.NoSuchElementException;

import org.rowdelta.Cursor;
import org.rowdelta.QueryExecutionException;

/**
 * Abstract cursor which wraps another cursor and transforms each result into
 * a target value. The controller uses one to turn live objects into row
 * identities while reading a fetch.
 *
 * @param <S> source type, can be anything
 * @param <T> target type, can be anything
 * @author RowDelta Authors
 */
public abstract class TransformedCursor<S, T> extends AbstractCursor<T> {
    private final Cursor<S> mCursor;

    private T mNext;

    protected TransformedCursor(Cursor<S> cursor) {
        if (cursor == null) {
            throw new IllegalArgumentException();
        }
        mCursor = cursor;
    }

    /**
     * This method must be implemented to transform results. If a result
     * cannot be transformed, either throw a QueryExecutionException or return
     * null. If null is returned, the result is simply filtered out.
     *
     * @return transformed result, or null to filter it out
     */
    protected abstract T transform(S source) throws QueryExecutionException;

    public void close() throws QueryExecutionException {
        mCursor.close();
        mNext = null;
    }

    public boolean hasNext() throws QueryExecutionException {
        if (mNext != null) {
            return true;
        }
        try {
            while (mCursor.hasNext()) {
                T next = transform(mCursor.next());
                if (next != null) {
                    mNext = next;
                    return true;
                }
            }
        } catch (QueryExecutionException e) {
            closeQuietly();
            throw e;
        } catch (RuntimeException e) {
            closeQuietly();
            throw e;
        }
        return false;
    }

    public T next() throws QueryExecutionException {
        if (hasNext()) {
            T next = mNext;
            mNext = null;
            return next;
        }
        throw new NoSuchElementException();
    }
}
