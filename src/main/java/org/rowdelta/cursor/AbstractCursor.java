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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.rowdelta.Cursor;
import org.rowdelta.QueryExecutionException;

/**
 * AbstractCursor implements the bulk copy methods of Cursor in terms of
 * hasNext and next.
 *
 * @author RowDelta Authors
 */
public abstract class AbstractCursor<S> implements Cursor<S> {
    protected AbstractCursor() {
    }

    public int copyInto(Collection<? super S> c) throws QueryExecutionException {
        int count = 0;
        try {
            while (hasNext()) {
                c.add(next());
                count++;
            }
        } catch (QueryExecutionException e) {
            closeQuietly();
            throw e;
        }
        close();
        return count;
    }

    public List<S> toList() throws QueryExecutionException {
        List<S> list = new ArrayList<S>();
        copyInto(list);
        return list;
    }

    /**
     * Closes this cursor after a failure, keeping the original exception.
     */
    protected void closeQuietly() {
        try {
            close();
        } catch (Exception e) {
            // Don't care.
        }
    }
}
