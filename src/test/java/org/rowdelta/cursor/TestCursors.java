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
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import org.rowdelta.Cursor;
import org.rowdelta.QueryExecutionException;

/**
 * Tests for the cursor implementations.
 *
 * @author RowDelta Authors
 */
public class TestCursors extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestCursors.class);
    }

    public TestCursors(String name) {
        super(name);
    }

    public void testIteratorCursor() throws Exception {
        Cursor<String> cursor = new IteratorCursor<String>(Arrays.asList("a", "b"));
        assertTrue(cursor.hasNext());
        assertEquals("a", cursor.next());
        assertEquals("b", cursor.next());
        assertFalse(cursor.hasNext());
        try {
            cursor.next();
            fail();
        } catch (NoSuchElementException e) {
        }

        cursor = new IteratorCursor<String>((Iterable<String>) null);
        assertFalse(cursor.hasNext());

        cursor = new IteratorCursor<String>(Arrays.asList("a", "b").iterator());
        cursor.close();
        assertFalse(cursor.hasNext());
    }

    public void testCopyInto() throws Exception {
        Cursor<String> cursor = new IteratorCursor<String>(Arrays.asList("a", "b", "c"));
        cursor.next();
        List<Object> list = new ArrayList<Object>();
        list.add("x");
        assertEquals(2, cursor.copyInto(list));
        assertEquals("[x, b, c]", list.toString());
        assertFalse(cursor.hasNext());

        cursor = new IteratorCursor<String>(Arrays.asList("a", "b"));
        assertEquals(Arrays.asList("a", "b"), cursor.toList());
    }

    public void testTransformedCursor() throws Exception {
        ClosingCursor source = new ClosingCursor(Arrays.asList("1", "skip", "3"));
        Cursor<Integer> cursor = new TransformedCursor<String, Integer>(source) {
            @Override
            protected Integer transform(String s) {
                return "skip".equals(s) ? null : Integer.valueOf(s);
            }
        };

        assertTrue(cursor.hasNext());
        assertTrue(cursor.hasNext());
        assertEquals(Integer.valueOf(1), cursor.next());
        assertEquals(Integer.valueOf(3), cursor.next());
        assertFalse(cursor.hasNext());
        try {
            cursor.next();
            fail();
        } catch (NoSuchElementException e) {
        }

        cursor.close();
        assertTrue(source.mClosed);
    }

    public void testTransformFailureClosesSource() throws Exception {
        ClosingCursor source = new ClosingCursor(Arrays.asList("1", "bad"));
        Cursor<Integer> cursor = new TransformedCursor<String, Integer>(source) {
            @Override
            protected Integer transform(String s) throws QueryExecutionException {
                if ("bad".equals(s)) {
                    throw new QueryExecutionException("Cannot transform " + s);
                }
                return Integer.valueOf(s);
            }
        };

        try {
            cursor.toList();
            fail();
        } catch (QueryExecutionException e) {
            assertEquals("Cannot transform bad", e.getMessage());
        }
        assertTrue(source.mClosed);

        source = new ClosingCursor(Arrays.asList("x"));
        cursor = new TransformedCursor<String, Integer>(source) {
            @Override
            protected Integer transform(String s) {
                return Integer.valueOf(s);
            }
        };

        try {
            cursor.hasNext();
            fail();
        } catch (NumberFormatException e) {
        }
        assertTrue(source.mClosed);
    }

    /**
     * Records whether it was closed.
     */
    private static class ClosingCursor extends IteratorCursor<String> {
        boolean mClosed;

        ClosingCursor(List<String> list) {
            super(list);
        }

        @Override
        public void close() {
            mClosed = true;
            super.close();
        }
    }
}
