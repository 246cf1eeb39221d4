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

package org.rowdelta.cache.map;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import org.rowdelta.CacheInUseException;
import org.rowdelta.cache.LayoutCache;
import org.rowdelta.layout.Layout;

import static org.rowdelta.layout.Layouts.*;

/**
 * Tests for MapLayoutStore and LayoutCache.
 *
 * @author RowDelta Authors
 */
public class TestMapLayoutStore extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestMapLayoutStore.class);
    }

    public TestMapLayoutStore(String name) {
        super(name);
    }

    private MapLayoutStore mStore;

    @Override
    protected void setUp() {
        mStore = new MapLayoutStore();
    }

    public void testReadMissing() throws Exception {
        assertSame(Layout.EMPTY, mStore.read("none", "sig"));
        assertFalse(mStore.isDurable());
    }

    public void testWriteAndRead() throws Exception {
        Layout layout = grouped(row(1, "A", 1, "x"));
        mStore.write("a", "sig", layout);
        assertSame(layout, mStore.read("a", "sig"));
        assertSame(Layout.EMPTY, mStore.read("a", "other"));
        assertEquals(1, mStore.size());
    }

    public void testOpenIsExclusive() throws Exception {
        LayoutCache cache = mStore.open("a", "sig");
        assertTrue(mStore.isOpen("a"));
        try {
            mStore.open("a", "sig");
            fail();
        } catch (CacheInUseException e) {
            assertTrue(e.getCacheNames().contains("a"));
        }
        cache.close();
        cache.close();
        assertFalse(mStore.isOpen("a"));
        mStore.open("a", "sig").close();
    }

    public void testDeleteWhileOpen() throws Exception {
        mStore.write("a", "sig", grouped(row(1, "A", 1)));
        LayoutCache cache = mStore.open("a", "sig");
        mStore.open("b", "sig");

        try {
            mStore.delete("a");
            fail();
        } catch (CacheInUseException e) {
        }
        try {
            mStore.delete(null);
            fail();
        } catch (CacheInUseException e) {
            assertEquals(2, e.getCacheNames().size());
        }

        mStore.delete("c");
        assertEquals(1, mStore.size());

        cache.close();
        mStore.delete("a");
        mStore.delete("a");
        assertEquals(0, mStore.size());
    }

    public void testDeleteAll() throws Exception {
        mStore.write("a", "sig", grouped(row(1, "A", 1)));
        mStore.write("b", "sig", grouped(row(1, "A", 1)));
        mStore.delete(null);
        assertEquals(0, mStore.size());
        mStore.delete(null);
    }

    public void testCacheLifecycle() throws Exception {
        mStore.write("a", "sig", grouped(row(1, "A", 1)));
        LayoutCache cache = mStore.open("a", "sig");
        assertEquals("a", cache.getName());
        assertSame(Layout.EMPTY, cache.getLayout());

        Layout loaded = cache.load();
        assertEquals(grouped(row(1, "A", 1)), loaded);
        assertSame(loaded, cache.getLayout());

        Layout next = grouped(row(1, "A", 1), row(2, "A", 2));
        cache.store(next);
        assertSame(next, cache.getLayout());
        assertSame(next, mStore.read("a", "sig"));

        // Same structure, newer values: baseline takes them, record is kept.
        Layout values = grouped(row(1, "A", 5), row(2, "A", 6));
        cache.store(values);
        assertSame(values, cache.getLayout());
        assertSame(next, mStore.read("a", "sig"));

        cache.clear();
        assertSame(Layout.EMPTY, cache.getLayout());
        assertSame(Layout.EMPTY, mStore.read("a", "sig"));
        assertEquals(0, mStore.size());

        cache.close();
        assertTrue(cache.isClosed());
        try {
            cache.load();
            fail();
        } catch (IllegalStateException e) {
        }
    }

    public void testEmptyName() throws Exception {
        try {
            mStore.open("", "sig");
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            mStore.read(null, "sig");
            fail();
        } catch (IllegalArgumentException e) {
        }
    }
}
