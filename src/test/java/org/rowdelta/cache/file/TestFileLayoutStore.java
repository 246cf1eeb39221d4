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

package org.rowdelta.cache.file;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import org.rowdelta.CacheIOException;
import org.rowdelta.CacheInUseException;
import org.rowdelta.CorruptLayoutException;
import org.rowdelta.cache.LayoutCache;
import org.rowdelta.layout.Layout;

import static org.rowdelta.layout.Layouts.*;

/**
 * Tests for FileLayoutStore.
 *
 * @author RowDelta Authors
 */
public class TestFileLayoutStore extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestFileLayoutStore.class);
    }

    public TestFileLayoutStore(String name) {
        super(name);
    }

    private File mDirectory;
    private FileLayoutStore mStore;

    @Override
    protected void setUp() throws Exception {
        mDirectory = File.createTempFile("layouts", "");
        mDirectory.delete();
        mStore = new FileLayoutStore(new File(mDirectory, "nested"));
    }

    @Override
    protected void tearDown() {
        deleteTree(mDirectory);
    }

    public void testCreatesDirectory() {
        assertTrue(mStore.getDirectory().isDirectory());
        assertTrue(mStore.isDurable());
    }

    public void testNotADirectory() throws Exception {
        File file = new File(mDirectory, "plain");
        new FileOutputStream(file).close();
        try {
            new FileLayoutStore(file);
            fail();
        } catch (CacheIOException e) {
        }
    }

    public void testWriteAndRead() throws Exception {
        Layout layout = grouped(row(1L, "A", 1), row(2L, "A", 2), row(3L, "B", 1));
        mStore.write("contacts", "sig", layout);

        assertTrue(mStore.fileFor("contacts").isFile());

        Layout read = mStore.read("contacts", "sig");
        assertEquals(layout, read);
        assertFalse(read.findRow(1L).hasKnownValues());

        assertSame(Layout.EMPTY, mStore.read("contacts", "other"));
        assertSame(Layout.EMPTY, mStore.read("missing", "sig"));

        // Records outlive the store instance.
        FileLayoutStore other = new FileLayoutStore(mStore.getDirectory());
        assertEquals(layout, other.read("contacts", "sig"));
    }

    public void testReplaceLeavesNoTemporaryFiles() throws Exception {
        mStore.write("a", "sig", grouped(row(1, "A", 1)));
        mStore.write("a", "sig", grouped(row(1, "A", 1), row(2, "A", 2)));

        String[] names = mStore.getDirectory().list();
        assertEquals(1, names.length);
        assertEquals("a" + FileLayoutStore.SUFFIX, names[0]);
        assertEquals(2, mStore.read("a", "sig").getRowCount());
    }

    public void testNameEncoding() throws Exception {
        String name = "my/cache name";
        mStore.write(name, "sig", grouped(row(1, "A", 1)));
        File file = mStore.fileFor(name);
        assertEquals(mStore.getDirectory(), file.getParentFile());
        assertTrue(file.isFile());
        assertEquals(1, mStore.read(name, "sig").getRowCount());
    }

    public void testCorruptRecord() throws Exception {
        FileOutputStream out = new FileOutputStream(mStore.fileFor("bad"));
        out.write(new byte[] {'n', 'o', 'p', 'e', '!'});
        out.close();

        try {
            mStore.read("bad", "sig");
            fail();
        } catch (CorruptLayoutException e) {
            assertEquals("bad", e.getCacheName());
        }
    }

    public void testDelete() throws Exception {
        mStore.write("a", "sig", grouped(row(1, "A", 1)));
        mStore.write("b", "sig", grouped(row(1, "A", 1)));
        File unrelated = new File(mStore.getDirectory(), "unrelated.txt");
        new FileOutputStream(unrelated).close();

        mStore.delete("a");
        assertFalse(mStore.fileFor("a").exists());
        mStore.delete("a");

        LayoutCache cache = mStore.open("b", "sig");
        try {
            mStore.delete("b");
            fail();
        } catch (CacheInUseException e) {
        }
        assertTrue(mStore.fileFor("b").exists());
        cache.close();

        mStore.delete(null);
        assertFalse(mStore.fileFor("b").exists());
        assertTrue(unrelated.exists());
    }

    public void testCacheSkipsUnchangedWrites() throws Exception {
        LayoutCache cache = mStore.open("a", "sig");
        cache.load();

        cache.store(grouped(row(1, "A", 1)));
        File file = mStore.fileFor("a");
        assertTrue(file.delete());

        // Same structure: no write.
        cache.store(grouped(row(1, "A", 7)));
        assertFalse(file.exists());

        cache.store(grouped(row(1, "A", 7), row(2, "A", 8)));
        assertTrue(file.exists());
        cache.close();
    }

    private static void deleteTree(File file) {
        File[] children = file.listFiles();
        if (children != null) {
            for (File child : children) {
                deleteTree(child);
            }
        }
        file.delete();
    }
}
