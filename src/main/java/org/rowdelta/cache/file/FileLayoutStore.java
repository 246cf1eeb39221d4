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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

import org.rowdelta.CacheIOException;
import org.rowdelta.cache.AbstractLayoutStore;
import org.rowdelta.cache.LayoutCodec;
import org.rowdelta.layout.Layout;

/**
 * Layout store which keeps one file per record in a directory. A record is
 * replaced by writing a temporary file, syncing it to disk, and renaming it
 * over the old one, so readers see either the old or the new record in full.
 *
 * @see LayoutCodec
 * @author RowDelta Authors
 */
public class FileLayoutStore extends AbstractLayoutStore {
    static final String SUFFIX = ".layout";

    private final File mDirectory;
    private final LayoutCodec mCodec;

    /**
     * @param directory directory to keep records in, which is created if it
     * does not exist
     * @throws CacheIOException if the directory cannot be created
     */
    public FileLayoutStore(File directory) throws CacheIOException {
        if (directory == null) {
            throw new IllegalArgumentException("Directory cannot be null");
        }
        if (!directory.isDirectory() && !directory.mkdirs()) {
            throw new CacheIOException("Unable to create directory: " + directory);
        }
        mDirectory = directory;
        mCodec = new LayoutCodec();
    }

    public File getDirectory() {
        return mDirectory;
    }

    public boolean isDurable() {
        return true;
    }

    /**
     * Returns the file which holds the record of the given name.
     */
    public File fileFor(String name) {
        try {
            return new File(mDirectory, URLEncoder.encode(name, "UTF-8") + SUFFIX);
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    protected Layout doRead(String name, String signature) throws CacheIOException {
        File file = fileFor(name);
        InputStream in;
        try {
            in = new BufferedInputStream(new FileInputStream(file));
        } catch (FileNotFoundException e) {
            return null;
        }
        try {
            return mCodec.decode(name, signature, in);
        } finally {
            try {
                in.close();
            } catch (IOException e) {
                mLog.warn("Unable to close " + file, e);
            }
        }
    }

    @Override
    protected void doWrite(String name, String signature, Layout layout)
        throws CacheIOException
    {
        File file = fileFor(name);
        File temp = null;
        try {
            temp = File.createTempFile(file.getName(), ".tmp", mDirectory);
            FileOutputStream fout = new FileOutputStream(temp);
            try {
                BufferedOutputStream out = new BufferedOutputStream(fout);
                mCodec.encode(signature, layout, out);
                out.flush();
                fout.getFD().sync();
            } finally {
                fout.close();
            }

            try {
                Files.move(temp.toPath(), file.toPath(),
                           StandardCopyOption.ATOMIC_MOVE,
                           StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            throw new CacheIOException("Unable to write " + file, e);
        } finally {
            if (temp != null && temp.exists() && !temp.delete()) {
                mLog.warn("Unable to delete temporary file " + temp);
            }
        }

        if (mLog.isDebugEnabled()) {
            mLog.debug("Wrote " + layout.getRowCount() + " rows to " + file);
        }
    }

    @Override
    protected void doDelete(String name) throws CacheIOException {
        File file = fileFor(name);
        if (file.exists() && !file.delete()) {
            throw new CacheIOException("Unable to delete " + file);
        }
    }

    @Override
    protected void doDeleteAll() throws CacheIOException {
        File[] files = mDirectory.listFiles();
        if (files == null) {
            return;
        }
        for (File file : files) {
            if (file.getName().endsWith(SUFFIX) && !file.delete()) {
                throw new CacheIOException("Unable to delete " + file);
            }
        }
    }

    @Override
    public String toString() {
        return "FileLayoutStore {directory=" + mDirectory + '}';
    }
}
