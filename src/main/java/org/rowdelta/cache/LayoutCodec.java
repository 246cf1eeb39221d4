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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.io.StreamCorruptedException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

import org.rowdelta.CacheIOException;
import org.rowdelta.CorruptLayoutException;
import org.rowdelta.LayoutInvariantException;
import org.rowdelta.RowIdentity;
import org.rowdelta.layout.Layout;
import org.rowdelta.layout.LayoutSection;

/**
 * Binary encoding of layout records. Only structure is encoded: section names
 * and row identifiers, in order. Decoded rows have unknown values.
 *
 * <p>Record format, all integers big-endian:
 *
 * <pre>
 * int      magic
 * byte     version
 * string   configuration signature
 * int      section count
 * section* sections
 *
 * section: byte    1 if named, 0 otherwise
 *          string  name, if named
 *          int     row count
 *          id*     row identifiers
 *
 * id:      byte    tag
 *          ...     String (tag 1) as a string, Integer (tag 2) as int,
 *                  Long (tag 3) as long, otherwise (tag 4) as a length-prefixed
 *                  serialized object
 *
 * string:  int     length in bytes, followed by UTF-8 bytes
 * </pre>
 *
 * @author RowDelta Authors
 */
public class LayoutCodec {
    static final int MAGIC = 0x52444c59;
    static final byte VERSION = 1;

    private static final byte NAMED = 1, UNNAMED = 0;
    private static final byte TAG_STRING = 1, TAG_INTEGER = 2, TAG_LONG = 3, TAG_SERIALIZED = 4;

    // Length-prefixed byte runs are read at most this much at a time.
    private static final int CHUNK_SIZE = 8192;

    private static final Charset UTF_8 = Charset.forName("UTF-8");

    public LayoutCodec() {
    }

    /**
     * @throws CacheIOException if a row identifier cannot be encoded or if
     * writing failed
     */
    public void encode(String signature, Layout layout, OutputStream out)
        throws CacheIOException
    {
        try {
            DataOutputStream dout = new DataOutputStream(out);
            dout.writeInt(MAGIC);
            dout.writeByte(VERSION);
            writeString(dout, signature);
            dout.writeInt(layout.getSectionCount());
            for (LayoutSection section : layout.getSections()) {
                if (section.getName() == null) {
                    dout.writeByte(UNNAMED);
                } else {
                    dout.writeByte(NAMED);
                    writeString(dout, section.getName());
                }
                dout.writeInt(section.getRowCount());
                for (RowIdentity row : section.getRows()) {
                    writeId(dout, row.getId());
                }
            }
            dout.flush();
        } catch (IOException e) {
            throw new CacheIOException(e);
        }
    }

    public byte[] encode(String signature, Layout layout) throws CacheIOException {
        ByteArrayOutputStream bout = new ByteArrayOutputStream();
        encode(signature, layout, bout);
        return bout.toByteArray();
    }

    /**
     * Decodes a record, returning an empty layout if it was written for
     * another configuration signature.
     *
     * @param cacheName name of the record, for error reporting
     * @throws CorruptLayoutException if the record is malformed
     * @throws CacheIOException if reading failed
     */
    public Layout decode(String cacheName, String signature, InputStream in)
        throws CacheIOException
    {
        DataInputStream din = new DataInputStream(in);
        try {
            if (din.readInt() != MAGIC) {
                throw new CorruptLayoutException(cacheName, "Not a layout record");
            }
            byte version = din.readByte();
            if (version != VERSION) {
                throw new CorruptLayoutException
                    (cacheName, "Unsupported layout record version: " + version);
            }
            String recordSignature = readString(cacheName, din);
            if (!recordSignature.equals(signature)) {
                return Layout.EMPTY;
            }

            int sectionCount = checkCount(cacheName, din.readInt());
            List<LayoutSection> sections = new ArrayList<LayoutSection>(Math.min(sectionCount, 16));
            for (int s=0; s<sectionCount; s++) {
                String name;
                byte named = din.readByte();
                if (named == NAMED) {
                    name = readString(cacheName, din);
                } else if (named == UNNAMED) {
                    name = null;
                } else {
                    throw new CorruptLayoutException
                        (cacheName, "Illegal section flag: " + named);
                }
                int rowCount = checkCount(cacheName, din.readInt());
                List<RowIdentity> rows = new ArrayList<RowIdentity>(Math.min(rowCount, 1024));
                for (int r=0; r<rowCount; r++) {
                    rows.add(RowIdentity.restored(readId(cacheName, din), name));
                }
                sections.add(new LayoutSection(name, rows));
            }

            return sections.isEmpty() ? Layout.EMPTY : new Layout(sections);
        } catch (EOFException e) {
            throw new CorruptLayoutException(cacheName, "Layout record is truncated", e);
        } catch (StreamCorruptedException e) {
            throw new CorruptLayoutException(cacheName, e.getMessage(), e);
        } catch (LayoutInvariantException e) {
            throw new CorruptLayoutException(cacheName, e.getMessage(), e);
        } catch (IOException e) {
            throw new CacheIOException(e);
        }
    }

    public Layout decode(String cacheName, String signature, byte[] record)
        throws CacheIOException
    {
        return decode(cacheName, signature, new ByteArrayInputStream(record));
    }

    private static void writeString(DataOutputStream out, String str) throws IOException {
        byte[] bytes = str.getBytes(UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    private static String readString(String cacheName, DataInputStream in)
        throws IOException, CorruptLayoutException
    {
        return new String(readBytes(cacheName, in), UTF_8);
    }

    /**
     * Reads a length-prefixed byte run. Memory is only committed for bytes
     * actually present, so a corrupt length ends in a truncation error.
     */
    private static byte[] readBytes(String cacheName, DataInputStream in)
        throws IOException, CorruptLayoutException
    {
        int length = checkCount(cacheName, in.readInt());
        if (length <= CHUNK_SIZE) {
            byte[] bytes = new byte[length];
            in.readFully(bytes);
            return bytes;
        }
        ByteArrayOutputStream bout = new ByteArrayOutputStream(CHUNK_SIZE);
        byte[] chunk = new byte[CHUNK_SIZE];
        int remaining = length;
        while (remaining > 0) {
            int amt = in.read(chunk, 0, Math.min(CHUNK_SIZE, remaining));
            if (amt < 0) {
                throw new EOFException();
            }
            bout.write(chunk, 0, amt);
            remaining -= amt;
        }
        return bout.toByteArray();
    }

    private static void writeId(DataOutputStream out, Object id) throws IOException,
        CacheIOException
    {
        if (id instanceof String) {
            out.writeByte(TAG_STRING);
            writeString(out, (String) id);
        } else if (id instanceof Integer) {
            out.writeByte(TAG_INTEGER);
            out.writeInt((Integer) id);
        } else if (id instanceof Long) {
            out.writeByte(TAG_LONG);
            out.writeLong((Long) id);
        } else if (id instanceof Serializable) {
            ByteArrayOutputStream bout = new ByteArrayOutputStream();
            ObjectOutputStream oout = new ObjectOutputStream(bout);
            oout.writeObject(id);
            oout.close();
            byte[] bytes = bout.toByteArray();
            out.writeByte(TAG_SERIALIZED);
            out.writeInt(bytes.length);
            out.write(bytes);
        } else {
            throw new CacheIOException
                ("Row identifier of type " + id.getClass().getName() + " is not serializable");
        }
    }

    private static Object readId(String cacheName, DataInputStream in)
        throws IOException, CacheIOException
    {
        byte tag = in.readByte();
        switch (tag) {
        case TAG_STRING:
            return readString(cacheName, in);
        case TAG_INTEGER:
            return in.readInt();
        case TAG_LONG:
            return in.readLong();
        case TAG_SERIALIZED:
            byte[] bytes = readBytes(cacheName, in);
            ObjectInputStream oin = new ObjectInputStream(new ByteArrayInputStream(bytes));
            try {
                return oin.readObject();
            } catch (ClassNotFoundException e) {
                throw new CorruptLayoutException
                    (cacheName, "Row identifier class not found: " + e.getMessage(), e);
            } finally {
                oin.close();
            }
        default:
            throw new CorruptLayoutException(cacheName, "Illegal row identifier tag: " + tag);
        }
    }

    private static int checkCount(String cacheName, int count) throws CorruptLayoutException {
        if (count < 0) {
            throw new CorruptLayoutException(cacheName, "Negative count: " + count);
        }
        return count;
    }
}
