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

/**
 * A CorruptLayoutException is caused when decoding a persisted layout record
 * fails.
 *
 * @author RowDelta Authors
 */
public class CorruptLayoutException extends CacheIOException {

    private static final long serialVersionUID = 2L;

    private final String mCacheName;

    public CorruptLayoutException(String cacheName, String message) {
        super(message);
        mCacheName = cacheName;
    }

    public CorruptLayoutException(String cacheName, String message, Throwable cause) {
        super(message, cause);
        mCacheName = cacheName;
    }

    /**
     * Returns the name of the cache whose record could not be decoded, or null
     * if not known.
     */
    public String getCacheName() {
        return mCacheName;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (mCacheName != null) {
            message = message + "; cache \"" + mCacheName + '"';
        }
        return message;
    }
}
