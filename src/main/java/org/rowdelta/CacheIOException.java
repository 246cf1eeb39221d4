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
 * Thrown when a {@link org.rowdelta.cache.LayoutStore layout store} cannot
 * read or write a cached layout. A controller never substitutes an empty
 * layout when this happens.
 *
 * @author RowDelta Authors
 */
public class CacheIOException extends ControllerException {

    private static final long serialVersionUID = 8630187124554032917L;

    public CacheIOException() {
        super();
    }

    public CacheIOException(String message) {
        super(message);
    }

    public CacheIOException(String message, Throwable cause) {
        super(message, cause);
    }

    public CacheIOException(Throwable cause) {
        super(cause);
    }
}
