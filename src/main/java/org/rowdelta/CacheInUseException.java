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
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Thrown when a cached layout is deleted or opened while a controller still
 * owns it. This is a programming error: close the owning controller first.
 *
 * @author RowDelta Authors
 */
public class CacheInUseException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final Set<String> mNames;

    public CacheInUseException(Collection<String> names) {
        super(message(names));
        mNames = Collections.unmodifiableSet(new TreeSet<String>(names));
    }

    /**
     * Returns the names of the caches which were still open.
     */
    public Set<String> getCacheNames() {
        return mNames;
    }

    private static String message(Collection<String> names) {
        StringBuilder b = new StringBuilder();
        b.append(names.size() == 1 ? "Cache is still open: " : "Caches are still open: ");
        int i = 0;
        for (String name : new TreeSet<String>(names)) {
            if (i++ > 0) {
                b.append(", ");
            }
            b.append('"').append(name).append('"');
        }
        return b.toString();
    }
}
