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
 * Thrown when a layout or a diff would break a structural invariant, such as
 * a duplicate row identity or a section which is not contiguous in the fetched
 * results. The diff cycle which hits it is abandoned and the cached layout is
 * left as it was. Call {@link FetchedResultsController#reset reset} to
 * recover.
 *
 * @author RowDelta Authors
 */
public class LayoutInvariantException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public LayoutInvariantException(String message) {
        super(message);
    }

    public LayoutInvariantException(String message, Throwable cause) {
        super(message, cause);
    }
}
