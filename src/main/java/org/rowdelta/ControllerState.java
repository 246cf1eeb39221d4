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
 * Lifecycle state of a {@link FetchedResultsController}.
 *
 * @author RowDelta Authors
 */
public enum ControllerState {
    /** Built, but no fetch has succeeded yet. */
    UNINITIALIZED,

    /** Fetched and subscribed; no change batch processed since the fetch. */
    FETCHED,

    /** Fetched, and at least one change batch has been processed. */
    OBSERVING,

    /** Processing a change batch. */
    DIFFING,

    /** Cache discarded; the next fetch or change batch rebuilds it. */
    RESET,

    /** Closed; no further operations are permitted. */
    CLOSED;

    /**
     * Returns true if read accessors see a fetched layout in this state.
     */
    public boolean isFetched() {
        return this == FETCHED || this == OBSERVING || this == DIFFING;
    }
}
