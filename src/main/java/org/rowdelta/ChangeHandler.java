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
 * Receives raw object-level change batches from a {@link QueryEngine}.
 *
 * @author RowDelta Authors
 */
public interface ChangeHandler<S> {
    /**
     * Called once per batch of committed changes.
     *
     * @throws ControllerException if the handler fails to process the batch;
     * the store's change is already committed at this point
     */
    void objectsChanged(ObjectChanges<S> changes) throws ControllerException;
}
