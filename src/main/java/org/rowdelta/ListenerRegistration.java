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
 * Handle returned when a {@link ChangeListener} is registered. The controller
 * keeps the listener until the handle is unregistered or the controller is
 * closed.
 *
 * @author RowDelta Authors
 */
public interface ListenerRegistration {
    /**
     * Stops delivery of changes to the listener. Calling this more than once
     * has no further effect.
     */
    void unregister();
}
