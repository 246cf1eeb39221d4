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
 * Base class of every structural change reported to a {@link ChangeListener}.
 * The concrete events are {@link SectionChange.Insert}, {@link
 * SectionChange.Delete}, {@link RowChange.Insert}, {@link RowChange.Delete},
 * {@link RowChange.Move} and {@link RowChange.Update}. Each carries only the
 * fields which apply to it; use a {@link ChangeVisitor} to dispatch on the
 * concrete type.
 *
 * <p>Index paths carried by an event are valid against the layout as it is
 * after all earlier events of the same batch have been applied. Applying the
 * events of a batch in order, with {@link
 * org.rowdelta.layout.MutableLayout#apply MutableLayout.apply}, turns the
 * previous layout into the new one.
 *
 * @author RowDelta Authors
 */
public abstract class ChangeEvent {
    ChangeEvent() {
    }

    public abstract ChangeType getType();

    /**
     * Calls the visit method of the given visitor which matches this event's
     * concrete type.
     */
    public abstract <R, P> R accept(ChangeVisitor<R, P> visitor, P param);
}
