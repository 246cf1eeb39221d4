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
 * Dispatches on the concrete type of a {@link ChangeEvent}. Override the
 * visit methods of interest; the others return null.
 *
 * @param <R> return type of the visit methods
 * @param <P> type of the parameter passed along to each visit method
 * @author RowDelta Authors
 */
public abstract class ChangeVisitor<R, P> {
    public R visit(SectionChange.Insert change, P param) {
        return null;
    }

    public R visit(SectionChange.Delete change, P param) {
        return null;
    }

    public R visit(RowChange.Insert change, P param) {
        return null;
    }

    public R visit(RowChange.Delete change, P param) {
        return null;
    }

    public R visit(RowChange.Move change, P param) {
        return null;
    }

    public R visit(RowChange.Update change, P param) {
        return null;
    }
}
