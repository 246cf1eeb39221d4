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
 * Callback mechanism which receives the changes identified by a {@link
 * FetchedResultsController}. By default, the methods defined in this class do
 * nothing. Subclass and override the callbacks of interest, and then {@link
 * FetchedResultsController#addListener register} it. Listener
 * implementations are encouraged to override the equals method, to prevent
 * accidental double registration.
 *
 * <p>For each batch of changes, callbacks are invoked in this order:
 * willChangeContent, every didChangeSection (deletes before inserts), every
 * didChangeObject, then didChangeContent. Batches never interleave.
 *
 * <p>Changes are reported with the following heuristics:
 *
 * <ul>
 * <li>On insert and delete, only the inserted or deleted row is reported.
 * Rows after it are assumed to shift, but these shifts are not reported.
 *
 * <li>A move is reported when an attribute used by the sort descriptors of
 * the fetch request changed and the row's position changed with it. An update
 * of the row is assumed in this case, and no separate update is reported.
 *
 * <li>An update is reported when a row's state changed but its position did
 * not.
 * </ul>
 *
 * <p>Section and row changes are only computed if at least one registered
 * listener overrides {@link #didChangeSection} or {@link #didChangeObject}.
 *
 * <p>Any exception thrown by a callback is passed to the caller of the
 * operation which triggered the batch. The controller's cache already
 * reflects the new layout at that point; call {@link
 * FetchedResultsController#reset reset} and reload the presentation.
 *
 * @author RowDelta Authors
 */
public abstract class ChangeListener<S> {
    /**
     * Called before the first change of a batch is reported.
     *
     * @param controller controller which noticed the change
     */
    public void willChangeContent(FetchedResultsController<? extends S> controller) {
    }

    /**
     * Called for every section insert or delete, before any row changes of
     * the same batch.
     *
     * @param controller controller which noticed the change
     * @param change insert or delete of one section
     */
    public void didChangeSection(FetchedResultsController<? extends S> controller,
                                 SectionChange change)
    {
    }

    /**
     * Called for every row insert, delete, move or update.
     *
     * @param controller controller which noticed the change
     * @param change change of one row
     */
    public void didChangeObject(FetchedResultsController<? extends S> controller,
                                RowChange change)
    {
    }

    /**
     * Called after the last change of a batch is reported.
     *
     * @param controller controller which noticed the change
     */
    public void didChangeContent(FetchedResultsController<? extends S> controller) {
    }
}
