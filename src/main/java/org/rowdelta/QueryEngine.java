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
 * Query capability a {@link FetchedResultsController} is built upon. A query
 * engine executes fetch requests against a live object store, loads single
 * objects by identity, and reports raw object-level changes to subscribers.
 *
 * <p>Query engine instances should be thread-safe. Change batches may be
 * delivered on any thread; the controller hands them to its owning context.
 *
 * @param <S> type of objects in the store
 * @author RowDelta Authors
 */
public interface QueryEngine<S> {
    /**
     * Returns the type of objects this engine fetches.
     */
    Class<S> getObjectType();

    /**
     * Executes the request, returning matching objects ordered by the
     * request's order-by properties. Objects which compare equal must be
     * returned in a stable order.
     *
     * @throws QueryExecutionException if the request is malformed or the
     * store fails
     */
    Cursor<S> execute(FetchRequest<S> request) throws QueryExecutionException;

    /**
     * Loads the live object with the given identity.
     *
     * @param request request whose identity property defines the identity
     * @param id value of the identity property
     * @return the object, or null if it no longer exists
     * @throws QueryExecutionException if the store fails
     */
    S tryLoad(FetchRequest<S> request, Object id) throws QueryExecutionException;

    /**
     * Registers a handler which receives batches of object-level changes
     * relevant to the request. Each committed change set of the store is
     * delivered as one batch.
     *
     * @return handle used to stop delivery
     * @throws QueryExecutionException if the subscription cannot be created
     */
    Subscription subscribe(FetchRequest<S> request, ChangeHandler<S> handler)
        throws QueryExecutionException;
}
