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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.rowdelta.cache.LayoutCache;
import org.rowdelta.cache.LayoutStore;
import org.rowdelta.cache.map.MapLayoutStore;
import org.rowdelta.spi.RowIdentityFactory;

/**
 * Builds {@link FetchedResultsController} instances. A query engine and a
 * fetch request with at least one order-by property are required.
 *
 * <pre>
 * FetchedResultsControllerBuilder&lt;Contact&gt; builder =
 *     new FetchedResultsControllerBuilder&lt;Contact&gt;();
 * builder.setQueryEngine(engine);
 * builder.setFetchRequest(FetchRequest.forType(Contact.class, "id").orderBy("group", "name"));
 * builder.setSectionNameKeyPath("group");
 * builder.setCacheName("contacts");
 * builder.setLayoutStore(new FileLayoutStore(new File("cache")));
 * FetchedResultsController&lt;Contact&gt; controller = builder.build();
 * </pre>
 *
 * <p>Without a cache name, the controller keeps its layout in a private
 * in-memory store.
 *
 * @author RowDelta Authors
 */
public class FetchedResultsControllerBuilder<S> {
    private static final AtomicLong cPrivateCacheCount = new AtomicLong();

    /**
     * Returns the configuration signature under which a layout is cached. A
     * cached layout is only adopted by a controller with the same signature.
     */
    public static String signature(FetchRequest<?> request, String sectionNameKeyPath) {
        return request + " sectionNameKeyPath=" + sectionNameKeyPath;
    }

    private final Log mLog = LogFactory.getLog(getClass());

    private QueryEngine<S> mEngine;
    private FetchRequest<S> mRequest;
    private String mSectionNameKeyPath;
    private String mCacheName;
    private LayoutStore mStore;
    private Executor mExecutor;

    public FetchedResultsControllerBuilder() {
    }

    /**
     * Builds a controller, which takes ownership of its cache name until
     * closed.
     *
     * @throws ConfigurationException if the settings are incomplete or
     * inconsistent
     * @throws CacheInUseException if the cache name is already open
     * @throws CacheIOException if the cache cannot be opened
     */
    public FetchedResultsController<S> build() throws ControllerException {
        assertReady();

        LayoutStore store;
        String name;
        if (mCacheName == null) {
            store = new MapLayoutStore();
            name = "private-" + cPrivateCacheCount.incrementAndGet();
        } else {
            store = mStore;
            name = mCacheName;
        }

        String signature = signature(mRequest, mSectionNameKeyPath);
        LayoutCache cache = store.open(name, signature);

        if (mLog.isDebugEnabled()) {
            mLog.debug("Building controller for " + mRequest + " with cache \"" + name + '"');
        }

        return new FetchedResultsController<S>(mEngine, mRequest, mSectionNameKeyPath,
                                               mCacheName, cache, mExecutor,
                                               new RowIdentityFactory<S>
                                               (mRequest, mSectionNameKeyPath));
    }

    public QueryEngine<S> getQueryEngine() {
        return mEngine;
    }

    public void setQueryEngine(QueryEngine<S> engine) {
        mEngine = engine;
    }

    public FetchRequest<S> getFetchRequest() {
        return mRequest;
    }

    public void setFetchRequest(FetchRequest<S> request) {
        mRequest = request;
    }

    public String getSectionNameKeyPath() {
        return mSectionNameKeyPath;
    }

    /**
     * Groups results into sections by the given property. It must be the
     * first order-by property of the fetch request. By default, results are
     * not grouped.
     */
    public void setSectionNameKeyPath(String keyPath) {
        mSectionNameKeyPath = keyPath;
    }

    public String getCacheName() {
        return mCacheName;
    }

    /**
     * Sets the name under which the layout is kept in the layout store. By
     * default, the layout is kept in a private in-memory store.
     */
    public void setCacheName(String name) {
        mCacheName = name;
    }

    public LayoutStore getLayoutStore() {
        return mStore;
    }

    public void setLayoutStore(LayoutStore store) {
        mStore = store;
    }

    public Executor getExecutor() {
        return mExecutor;
    }

    /**
     * Sets the context which processes change batches from the query engine.
     * By default, batches are processed by the thread which delivers them.
     */
    public void setExecutor(Executor executor) {
        mExecutor = executor;
    }

    /**
     * Throw a configuration exception if the configuration is not filled out
     * sufficiently and correctly such that a controller could be built from
     * it.
     */
    public final void assertReady() throws ConfigurationException {
        ArrayList<String> messages = new ArrayList<String>();
        errorCheck(messages);
        int size = messages.size();
        if (size == 0) {
            return;
        }
        StringBuilder b = new StringBuilder();
        if (size > 1) {
            b.append("Multiple problems: ");
        }
        for (int i=0; i<size; i++) {
            if (i > 0) {
                b.append("; ");
            }
            b.append(messages.get(i));
        }
        throw new ConfigurationException(b.toString());
    }

    /**
     * This method is called by assertReady. Subclasses may override to
     * perform additional checks. Be sure to call {@code super.errorCheck} as
     * well.
     *
     * @param messages add any error messages to this list
     */
    public void errorCheck(Collection<String> messages) throws ConfigurationException {
        if (mEngine == null) {
            messages.add("query engine missing");
        }

        if (mRequest == null) {
            messages.add("fetch request missing");
        } else {
            List<String> orderBy = mRequest.getOrderBy();
            if (orderBy.isEmpty()) {
                messages.add("sort descriptors missing");
            }

            RowIdentityFactory.errorCheck(mRequest, mSectionNameKeyPath, messages);

            if (mSectionNameKeyPath != null && !orderBy.isEmpty()) {
                String first = FetchRequest.propertyName(orderBy.get(0));
                if (!mSectionNameKeyPath.equals(first)) {
                    messages.add("section name key path \"" + mSectionNameKeyPath
                                 + "\" must be the first order-by property, not \""
                                 + first + '"');
                }
            }

            if (mEngine != null && mEngine.getObjectType() != mRequest.getObjectType()) {
                messages.add("query engine fetches " + mEngine.getObjectType().getName()
                             + ", but request is for " + mRequest.getObjectType().getName());
            }
        }

        if (mCacheName != null) {
            if (mCacheName.length() == 0) {
                messages.add("cache name is empty");
            }
            if (mStore == null) {
                messages.add("layout store missing for cache name \"" + mCacheName + '"');
            }
        } else if (mStore != null) {
            messages.add("layout store set without a cache name");
        }
    }
}
