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

package org.rowdelta.logging;

import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import org.rowdelta.FetchRequest;
import org.rowdelta.FetchedResultsController;
import org.rowdelta.FetchedResultsControllerBuilder;
import org.rowdelta.cache.map.MapLayoutStore;
import org.rowdelta.stored.Contact;
import org.rowdelta.toy.ToyQueryEngine;

/**
 * Tests for LoggingChangeListener.
 *
 * @author RowDelta Authors
 */
public class TestLoggingChangeListener extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestLoggingChangeListener.class);
    }

    public TestLoggingChangeListener(String name) {
        super(name);
    }

    private ToyQueryEngine<Contact> mEngine;
    private CapturingLog mLog;

    @Override
    protected void setUp() throws Exception {
        mEngine = new ToyQueryEngine<Contact>(Contact.class, "id");
        mEngine.insert(new Contact(1, "A", "Ann", 1));
        mEngine.insert(new Contact(2, "A", "Bob", 2));
        mLog = new CapturingLog();
    }

    public void testMessages() throws Exception {
        FetchedResultsController<Contact> controller = build("contacts");
        controller.addListener(new LoggingChangeListener<Object>(mLog));
        assertTrue(controller.performFetch());

        Contact bob = mEngine.get(2L).copy();
        bob.setRank(0);
        mEngine.update(bob);
        mEngine.insert(new Contact(3, "B", "Cid", 1));

        assertEquals("willChangeContent on contacts", mLog.mMessages.get(0));
        assertEquals("Row.move(2) from (0, 1) to (0, 0) on contacts", mLog.mMessages.get(1));
        assertEquals("didChangeContent on contacts, now 1 sections", mLog.mMessages.get(2));
        assertEquals("willChangeContent on contacts", mLog.mMessages.get(3));
        assertEquals("Section.insert(\"B\") at 1 on contacts", mLog.mMessages.get(4));
        assertEquals("Row.insert(3) at (1, 0) on contacts", mLog.mMessages.get(5));
        assertEquals("didChangeContent on contacts, now 2 sections", mLog.mMessages.get(6));
        assertEquals(7, mLog.mMessages.size());

        controller.close();
    }

    public void testPrivateCacheUsesTypeName() throws Exception {
        FetchedResultsController<Contact> controller = build(null);
        controller.addListener(new LoggingChangeListener<Contact>(mLog));
        controller.performFetch();

        mEngine.delete(1L);

        assertEquals("Row.delete(1) at (0, 0) on " + Contact.class.getName(),
                     mLog.mMessages.get(1));
        controller.close();
    }

    public void testDisabled() throws Exception {
        FetchedResultsController<Contact> controller = build(null);
        mLog.mEnabled = false;
        controller.addListener(new LoggingChangeListener<Contact>(mLog));
        controller.performFetch();
        mEngine.delete(1L);
        assertTrue(mLog.mMessages.isEmpty());
        controller.close();
    }

    public void testDefaultLog() throws Exception {
        FetchedResultsController<Contact> controller = build(null);
        controller.addListener(new LoggingChangeListener<Contact>());
        controller.performFetch();
        mEngine.delete(1L);
        assertEquals(1, controller.numberOfRows(0));
        controller.close();
    }

    private FetchedResultsController<Contact> build(String cacheName) throws Exception {
        FetchedResultsControllerBuilder<Contact> builder =
            new FetchedResultsControllerBuilder<Contact>();
        builder.setQueryEngine(mEngine);
        builder.setFetchRequest(FetchRequest.forType(Contact.class, "id")
                                .orderBy("group", "rank"));
        builder.setSectionNameKeyPath("group");
        if (cacheName != null) {
            builder.setCacheName(cacheName);
            builder.setLayoutStore(new MapLayoutStore());
        }
        return builder.build();
    }

    private static class CapturingLog implements Log {
        final List<String> mMessages = new ArrayList<String>();
        boolean mEnabled = true;

        public boolean isEnabled() {
            return mEnabled;
        }

        public void write(String message) {
            mMessages.add(message);
        }
    }
}
