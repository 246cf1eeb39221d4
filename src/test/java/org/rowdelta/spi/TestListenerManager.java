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

package org.rowdelta.spi;

import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import org.rowdelta.ChangeListener;
import org.rowdelta.FetchedResultsController;
import org.rowdelta.IndexPath;
import org.rowdelta.RowChange;
import org.rowdelta.RowIdentity;
import org.rowdelta.SectionChange;
import org.rowdelta.layout.LayoutSection;
import org.rowdelta.stored.Contact;

/**
 * Tests for ListenerManager.
 *
 * @author RowDelta Authors
 */
public class TestListenerManager extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestListenerManager.class);
    }

    public TestListenerManager(String name) {
        super(name);
    }

    List<String> mCalls;

    @Override
    protected void setUp() {
        mCalls = new ArrayList<String>();
    }

    public void testAddAndRemove() {
        ListenerManager<Contact> set = new ListenerManager<Contact>();
        ChangeListener<Contact> listener = new RecordingListener<Contact>("a");

        assertTrue(set.isEmpty());
        assertFalse(set.isTrackingChanges());

        assertTrue(set.addListener(listener));
        assertFalse(set.isEmpty());
        assertTrue(set.isTrackingChanges());

        assertFalse(set.addListener(listener));
        assertEquals(1, set.size());

        assertTrue(set.removeListener(listener));
        assertTrue(set.isEmpty());
        assertFalse(set.isTrackingChanges());
        assertFalse(set.removeListener(listener));

        try {
            set.addListener(null);
            fail();
        } catch (IllegalArgumentException e) {
        }
    }

    public void testContentOnlyListener() {
        ListenerManager<Contact> set = new ListenerManager<Contact>();
        set.addListener(new ChangeListener<Object>() {
            @Override
            public void didChangeContent(FetchedResultsController<? extends Object> c) {
                mCalls.add("did");
            }
        });

        assertFalse(set.isEmpty());
        assertFalse(set.isTrackingChanges());

        set.willChangeContent(null);
        set.didChangeObject(null, update());
        set.didChangeContent(null);
        assertEquals("[did]", mCalls.toString());
    }

    public void testSectionOnlyListenerTracksChanges() {
        ListenerManager<Contact> set = new ListenerManager<Contact>();
        set.addListener(new ChangeListener<Contact>() {
            @Override
            public void didChangeSection(FetchedResultsController<? extends Contact> c,
                                         SectionChange change)
            {
                mCalls.add("section " + change.getSectionName());
            }
        });
        assertTrue(set.isTrackingChanges());
    }

    public void testDispatchOrder() {
        ListenerManager<Contact> set = new ListenerManager<Contact>();
        RecordingListener<Contact> a = new RecordingListener<Contact>("a");
        RecordingListener<Object> b = new RecordingListener<Object>("b");
        set.addListener(a);
        set.addListener(b);

        LayoutSection section = new LayoutSection("A", new ArrayList<RowIdentity>());
        set.willChangeContent(null);
        set.didChangeSection(null, new SectionChange.Insert(section, 0));
        set.didChangeObject(null, update());
        set.didChangeContent(null);

        assertEquals("[a will, b will, a section, b section, a object, b object, a did, b did]",
                     mCalls.toString());

        set.removeAllListeners();
        assertTrue(set.isEmpty());
        set.didChangeContent(null);
        assertEquals(8, mCalls.size());
    }

    public void testRemoveDuringDispatch() {
        final ListenerManager<Contact> set = new ListenerManager<Contact>();
        final RecordingListener<Contact> b = new RecordingListener<Contact>("b");
        set.addListener(new ChangeListener<Contact>() {
            @Override
            public void willChangeContent(FetchedResultsController<? extends Contact> c) {
                mCalls.add("a will");
                set.removeListener(b);
            }
        });
        set.addListener(b);

        set.willChangeContent(null);
        assertEquals("[a will, b will]", mCalls.toString());
        set.willChangeContent(null);
        assertEquals("[a will, b will, a will]", mCalls.toString());
    }

    private static RowChange update() {
        RowIdentity row = RowIdentity.restored(1L, "A");
        return new RowChange.Update(row, IndexPath.of(0, 0));
    }

    private class RecordingListener<S> extends ChangeListener<S> {
        private final String mName;

        RecordingListener(String name) {
            mName = name;
        }

        @Override
        public void willChangeContent(FetchedResultsController<? extends S> c) {
            mCalls.add(mName + " will");
        }

        @Override
        public void didChangeSection(FetchedResultsController<? extends S> c,
                                     SectionChange change)
        {
            mCalls.add(mName + " section");
        }

        @Override
        public void didChangeObject(FetchedResultsController<? extends S> c, RowChange change) {
            mCalls.add(mName + " object");
        }

        @Override
        public void didChangeContent(FetchedResultsController<? extends S> c) {
            mCalls.add(mName + " did");
        }
    }
}
