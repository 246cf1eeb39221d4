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
import java.util.Arrays;
import java.util.List;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import org.rowdelta.FetchRequest;
import org.rowdelta.LayoutInvariantException;
import org.rowdelta.RowIdentity;
import org.rowdelta.stored.Contact;
import org.rowdelta.stored.Location;

/**
 * Tests for RowIdentityFactory.
 *
 * @author RowDelta Authors
 */
public class TestRowIdentityFactory extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestRowIdentityFactory.class);
    }

    public TestRowIdentityFactory(String name) {
        super(name);
    }

    public void testIdentify() {
        FetchRequest<Contact> request = FetchRequest.forType(Contact.class, "id")
            .orderBy("group", "-rank").track("note");
        RowIdentityFactory<Contact> factory = new RowIdentityFactory<Contact>(request, "group");

        Contact c = new Contact(7, "friends", "Ann", 3);
        c.setNote("hi");

        RowIdentity row = factory.identify(c);
        assertTrue(factory.isGrouped());
        assertEquals(7L, row.getId());
        assertEquals("friends", row.getSectionName());
        assertTrue(Arrays.equals(new Object[] {"friends", 3}, row.getSortValues()));
        assertTrue(Arrays.equals(new Object[] {"hi"}, row.getTrackedValues()));
        assertEquals(7L, factory.identityOf(c));

        Contact changed = c.copy();
        changed.setNote("bye");
        RowIdentity newer = factory.identify(changed);
        assertEquals(row, newer);
        assertFalse(row.isSortChanged(newer));
        assertTrue(row.isTrackedChanged(newer));

        changed.setRank(4);
        assertTrue(row.isSortChanged(factory.identify(changed)));
    }

    public void testUngroupedAndNullSection() {
        FetchRequest<Contact> request = FetchRequest.forType(Contact.class, "id").orderBy("name");

        RowIdentityFactory<Contact> ungrouped = new RowIdentityFactory<Contact>(request, null);
        assertFalse(ungrouped.isGrouped());
        assertNull(ungrouped.identify(new Contact(1, "g", "a", 0)).getSectionName());

        RowIdentityFactory<Contact> grouped = new RowIdentityFactory<Contact>(request, "group");
        assertEquals("", grouped.identify(new Contact(1, null, "a", 0)).getSectionName());
    }

    public void testDottedPath() {
        FetchRequest<Contact> request = FetchRequest.forType(Contact.class, "id")
            .orderBy("location.city", "name");
        RowIdentityFactory<Contact> factory =
            new RowIdentityFactory<Contact>(request, "location.city");

        Contact c = new Contact(1, "g", "a", 0);
        c.setLocation(new Location("Oslo"));
        assertEquals("Oslo", factory.identify(c).getSectionName());

        c.setLocation(null);
        RowIdentity row = factory.identify(c);
        assertEquals("", row.getSectionName());
        assertNull(row.getSortValues()[0]);
    }

    public void testNullIdentity() {
        FetchRequest<Contact> request = FetchRequest.forType(Contact.class, "name")
            .orderBy("name");
        RowIdentityFactory<Contact> factory = new RowIdentityFactory<Contact>(request, null);
        try {
            factory.identify(new Contact(1, "g", null, 0));
            fail();
        } catch (LayoutInvariantException e) {
        }
    }

    public void testErrorCheck() {
        List<String> messages = new ArrayList<String>();
        FetchRequest<Contact> request = FetchRequest.forType(Contact.class, "id")
            .orderBy("group", "-rank", "location.city");
        RowIdentityFactory.errorCheck(request, "group", messages);
        assertTrue(messages.toString(), messages.isEmpty());

        request = FetchRequest.forType(Contact.class, "key")
            .orderBy("+bogus", "location.zip").track("note", "secret");
        RowIdentityFactory.errorCheck(request, "nothing", messages);
        assertEquals(messages.toString(), 5, messages.size());
        assertTrue(messages.get(0).contains("identity property \"key\""));
        assertTrue(messages.get(1).contains("\"bogus\""));

        messages.clear();
        RowIdentityFactory.errorCheck(FetchRequest.forType(Contact.class, null), null, messages);
        assertEquals("[identity property is missing]", messages.toString());
    }

    public void testPropertyType() {
        assertEquals(long.class, RowIdentityFactory.propertyType(Contact.class, "id"));
        assertEquals(String.class, RowIdentityFactory.propertyType(Contact.class, "location.city"));
        assertNull(RowIdentityFactory.propertyType(Contact.class, "location.zip"));
        assertNull(RowIdentityFactory.propertyType(Contact.class, "missing"));
    }

    public void testUnreadableProperty() {
        FetchRequest<Contact> request = FetchRequest.forType(Contact.class, "id")
            .orderBy("missing");
        try {
            new RowIdentityFactory<Contact>(request, null);
            fail();
        } catch (IllegalArgumentException e) {
        }
    }
}
