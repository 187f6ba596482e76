/*
 * Copyright 2009-2011, Qualcomm Innovation Center, Inc.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package org.jsdbus;

import junit.framework.TestCase;

public class VariantTest extends TestCase {
    public VariantTest(String name) {
        super(name);
    }

    public void testGetObject() throws Exception {
        Variant v = new Variant("s", "five");
        assertEquals("s", v.getSignature());
        assertEquals("five", v.getObject());
        assertEquals("five", v.getObject(String.class));
    }

    public void testClassMismatch() {
        boolean thrown = false;
        try {
            new Variant("i", 1).getObject(String.class);
        } catch (MarshalBusException ex) {
            thrown = true;
        } finally {
            assertTrue(thrown);
        }
    }

    public void testEquality() {
        assertEquals(new Variant("i", 1), new Variant("i", 1));
        assertFalse(new Variant("i", 1).equals(new Variant("u", 1)));
        assertEquals(new Variant("(si)", new Object[] { "a", 1 }), new Variant("(si)", new Object[] { "a", 1 }));
        assertEquals(new Variant("(si)", new Object[] { "a", 1 }).hashCode(),
                     new Variant("(si)", new Object[] { "a", 1 }).hashCode());
    }
}
