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

import java.util.concurrent.ExecutionException;

import junit.framework.TestCase;

public class BoundPropertyTest extends TestCase {
    public BoundPropertyTest(String name) {
        super(name);
    }

    private static final String PATH = "/org/jsdbus/test";

    private FakeBus bus;

    private ExampleInterface server;

    private ExampleInterface proxy;

    @Override
    public void setUp() throws Exception {
        bus = new FakeBus();
        server = new ExampleInterface();
        server.startServing(bus, PATH);
        proxy = DbusInterfaceBase.newProxy(ExampleInterface.class, bus, "org.jsdbus.test", PATH);
    }

    public void testLocalGetAndSet() throws Exception {
        ExampleInterface obj = new ExampleInterface();
        BoundProperty<String> name = obj.property("name");
        assertEquals("example", name.getSync());
        assertEquals("example", name.getAsync().get());

        name.setSync("changed");
        assertEquals("changed", obj.getLocalName());
        name.setAsync("again").get();
        assertEquals("again", name.getSync());
    }

    public void testReadOnlyProperty() throws Exception {
        ExampleInterface obj = new ExampleInterface();
        BoundProperty<Integer> version = obj.property("version");
        assertEquals(Integer.valueOf(3), version.getSync());

        try {
            version.setSync(4);
            fail("expected NoSetterBusException");
        } catch (NoSetterBusException ex) {
            assertEquals("Version", ex.getPropertyName());
        }
        try {
            version.setAsync(4);
            fail("expected NoSetterBusException");
        } catch (NoSetterBusException ex) {
            assertEquals("Version", ex.getPropertyName());
        }
    }

    public void testProxyGet() throws Exception {
        server.property("name").setSync("served");
        assertEquals("served", proxy.<String>property("name").getAsync().get());
        assertEquals(Integer.valueOf(3), proxy.<Integer>property("version").getAsync().get());

        FakeMessage get = bus.getSent(FakeMessage.Kind.PROPERTY_GET).get(0);
        assertEquals("org.jsdbus.test.Example", get.getInterface());
        assertEquals("Name", get.getMember());
    }

    public void testProxySet() throws Exception {
        proxy.<String>property("name").setAsync("remote").get();
        assertEquals("remote", server.getLocalName());

        FakeMessage set = bus.getSent(FakeMessage.Kind.PROPERTY_SET).get(0);
        assertEquals("v", set.getSignature());
        assertEquals(new Variant("s", "remote"), set.getBody().get(0));
    }

    public void testSyncAccessOnProxyIsLocal() throws Exception {
        server.property("name").setSync("served");
        assertEquals("example", proxy.<String>property("name").getSync());

        proxy.<String>property("name").setSync("proxy side");
        assertEquals("served", server.getLocalName());
        assertTrue(bus.getSent(FakeMessage.Kind.PROPERTY_GET).isEmpty());
        assertTrue(bus.getSent(FakeMessage.Kind.PROPERTY_SET).isEmpty());
    }

    public void testProxySetOfReadOnlyProperty() throws Exception {
        try {
            proxy.<Integer>property("version").setAsync(4).get();
            fail("expected an error reply");
        } catch (ExecutionException ex) {
            ErrorReplyBusException error = (ErrorReplyBusException) ex.getCause();
            assertEquals("org.freedesktop.DBus.Error.PropertyReadOnly", error.getErrorName());
        }
    }

    public void testNotAProperty() throws Exception {
        boolean thrown = false;
        try {
            proxy.property("upper");
        } catch (BusException ex) {
            thrown = true;
        } finally {
            assertTrue(thrown);
        }
    }
}
