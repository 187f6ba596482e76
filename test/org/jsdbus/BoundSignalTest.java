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

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import junit.framework.TestCase;

public class BoundSignalTest extends TestCase {
    public BoundSignalTest(String name) {
        super(name);
    }

    private static final String PATH = "/org/jsdbus/test";

    /** Hands out signal queues only when told to. */
    static class DeferredQueueBus extends FakeBus {
        private final CompletableFuture<AsyncQueue<Message>> pending =
            new CompletableFuture<AsyncQueue<Message>>();

        private AsyncQueue<Message> queue;

        @Override
        public CompletableFuture<AsyncQueue<Message>> getSignalQueueAsync(String senderName, String objectPath,
                                                                          String interfaceName, String signalName) {
            queue = super.getSignalQueueAsync(senderName, objectPath, interfaceName, signalName).join();
            return pending;
        }

        void handOut() {
            pending.complete(queue);
        }

        void failHandOut(Throwable error) {
            pending.completeExceptionally(error);
        }
    }

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

    private static <T> T next(SignalSubscription<T> subscription) throws Exception {
        return subscription.next().get(5, TimeUnit.SECONDS);
    }

    public void testLocalEmitWithoutBus() throws Exception {
        ExampleInterface obj = new ExampleInterface();
        try (SignalSubscription<String> changes = obj.<String>signal(ExampleInterface.NAME_CHANGED).subscribe()) {
            obj.property("name").setSync("first");
            obj.<String>signal(ExampleInterface.NAME_CHANGED).emit("second");
            assertEquals("first", next(changes));
            assertEquals("second", next(changes));
        }
    }

    public void testServedEmitSendsOneMessage() throws Exception {
        SignalSubscription<String> local = server.<String>signal(ExampleInterface.NAME_CHANGED).subscribe();
        server.<String>signal(ExampleInterface.NAME_CHANGED).emit("hello");

        List<FakeMessage> signals = bus.getSent(FakeMessage.Kind.SIGNAL);
        assertEquals(1, signals.size());
        FakeMessage signal = signals.get(0);
        assertEquals(PATH, signal.getPath());
        assertEquals("org.jsdbus.test.Example", signal.getInterface());
        assertEquals("NameChanged", signal.getMember());
        assertEquals("s", signal.getSignature());
        assertEquals(Arrays.<Object>asList("hello"), signal.getBody());

        assertEquals("hello", next(local));
        local.close();
    }

    public void testMultipleValues() throws Exception {
        SignalSubscription<Object[]> local = server.<Object[]>signal(ExampleInterface.TICK).subscribe();
        server.<Object[]>signal(ExampleInterface.TICK).emit(new Object[] { "tock", 7 });

        FakeMessage signal = bus.getSent(FakeMessage.Kind.SIGNAL).get(0);
        assertEquals("Tick", signal.getMember());
        assertEquals(Arrays.<Object>asList("tock", 7), signal.getBody());
        assertTrue(Arrays.equals(new Object[] { "tock", 7 }, next(local)));
    }

    public void testNoPayload() throws Exception {
        SignalSubscription<Object> local = server.signal(ExampleInterface.RESET).subscribe();
        server.signal(ExampleInterface.RESET).emit(null);

        FakeMessage signal = bus.getSent(FakeMessage.Kind.SIGNAL).get(0);
        assertEquals("Reset", signal.getMember());
        assertTrue(signal.getBody().isEmpty());
        assertNull(next(local));
    }

    public void testClosedSubscriptionIsDropped() throws Exception {
        BoundSignal<String> changed = server.signal(ExampleInterface.NAME_CHANGED);
        SignalSubscription<String> first = changed.subscribe();
        SignalSubscription<String> second = changed.subscribe();
        first.close();
        assertTrue(first.isClosed());

        changed.emit("after close");
        assertEquals("after close", next(second));
        assertEquals(1, server.liveLocalQueues(changed.getDescriptor()).size());

        try {
            first.next().get();
            fail("expected a closed subscription to fail");
        } catch (ExecutionException ex) {
            assertTrue(ex.getCause() instanceof BusException);
        }
    }

    public void testCollectedQueueLeavesFanOut() throws Exception {
        BoundSignal<String> changed = server.signal(ExampleInterface.NAME_CHANGED);
        server.addLocalQueue(changed.getDescriptor(), new AsyncQueue<String>());

        for (int i = 0; i < 100 && !server.liveLocalQueues(changed.getDescriptor()).isEmpty(); ++i) {
            System.gc();
            Thread.sleep(10);
        }
        assertTrue(server.liveLocalQueues(changed.getDescriptor()).isEmpty());

        changed.emit("nobody listens");
        assertEquals(1, bus.getSent(FakeMessage.Kind.SIGNAL).size());
    }

    public void testSubscriptionsHaveTheirOwnBacklog() throws Exception {
        BoundSignal<String> changed = server.signal(ExampleInterface.NAME_CHANGED);
        SignalSubscription<String> early = changed.subscribe();
        changed.emit("one");
        SignalSubscription<String> late = changed.subscribe();
        changed.emit("two");

        assertEquals("one", next(early));
        assertEquals("two", next(early));
        assertEquals("two", next(late));
    }

    public void testRemoteSubscription() throws Exception {
        SignalSubscription<String> changes = proxy.<String>signal(ExampleInterface.NAME_CHANGED).subscribe();
        server.property("name").setSync("a");
        server.property("name").setSync("b");
        assertEquals("a", next(changes));
        assertEquals("b", next(changes));
        changes.close();
    }

    public void testRemoteMultipleValues() throws Exception {
        SignalSubscription<Object[]> ticks = proxy.<Object[]>signal(ExampleInterface.TICK).subscribe();
        server.<Object[]>signal(ExampleInterface.TICK).emit(new Object[] { "tock", 7 });
        assertTrue(Arrays.equals(new Object[] { "tock", 7 }, next(ticks)));
    }

    public void testProxyEmitDoesNotReachTheBus() throws Exception {
        proxy.<String>signal(ExampleInterface.NAME_CHANGED).emit("local only");
        assertTrue(bus.getSent(FakeMessage.Kind.SIGNAL).isEmpty());
    }

    public void testCancelledWaitLosesNothing() throws Exception {
        SignalSubscription<String> local = server.<String>signal(ExampleInterface.NAME_CHANGED).subscribe();
        SignalSubscription<String> remote = proxy.<String>signal(ExampleInterface.NAME_CHANGED).subscribe();

        CompletableFuture<String> abandoned = local.next();
        CompletableFuture<String> abandonedRemote = remote.next();
        abandoned.cancel(true);
        abandonedRemote.cancel(true);

        server.<String>signal(ExampleInterface.NAME_CHANGED).emit("kept");
        assertEquals("kept", next(local));
        assertEquals("kept", next(remote));
    }

    public void testSingleArrayPayload() throws Exception {
        SignalSubscription<Object[]> local = server.<Object[]>signal(ExampleInterface.NAMES).subscribe();
        SignalSubscription<Object[]> remote = proxy.<Object[]>signal(ExampleInterface.NAMES).subscribe();
        server.<Object[]>signal(ExampleInterface.NAMES).emit(new Object[] { "a", "b", "c" });

        FakeMessage signal = bus.getSent(FakeMessage.Kind.SIGNAL).get(0);
        assertEquals("as", signal.getSignature());
        assertEquals(1, signal.getBody().size());
        assertTrue(Arrays.equals(new Object[] { "a", "b", "c" }, next(local)));
        assertTrue(Arrays.equals(new Object[] { "a", "b", "c" }, next(remote)));
    }

    public void testWaitsBeforeQueueKeepTheirOrder() throws Exception {
        DeferredQueueBus deferred = new DeferredQueueBus();
        ExampleInterface served = new ExampleInterface();
        served.startServing(deferred, PATH);
        ExampleInterface remote = DbusInterfaceBase.newProxy(ExampleInterface.class, deferred,
                                                             "org.jsdbus.test", PATH);

        SignalSubscription<String> changes = remote.<String>signal(ExampleInterface.NAME_CHANGED).subscribe();
        CompletableFuture<String> first = changes.next();
        CompletableFuture<String> second = changes.next();
        CompletableFuture<String> third = changes.next();
        assertFalse(first.isDone());

        deferred.handOut();
        served.<String>signal(ExampleInterface.NAME_CHANGED).emit("1");
        served.<String>signal(ExampleInterface.NAME_CHANGED).emit("2");
        served.<String>signal(ExampleInterface.NAME_CHANGED).emit("3");

        assertEquals("1", first.get(5, TimeUnit.SECONDS));
        assertEquals("2", second.get(5, TimeUnit.SECONDS));
        assertEquals("3", third.get(5, TimeUnit.SECONDS));
    }

    public void testSignalsBeforeQueueKeepTheirOrder() throws Exception {
        DeferredQueueBus deferred = new DeferredQueueBus();
        ExampleInterface served = new ExampleInterface();
        served.startServing(deferred, PATH);
        ExampleInterface remote = DbusInterfaceBase.newProxy(ExampleInterface.class, deferred,
                                                             "org.jsdbus.test", PATH);

        SignalSubscription<String> changes = remote.<String>signal(ExampleInterface.NAME_CHANGED).subscribe();
        CompletableFuture<String> first = changes.next();
        CompletableFuture<String> second = changes.next();
        served.<String>signal(ExampleInterface.NAME_CHANGED).emit("1");
        served.<String>signal(ExampleInterface.NAME_CHANGED).emit("2");
        served.<String>signal(ExampleInterface.NAME_CHANGED).emit("3");

        deferred.handOut();
        assertEquals("1", first.get(5, TimeUnit.SECONDS));
        assertEquals("2", second.get(5, TimeUnit.SECONDS));
        assertEquals("3", next(changes));
    }

    public void testCancelledWaitBeforeQueueLosesNothing() throws Exception {
        DeferredQueueBus deferred = new DeferredQueueBus();
        ExampleInterface served = new ExampleInterface();
        served.startServing(deferred, PATH);
        ExampleInterface remote = DbusInterfaceBase.newProxy(ExampleInterface.class, deferred,
                                                             "org.jsdbus.test", PATH);

        SignalSubscription<String> changes = remote.<String>signal(ExampleInterface.NAME_CHANGED).subscribe();
        CompletableFuture<String> abandoned = changes.next();
        CompletableFuture<String> kept = changes.next();
        abandoned.cancel(true);

        deferred.handOut();
        served.<String>signal(ExampleInterface.NAME_CHANGED).emit("kept");
        assertEquals("kept", kept.get(5, TimeUnit.SECONDS));
        assertTrue(abandoned.isCancelled());
    }

    public void testRefusedQueueFailsWaits() throws Exception {
        DeferredQueueBus deferred = new DeferredQueueBus();
        ExampleInterface remote = DbusInterfaceBase.newProxy(ExampleInterface.class, deferred,
                                                             "org.jsdbus.test", PATH);

        SignalSubscription<String> changes = remote.<String>signal(ExampleInterface.NAME_CHANGED).subscribe();
        CompletableFuture<String> early = changes.next();
        deferred.failHandOut(new BusException("match rule refused"));

        boolean thrown = false;
        try {
            early.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException ex) {
            assertTrue(ex.getCause() instanceof BusException);
            thrown = true;
        } finally {
            assertTrue(thrown);
        }

        thrown = false;
        try {
            changes.next().get(5, TimeUnit.SECONDS);
        } catch (ExecutionException ex) {
            assertEquals("match rule refused", ex.getCause().getMessage());
            thrown = true;
        } finally {
            assertTrue(thrown);
        }
    }
}
