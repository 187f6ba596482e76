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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A signal bound to an object.
 * <p>
 * Subscribing to a signal of an object connected to a remote peer listens to
 * that peer's signals on the bus.  Subscribing on any other object listens
 * to {@link #emit} calls made on that same object, which is how served
 * objects can be exercised without a bus.
 *
 * @param <T> the payload type
 */
public class BoundSignal<T> extends BoundMember {

    private static final Logger log = LoggerFactory.getLogger(BoundSignal.class);

    private final SignalDescriptor descriptor;

    BoundSignal(SignalDescriptor descriptor, DbusInterfaceBase instance) {
        super(instance);
        this.descriptor = descriptor;
    }

    @Override
    public SignalDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * Subscribes to the signal.
     *
     * @return a new subscription; close it when done
     * @throws BusException if the signal has no interface name on a connected object
     */
    public SignalSubscription<T> subscribe() throws BusException {
        DbusInterfaceBase obj = getInstance();
        if (obj.isBound()) {
            CompletableFuture<AsyncQueue<Message>> queue =
                obj.getAttachedBus().getSignalQueueAsync(obj.getRemoteServiceName(),
                                                         obj.getRemoteObjectPath(),
                                                         requireInterfaceName(),
                                                         descriptor.getName());
            return new RemoteSubscription<T>(queue);
        }
        AsyncQueue<T> queue = new AsyncQueue<T>();
        obj.addLocalQueue(descriptor, queue);
        return new LocalSubscription<T>(obj, descriptor, queue);
    }

    /**
     * Emits the signal.  If the object is serving, a signal message is sent
     * on its bus.  Independently of that, the payload is delivered to every
     * open local subscription.
     *
     * @param value the payload; an {@code Object[]} carries several values
     *              when the signature holds more than one complete type
     * @throws BusException if the signal message cannot be sent
     */
    public void emit(T value) throws BusException {
        DbusInterfaceBase obj = getInstance();
        if (obj.hasActivatedInterfaces()) {
            emitMessage(obj, value);
        }
        for (AsyncQueue<Object> queue : obj.liveLocalQueues(descriptor)) {
            queue.put(value);
        }
    }

    private void emitMessage(DbusInterfaceBase obj, T value) throws BusException {
        String signature = descriptor.getSignature();
        Message signal = obj.getAttachedBus().newSignalMessage(obj.getServingObjectPath(),
                                                               requireInterfaceName(),
                                                               descriptor.getName());
        if (value instanceof Object[] && MemberDescriptor.completeTypeCount(signature) > 1) {
            signal.appendData(signature, (Object[]) value);
        } else if (value != null) {
            signal.appendData(signature, value);
        }
        log.debug("Emitting {}.{} from {}", descriptor.getInterfaceName(), descriptor.getName(),
                  obj.getServingObjectPath());
        signal.send();
    }

    @Override
    void addTo(ServedInterface served) {
        served.addSignal(descriptor.getName(), descriptor.getSignature(), descriptor.getArgNames(),
                         descriptor.getFlags());
    }

    private static final class LocalSubscription<T> extends SignalSubscription<T> {

        private final DbusInterfaceBase obj;

        private final SignalDescriptor signal;

        /* The object only holds the queue weakly; this keeps it alive. */
        private final AsyncQueue<T> queue;

        LocalSubscription(DbusInterfaceBase obj, SignalDescriptor signal, AsyncQueue<T> queue) {
            this.obj = obj;
            this.signal = signal;
            this.queue = queue;
        }

        @Override
        protected CompletableFuture<T> nextPayload() {
            return queue.take();
        }

        @Override
        protected void onClose() {
            obj.removeLocalQueue(signal, queue);
        }
    }

    private static final class RemoteSubscription<T> extends SignalSubscription<T> {

        private final AsyncQueue.Decoder<Message, T> decoder = new AsyncQueue.Decoder<Message, T>() {
            @SuppressWarnings(value = "unchecked")
            public T decode(Message message) throws BusException {
                return (T) message.getContents();
            }
        };

        /* Waits made before the engine handed out the queue, oldest first. */
        private final Deque<CompletableFuture<T>> early = new ArrayDeque<CompletableFuture<T>>();

        private AsyncQueue<Message> queue;

        private Throwable queueError;

        RemoteSubscription(CompletableFuture<AsyncQueue<Message>> queueFuture) {
            queueFuture.whenComplete(new BiConsumer<AsyncQueue<Message>, Throwable>() {
                public void accept(AsyncQueue<Message> q, Throwable error) {
                    arrived(q, error);
                }
            });
        }

        @Override
        protected synchronized CompletableFuture<T> nextPayload() {
            if (queueError != null) {
                return CompletableFuture.failedFuture(queueError);
            }
            if (queue != null) {
                return queue.take(decoder);
            }
            CompletableFuture<T> wait = new CompletableFuture<T>();
            early.add(wait);
            return wait;
        }

        private synchronized void arrived(AsyncQueue<Message> q, Throwable error) {
            if (error != null) {
                queueError = BusException.unwrap(error);
            } else {
                queue = q;
            }
            while (!early.isEmpty()) {
                CompletableFuture<T> wait = early.poll();
                if (queueError != null) {
                    wait.completeExceptionally(queueError);
                } else if (!wait.isDone()) {
                    forward(queue.take(decoder), wait);
                }
            }
        }

        /* Cancelling the wait withdraws the take so the queue keeps its item. */
        private static <T> void forward(final CompletableFuture<T> taken, final CompletableFuture<T> wait) {
            taken.whenComplete(new BiConsumer<T, Throwable>() {
                public void accept(T value, Throwable error) {
                    if (error != null) {
                        wait.completeExceptionally(error);
                    } else {
                        wait.complete(value);
                    }
                }
            });
            wait.whenComplete(new BiConsumer<T, Throwable>() {
                public void accept(T value, Throwable error) {
                    if (wait.isCancelled()) {
                        taken.cancel(false);
                    }
                }
            });
        }
    }
}
