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
import java.util.Iterator;
import java.util.LinkedList;
import java.util.concurrent.CompletableFuture;

/**
 * An unbounded FIFO whose consumers wait with futures instead of threads.
 * <p>
 * Items are handed out in the order they were put.  Cancelling a future
 * returned by {@link #take()} gives up the wait without consuming anything;
 * the next item goes to the next live waiter or stays queued.
 *
 * @param <T> the item type
 */
public class AsyncQueue<T> {

    /** Converts a dequeued item into the value a waiter completes with. */
    public interface Decoder<T, R> {
        R decode(T item) throws BusException;
    }

    private final class Waiter<R> {

        private final CompletableFuture<R> future = new CompletableFuture<R>();

        private final Decoder<T, R> decoder;

        Waiter(Decoder<T, R> decoder) {
            this.decoder = decoder;
        }

        /** Returns false if the waiter went away and the item is still ours. */
        boolean offer(T item) {
            if (future.isDone()) {
                return false;
            }
            deliver(future, decoder, item);
            return true;
        }
    }

    /* LinkedList because signals without payload are queued as null. */
    private final Deque<T> items = new LinkedList<T>();

    private final Deque<Waiter<?>> waiters = new ArrayDeque<Waiter<?>>();

    /**
     * Puts an item.  Never waits.
     *
     * @param item the item
     */
    public void put(T item) {
        while (true) {
            Waiter<?> waiter;
            synchronized (this) {
                waiter = waiters.poll();
                if (waiter == null) {
                    items.add(item);
                    return;
                }
            }
            if (waiter.offer(item)) {
                return;
            }
        }
    }

    /**
     * Takes the next item.
     *
     * @return a future completed with the next item
     */
    public CompletableFuture<T> take() {
        return take(new Decoder<T, T>() {
            public T decode(T item) {
                return item;
            }
        });
    }

    /**
     * Takes the next item and converts it.  A decoding failure completes the
     * future exceptionally; the item is consumed either way.
     *
     * @param decoder the conversion
     * @return a future completed with the converted item
     */
    public <R> CompletableFuture<R> take(Decoder<T, R> decoder) {
        T item;
        synchronized (this) {
            if (items.isEmpty()) {
                for (Iterator<Waiter<?>> it = waiters.iterator(); it.hasNext();) {
                    if (it.next().future.isDone()) {
                        it.remove();
                    }
                }
                Waiter<R> waiter = new Waiter<R>(decoder);
                waiters.add(waiter);
                return waiter.future;
            }
            item = items.poll();
        }
        CompletableFuture<R> future = new CompletableFuture<R>();
        deliver(future, decoder, item);
        return future;
    }

    /** @return the number of queued items */
    public synchronized int size() {
        return items.size();
    }

    private static <T, R> void deliver(CompletableFuture<R> future, Decoder<T, R> decoder, T item) {
        R value;
        try {
            value = decoder.decode(item);
        } catch (BusException ex) {
            future.completeExceptionally(ex);
            return;
        } catch (RuntimeException ex) {
            future.completeExceptionally(ex);
            return;
        }
        future.complete(value);
    }
}
