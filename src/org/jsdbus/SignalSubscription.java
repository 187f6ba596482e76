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

import java.util.concurrent.CompletableFuture;

/**
 * An endless, ordered stream of signal payloads received since the
 * subscription was made.  Each subscription has its own backlog.
 * <p>
 * Closing the subscription stops delivery to it.  Cancelling a future
 * returned by {@link #next()} only abandons that wait; no payload is lost.
 *
 * @param <T> the payload type
 * @see BoundSignal#subscribe()
 */
public abstract class SignalSubscription<T> implements AutoCloseable {

    private volatile boolean closed;

    /**
     * Waits for the next payload.
     *
     * @return the payload: the value for a single-value signal, an
     *         {@code Object[]} for several values
     */
    public final CompletableFuture<T> next() {
        if (closed) {
            return CompletableFuture.failedFuture(new BusException("Signal subscription is closed"));
        }
        return nextPayload();
    }

    protected abstract CompletableFuture<T> nextPayload();

    /** Called once, on the first {@link #close()}. */
    protected void onClose() {
    }

    /** Stops delivery to this subscription. */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            onClose();
        }
    }

    public boolean isClosed() {
        return closed;
    }
}
