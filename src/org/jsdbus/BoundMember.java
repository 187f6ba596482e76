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
import java.util.function.Function;

/**
 * A member descriptor paired with the object it was looked up on.  Bound
 * members are transient: they are created on every lookup and hold no state
 * of their own, so two lookups on the same object behave identically and
 * lookups on different objects never affect each other.
 */
public abstract class BoundMember {

    /** Decodes a reply, see {@link #contentsOf(Message)}. */
    static final Function<Message, CompletableFuture<Object>> REPLY_CONTENTS =
        new Function<Message, CompletableFuture<Object>>() {
            public CompletableFuture<Object> apply(Message reply) {
                return contentsOf(reply);
            }
        };

    private final DbusInterfaceBase instance;

    BoundMember(DbusInterfaceBase instance) {
        this.instance = instance;
    }

    /** @return the owning object */
    public DbusInterfaceBase getInstance() {
        return instance;
    }

    /** @return the shared static definition */
    public abstract MemberDescriptor getDescriptor();

    /** Adds this member to the table of a served interface. */
    abstract void addTo(ServedInterface served);

    String requireInterfaceName() throws BusException {
        String name = getDescriptor().getInterfaceName();
        if (name == null) {
            throw new BusException(getDescriptor().getKey() + " is not part of a named interface");
        }
        return name;
    }

    /**
     * Decodes a reply, turning error replies into {@link ErrorReplyBusException}.
     */
    static CompletableFuture<Object> contentsOf(Message reply) {
        if (reply.isError()) {
            return CompletableFuture.failedFuture(
                new ErrorReplyBusException(reply.getErrorName(), reply.getErrorMessage()));
        }
        try {
            return CompletableFuture.completedFuture(reply.getContents());
        } catch (BusException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    @Override
    public String toString() {
        return getDescriptor() + " of " + instance.getClass().getName();
    }
}
