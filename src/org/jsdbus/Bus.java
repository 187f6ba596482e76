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
 * A connection to a message bus, provided by a bus engine.
 * <p>
 * The engine owns framing, marshalling, transport and its event loop.
 * Everything that waits on the bus is expressed as a future; none of these
 * operations may block the calling thread.
 *
 * @see DefaultBus
 */
public interface Bus {

    /**
     * Creates a method call message.
     *
     * @param destination well-known or unique bus name of the remote peer
     * @param objectPath object path of the remote object
     * @param interfaceName the interface the method belongs to
     * @param methodName the method name
     * @return the (unsent) method call
     * @throws BusException if the message could not be created
     */
    Message newMethodCallMessage(String destination, String objectPath, String interfaceName,
                                 String methodName) throws BusException;

    /**
     * Creates an org.freedesktop.DBus.Properties.Get call.  The reply
     * carries the value as a single {@link Variant}.
     *
     * @param destination well-known or unique bus name of the remote peer
     * @param objectPath object path of the remote object
     * @param interfaceName the interface the property belongs to
     * @param propertyName the property name
     * @return the (unsent) method call
     * @throws BusException if the message could not be created
     */
    Message newPropertyGetMessage(String destination, String objectPath, String interfaceName,
                                  String propertyName) throws BusException;

    /**
     * Creates an org.freedesktop.DBus.Properties.Set call.  The caller
     * appends the new value as a {@link Variant} with signature "v".
     *
     * @param destination well-known or unique bus name of the remote peer
     * @param objectPath object path of the remote object
     * @param interfaceName the interface the property belongs to
     * @param propertyName the property name
     * @return the (unsent) method call
     * @throws BusException if the message could not be created
     */
    Message newPropertySetMessage(String destination, String objectPath, String interfaceName,
                                  String propertyName) throws BusException;

    /**
     * Creates a broadcast signal message.
     *
     * @param objectPath object path of the emitting object
     * @param interfaceName the interface the signal belongs to
     * @param signalName the signal name
     * @return the (unsent) signal
     * @throws BusException if the message could not be created
     */
    Message newSignalMessage(String objectPath, String interfaceName, String signalName)
        throws BusException;

    /**
     * Sends a method call and waits for exactly one reply.  Error replies
     * complete the future normally; the caller inspects
     * {@link Message#isError()}.
     *
     * @param message the method call
     * @return the reply
     */
    CompletableFuture<Message> callAsync(Message message);

    /**
     * Subscribes to a signal.  Every call returns a new queue that receives
     * the matching signals in arrival order, starting from now.
     *
     * @param senderName bus name of the emitting peer
     * @param objectPath object path of the emitting object
     * @param interfaceName the interface the signal belongs to
     * @param signalName the signal name
     * @return the queue of incoming signal messages
     */
    CompletableFuture<AsyncQueue<Message>> getSignalQueueAsync(String senderName, String objectPath,
                                                               String interfaceName, String signalName);

    /**
     * Registers an interface table at an object path.  Incoming calls are
     * dispatched to the handlers of the table from then on.
     *
     * @param served the interface table
     * @param objectPath the object path
     * @param interfaceName the interface name
     * @throws BusException if the interface could not be registered
     */
    void addInterface(ServedInterface served, String objectPath, String interfaceName) throws BusException;
}
