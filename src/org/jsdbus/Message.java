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

/**
 * A message owned by the bus engine.  The framework only appends typed
 * arguments, decodes payloads, creates replies and sends.
 */
public interface Message {

    /**
     * Appends arguments typed by a wire signature.
     *
     * @param signature the signature of all appended values
     * @param values the values, one per complete type in the signature
     * @throws BusException if the values do not match the signature
     */
    void appendData(String signature, Object... values) throws BusException;

    /**
     * Decodes the payload.
     *
     * @return {@code null} for an empty payload, the value itself for a
     *         single complete type and an {@code Object[]} otherwise
     * @throws BusException if the payload cannot be decoded
     */
    Object getContents() throws BusException;

    /**
     * Creates the method return for this method call.
     *
     * @return the (unsent) reply
     * @throws BusException if this message does not expect a reply
     */
    Message createReply() throws BusException;

    /**
     * Creates an error reply for this method call.
     *
     * @param errorName the D-Bus error name
     * @param errorMessage the human-readable error message
     * @return the (unsent) error reply
     * @throws BusException if this message does not expect a reply
     */
    Message createErrorReply(String errorName, String errorMessage) throws BusException;

    /**
     * Sends this message.
     *
     * @throws BusException if the message could not be queued
     */
    void send() throws BusException;

    /** @return {@code true} for error replies */
    boolean isError();

    /** @return the error name of an error reply */
    String getErrorName();

    /** @return the error message of an error reply */
    String getErrorMessage();

    /** @return the object path header field */
    String getPath();

    /** @return the interface header field */
    String getInterface();

    /** @return the member header field */
    String getMember();
}
