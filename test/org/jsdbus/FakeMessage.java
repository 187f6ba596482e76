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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A message of {@link FakeBus}.  Arguments are kept as appended, the
 * signature strings are concatenated.
 */
public class FakeMessage implements Message {

    public enum Kind { METHOD_CALL, PROPERTY_GET, PROPERTY_SET, METHOD_RETURN, ERROR, SIGNAL }

    private final FakeBus bus;
    private final Kind kind;
    private final String destination;
    private final String path;
    private final String iface;
    private final String member;
    private final FakeMessage call;

    private final StringBuilder signature = new StringBuilder();
    private final List<Object> body = new ArrayList<Object>();

    private String errorName;
    private String errorMessage;

    CompletableFuture<Message> pendingReply;

    FakeMessage(FakeBus bus, Kind kind, String destination, String path, String iface, String member,
                FakeMessage call) {
        this.bus = bus;
        this.kind = kind;
        this.destination = destination;
        this.path = path;
        this.iface = iface;
        this.member = member;
        this.call = call;
    }

    public void appendData(String sig, Object... values) throws BusException {
        if (values.length == 0) {
            throw new MarshalBusException("Nothing to append for signature '" + sig + "'");
        }
        signature.append(sig);
        Collections.addAll(body, values);
    }

    public Object getContents() {
        if (body.isEmpty()) {
            return null;
        }
        return body.size() == 1 ? body.get(0) : body.toArray();
    }

    public Message createReply() throws BusException {
        return reply(Kind.METHOD_RETURN);
    }

    public Message createErrorReply(String name, String message) throws BusException {
        FakeMessage reply = reply(Kind.ERROR);
        reply.errorName = name;
        reply.errorMessage = message;
        return reply;
    }

    private FakeMessage reply(Kind replyKind) throws BusException {
        if (kind != Kind.METHOD_CALL && kind != Kind.PROPERTY_GET && kind != Kind.PROPERTY_SET) {
            throw new BusException(kind + " messages expect no reply");
        }
        return new FakeMessage(bus, replyKind, null, path, iface, member, this);
    }

    public void send() throws BusException {
        bus.send(this);
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    public String getErrorName() {
        return errorName;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getPath() {
        return path;
    }

    public String getInterface() {
        return iface;
    }

    public String getMember() {
        return member;
    }

    public Kind getKind() {
        return kind;
    }

    public String getDestination() {
        return destination;
    }

    public String getSignature() {
        return signature.toString();
    }

    public List<Object> getBody() {
        return Collections.unmodifiableList(body);
    }

    /** @return the call this message replies to */
    public FakeMessage getCall() {
        return call;
    }

    @Override
    public String toString() {
        return kind + " " + path + " " + iface + "." + member + " " + body;
    }
}
