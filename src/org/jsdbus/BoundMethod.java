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

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A method bound to an object.
 * <p>
 * On an object connected to a remote peer a call is sent over the bus and
 * the future completes with the decoded reply.  On any other object the
 * Java implementation runs directly, without touching a bus.
 */
public class BoundMethod extends BoundMember {

    private static final Logger log = LoggerFactory.getLogger(BoundMethod.class);

    private final MethodDescriptor descriptor;

    BoundMethod(MethodDescriptor descriptor, DbusInterfaceBase instance) {
        super(instance);
        this.descriptor = descriptor;
    }

    @Override
    public MethodDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * Calls the method with positional arguments.  Missing trailing
     * arguments are filled from their declared defaults.
     *
     * @param args the positional arguments
     * @return the result: {@code null} for no result, the value for one and
     *         an {@code Object[]} for several
     * @throws BusException if the arguments cannot be resolved or the call
     *         cannot be sent
     */
    public <R> CompletableFuture<R> call(Object... args) throws BusException {
        return callKeywords(Collections.<String, Object>emptyMap(), args);
    }

    /**
     * Calls the method with positional and keyword arguments.
     *
     * @param keywordArgs arguments by name
     * @param args the positional arguments
     * @return the result
     * @throws ArgumentBusException if an argument cannot be resolved
     * @throws BusException if the call cannot be sent
     * @see #call(Object...)
     */
    public <R> CompletableFuture<R> callKeywords(Map<String, ?> keywordArgs, Object... args)
            throws BusException {
        Object[] resolved = (args.length == descriptor.getArgsCount() && keywordArgs.isEmpty())
            ? args
            : descriptor.rebuildArgs(args, keywordArgs);
        CompletableFuture<Object> result = getInstance().isBound()
            ? callDbus(resolved)
            : descriptor.invokeLocal(getInstance(), resolved);
        @SuppressWarnings(value = "unchecked")
        CompletableFuture<R> r = (CompletableFuture<R>) result;
        return r;
    }

    private CompletableFuture<Object> callDbus(Object[] args) throws BusException {
        DbusInterfaceBase obj = getInstance();
        Bus bus = obj.getAttachedBus();
        Message call = bus.newMethodCallMessage(obj.getRemoteServiceName(), obj.getRemoteObjectPath(),
                                                requireInterfaceName(), descriptor.getName());
        if (args.length > 0) {
            call.appendData(descriptor.getInputSignature(), args);
        }
        return bus.callAsync(call).thenCompose(REPLY_CONTENTS);
    }

    /**
     * Dispatches a method call received from the bus to the local
     * implementation and sends the reply.  The returned future always
     * completes normally: failures of the implementation are sent back to
     * the caller as error replies.
     *
     * @param request the incoming method call
     * @return completes when the reply has been sent
     */
    CompletableFuture<Void> callFromDbus(final Message request) {
        Object data;
        try {
            data = request.getContents();
        } catch (BusException ex) {
            replyError(request, ex);
            return CompletableFuture.completedFuture(null);
        }

        Object[] args;
        if (data == null) {
            args = new Object[0];
        } else if (data instanceof Object[] && descriptor.getArgsCount() > 1) {
            args = (Object[]) data;
        } else {
            args = new Object[] { data };
        }

        return descriptor.invokeLocal(getInstance(), args).handle(new BiFunction<Object, Throwable, Void>() {
            public Void apply(Object value, Throwable error) {
                if (error != null) {
                    replyError(request, BusException.unwrap(error));
                } else {
                    try {
                        reply(request, value);
                    } catch (BusException ex) {
                        replyError(request, ex);
                    }
                }
                return null;
            }
        });
    }

    private void reply(Message request, Object value) throws BusException {
        String signature = descriptor.getResultSignature();
        Message reply = request.createReply();
        if (value instanceof Object[] && MemberDescriptor.completeTypeCount(signature) > 1) {
            reply.appendData(signature, (Object[]) value);
        } else if (value != null) {
            reply.appendData(signature, value);
        }
        reply.send();
    }

    private void replyError(Message request, Throwable error) {
        String errorName;
        String errorMessage;
        if (error instanceof ErrorReplyBusException) {
            errorName = ((ErrorReplyBusException) error).getErrorName();
            errorMessage = ((ErrorReplyBusException) error).getErrorMessage();
        } else {
            errorName = ErrorReplyBusException.FAILED;
            errorMessage = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        }
        log.warn("{}.{} failed, replying with {}", descriptor.getInterfaceName(), descriptor.getName(),
                 errorName, error);
        try {
            request.createErrorReply(errorName, errorMessage).send();
        } catch (BusException ex) {
            log.error("Cannot send error reply for {}.{}", descriptor.getInterfaceName(),
                      descriptor.getName(), ex);
        }
    }

    @Override
    void addTo(ServedInterface served) {
        served.addMethod(descriptor.getName(), descriptor.getInputSignature(), descriptor.getArgsNames(),
                         descriptor.getResultSignature(), descriptor.getResultArgsNames(),
                         descriptor.getFlags(), new ServedInterface.MethodHandler() {
                             public CompletableFuture<Void> handle(Message request) {
                                 return callFromDbus(request);
                             }
                         });
    }
}
