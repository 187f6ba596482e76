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
 * Base class of jsdbus exceptions.
 */
public class BusException extends java.lang.Exception {

    /** Constructs a default BusException. */
    public BusException() {
        super();
    }

    /**
     * Constructs a BusException with a user-defined message.
     *
     * @param msg user-defined message
     */
    public BusException(String msg) {
        super(msg);
    }

    /**
     * Constructs a chained BusException with a user-defined message.
     *
     * @param msg user-defined message
     * @param cause the cause of this exception
     */
    public BusException(String msg, Throwable cause) {
        super(msg, cause);
    }

    /**
     * Unwraps the failure of a completed future or a reflective call down to
     * the exception the application code actually raised.
     *
     * @param th the wrapping throwable
     * @return the innermost meaningful cause
     */
    static Throwable unwrap(Throwable th) {
        while ((th instanceof java.util.concurrent.CompletionException
                || th instanceof java.util.concurrent.ExecutionException
                || th instanceof java.lang.reflect.InvocationTargetException)
               && th.getCause() != null) {
            th = th.getCause();
        }
        return th;
    }
}
