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
 * Declaration related exceptions.  These are raised while a bus interface
 * class is described and make the class unusable.
 * This exception will occur if
 * <ul>
 * <li>a subclass redefines an inherited bus member without {@code @DbusOverload},
 * <li>a member is declared twice or carries more than one member annotation,
 * <li>a signal annotation is placed on something other than a {@code static final String},
 * <li>a property setter does not match a property of the same class,
 * <li>a default value cannot be converted to its parameter type.
 * </ul>
 */
public class AnnotationBusException extends BusException {

    /** Constructs a default AnnotationBusException. */
    public AnnotationBusException() {
        super();
    }

    /**
     * Constructs a AnnotationBusException with a user-defined message.
     *
     * @param msg user-defined message
     */
    public AnnotationBusException(String msg) {
        super(msg);
    }

    /**
     * Constructs a chained AnnotationBusException with a user-defined message.
     *
     * @param msg user-defined message
     * @param cause the cause of this exception
     */
    public AnnotationBusException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
