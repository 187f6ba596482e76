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

package org.jsdbus.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a D-Bus signal.  The annotated field must be a
 * {@code static final String}; its value is the key the signal is looked up
 * with, e.g.
 * <pre>
 * &#64;DbusSignal(name = "StateChanged", signature = "s")
 * public static final String STATE_CHANGED = "state_changed";
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface DbusSignal {

    /** The D-Bus signal name. */
    String name();

    /** Signature of the signal payload. */
    String signature() default "";

    /** Names of the signal arguments. */
    String[] argNames() default {};

    /**
     * Member flags.
     *
     * @see org.jsdbus.DbusFlags
     */
    int flags() default 0;
}
