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
 * Indicates that a method of a bus interface class is a D-Bus method.
 * The same Java method is the local implementation and, once the object is
 * connected to a remote peer, the stub that forwards calls to it.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface DbusMethod {

    /**
     * Override of method name.
     * The default D-Bus method name is the Java method name converted by
     * {@link org.jsdbus.NameConverter}.
     */
    String name() default "";

    /** Input signature for method. */
    String inputSignature() default "";

    /** Output signature for method. */
    String resultSignature() default "";

    /**
     * Names of the input arguments.  Used to match keyword arguments.
     * The default is the parameter names recorded by the compiler.
     */
    String[] inputArgsNames() default {};

    /** Names of the output arguments. */
    String[] resultArgsNames() default {};

    /**
     * Member flags.
     *
     * @see org.jsdbus.DbusFlags
     */
    int flags() default 0;
}
