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
 * Indicates that a no-argument method of a bus interface class is the getter
 * of a D-Bus property.  A setter may be attached with
 * {@link DbusPropertySetter}; without one the property is read-only.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface DbusProperty {

    /**
     * Override of property name.
     * The default property name is the getter name converted by
     * {@link org.jsdbus.NameConverter}, so {@code state()} is "State".
     */
    String name() default "";

    /** Signature of property. */
    String signature() default "";

    /**
     * Member flags.
     *
     * @see org.jsdbus.DbusFlags
     */
    int flags() default 0;
}
