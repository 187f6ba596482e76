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
 * Names the D-Bus interface that the members declared directly in the
 * annotated class or interface belong to.  Members declared in a class
 * without this annotation have no interface name and are never served.
 * <p>
 * The annotation is not inherited: every subclass that declares new members
 * for a different interface carries its own.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface DbusInterfaceName {

    /** The D-Bus interface name, e.g. {@code org.freedesktop.DBus.Peer}. */
    String value();

    /**
     * Whether the members of this interface are registered when the object
     * starts serving.  Interfaces answered by the bus engine itself disable
     * serving.
     */
    boolean servingEnabled() default true;
}
