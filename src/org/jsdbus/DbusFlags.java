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
 * Member flags passed through to the served interface table.  The values
 * are those of the sd-bus vtable flags and may be combined with bitwise OR.
 */
public final class DbusFlags {

    private DbusFlags() {}

    /** Deprecated member.  See org.freedesktop.DBus.Deprecated. */
    public static final int DEPRECATED = 1 << 0;

    /** Member hidden from introspection. */
    public static final int HIDDEN = 1 << 1;

    /** Member callable by unprivileged peers. */
    public static final int UNPRIVILEGED = 1 << 2;

    /** Method sends no reply.  See org.freedesktop.DBus.Method.NoReply. */
    public static final int METHOD_NO_REPLY = 1 << 3;

    /** Property value never changes. */
    public static final int PROPERTY_CONST = 1 << 4;

    /** Property changes are announced with their new value. */
    public static final int PROPERTY_EMITS_CHANGE = 1 << 5;

    /** Property changes are announced without their new value. */
    public static final int PROPERTY_EMITS_INVALIDATION = 1 << 6;

    /** Property is left out of GetAll. */
    public static final int PROPERTY_EXPLICIT = 1 << 7;
}
