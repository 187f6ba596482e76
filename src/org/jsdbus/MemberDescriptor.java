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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * The static definition of one bus member: a method, a property or a
 * signal.  Descriptors are created once per declaring class by
 * {@link InterfaceRegistry}, are immutable and are shared by every instance
 * of that class and its subclasses.
 * <p>
 * A descriptor does nothing by itself; {@link #bind} pairs it with an
 * object and the resulting {@link BoundMember} decides whether an operation
 * runs locally or goes over the bus.
 */
public abstract class MemberDescriptor {

    private final String key;

    private final Class<?> declaringClass;

    private final String interfaceName;

    private final boolean servingEnabled;

    private final int flags;

    MemberDescriptor(String key, Class<?> declaringClass, String interfaceName,
                     boolean servingEnabled, int flags) {
        this.key = key;
        this.declaringClass = declaringClass;
        this.interfaceName = interfaceName;
        this.servingEnabled = servingEnabled;
        this.flags = flags;
    }

    /**
     * Gets the key the member is looked up with: the Java method name for
     * methods and properties, the field value for signals.
     *
     * @return the key
     */
    public String getKey() {
        return key;
    }

    /** @return the class or interface that declared the member */
    public Class<?> getDeclaringClass() {
        return declaringClass;
    }

    /** @return the D-Bus interface name, or {@code null} for non-serving mix-ins */
    public String getInterfaceName() {
        return interfaceName;
    }

    public boolean isServingEnabled() {
        return servingEnabled;
    }

    /** @see DbusFlags */
    public int getFlags() {
        return flags;
    }

    /**
     * Gets the D-Bus member name.
     *
     * @return the method, property or signal name on the wire
     */
    public abstract String getName();

    /**
     * Binds this member to an object.  Cheap and side-effect free; every
     * call returns a new wrapper.
     *
     * @param instance the owning object
     * @return the bound member
     */
    public abstract BoundMember bind(DbusInterfaceBase instance);

    /**
     * Counts the complete types in a signature, so {@code "si"} holds two
     * and {@code "av"}, {@code "(si)"} and {@code "a{sv}"} hold one each.
     * An {@code Object[]} payload is spread into several wire values only
     * when its signature holds more than one complete type.
     *
     * @param signature the signature
     * @return the number of complete types
     * @throws MarshalBusException if the signature is malformed
     */
    static int completeTypeCount(String signature) throws MarshalBusException {
        int count = 0;
        int i = 0;
        while (i < signature.length()) {
            i = skipCompleteType(signature, i);
            ++count;
        }
        return count;
    }

    private static int skipCompleteType(String signature, int i) throws MarshalBusException {
        if (i >= signature.length()) {
            throw new MarshalBusException("Signature '" + signature + "' ends inside a type");
        }
        char c = signature.charAt(i);
        switch (c) {
        case 'a':
            return skipCompleteType(signature, i + 1);
        case '(':
        case '{':
            char close = c == '(' ? ')' : '}';
            int j = i + 1;
            while (j < signature.length() && signature.charAt(j) != close) {
                j = skipCompleteType(signature, j);
            }
            if (j >= signature.length() || j == i + 1) {
                throw new MarshalBusException("Signature '" + signature + "' has an empty or unclosed container");
            }
            return j + 1;
        case ')':
        case '}':
            throw new MarshalBusException("Signature '" + signature + "' closes a container it never opened");
        default:
            return i + 1;
        }
    }

    /**
     * Calls a local implementation, rethrowing what it threw.
     */
    static Object invoke(Method method, Object target, Object... args) throws BusException {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof BusException) {
                throw (BusException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new BusException(method.getName() + " failed", cause);
        } catch (IllegalAccessException ex) {
            throw new BusException("Cannot access " + method, ex);
        } catch (IllegalArgumentException ex) {
            throw new MarshalBusException("Arguments do not fit " + method, ex);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + interfaceName + "." + getName() + ")";
    }
}
