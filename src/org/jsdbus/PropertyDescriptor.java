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

import org.jsdbus.annotation.DbusProperty;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

/**
 * A D-Bus property: a getter declared with {@link DbusProperty} and an
 * optional setter declared with
 * {@link org.jsdbus.annotation.DbusPropertySetter}.
 */
public final class PropertyDescriptor extends MemberDescriptor {

    private final String propertyName;

    private final String signature;

    private final Method getter;

    private final Method setter;

    private PropertyDescriptor(String key, Class<?> declaringClass, String interfaceName,
                               boolean servingEnabled, int flags, String propertyName,
                               String signature, Method getter, Method setter) {
        super(key, declaringClass, interfaceName, servingEnabled, flags);
        this.propertyName = propertyName;
        this.signature = signature;
        this.getter = getter;
        this.setter = setter;
    }

    static PropertyDescriptor create(Method getter, DbusProperty busProperty, String interfaceName,
                                     boolean servingEnabled) throws AnnotationBusException {
        if (Modifier.isStatic(getter.getModifiers()) || getter.getParameterCount() != 0
            || getter.getReturnType() == void.class) {
            throw new AnnotationBusException("Property getter " + getter
                                             + " must be an instance method without arguments returning a value");
        }
        String name = busProperty.name().length() > 0
            ? busProperty.name()
            : NameConverter.toWireName(getter.getName());
        NameValidator.checkMemberName("property", name);
        getter.setAccessible(true);
        return new PropertyDescriptor(getter.getName(), getter.getDeclaringClass(), interfaceName,
                                      servingEnabled, busProperty.flags(), name,
                                      busProperty.signature(), getter, null);
    }

    /**
     * Attaches a setter.
     *
     * @param method the setter
     * @return a new descriptor with the setter
     * @throws AnnotationBusException if the property already has a setter or
     *         the method does not take exactly one argument
     */
    PropertyDescriptor withSetter(Method method) throws AnnotationBusException {
        if (setter != null) {
            throw new AnnotationBusException("Property " + propertyName + " already has setter " + setter);
        }
        if (Modifier.isStatic(method.getModifiers()) || method.getParameterCount() != 1) {
            throw new AnnotationBusException("Property setter " + method
                                             + " must be an instance method with one argument");
        }
        method.setAccessible(true);
        return new PropertyDescriptor(getKey(), getDeclaringClass(), getInterfaceName(),
                                      isServingEnabled(), getFlags(), propertyName, signature,
                                      getter, method);
    }

    Object get(Object target) throws BusException {
        return invoke(getter, target);
    }

    void set(Object target, Object value) throws BusException {
        if (setter == null) {
            throw new NoSetterBusException(propertyName);
        }
        invoke(setter, target, value);
    }

    @Override
    public String getName() {
        return propertyName;
    }

    @Override
    public BoundProperty<Object> bind(DbusInterfaceBase instance) {
        return new BoundProperty<Object>(this, instance);
    }

    public String getSignature() {
        return signature;
    }

    public Method getGetter() {
        return getter;
    }

    /** @return the setter, or {@code null} for a read-only property */
    public Method getSetter() {
        return setter;
    }

    public boolean hasSetter() {
        return setter != null;
    }
}
