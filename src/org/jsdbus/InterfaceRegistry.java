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

import org.jsdbus.annotation.DbusInterfaceName;
import org.jsdbus.annotation.DbusMethod;
import org.jsdbus.annotation.DbusOverload;
import org.jsdbus.annotation.DbusProperty;
import org.jsdbus.annotation.DbusPropertySetter;
import org.jsdbus.annotation.DbusSignal;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and caches the {@link InterfaceDescription} of bus interface
 * classes.
 * <p>
 * A class is described once.  Its bases (the superclass and the directly
 * implemented interfaces that extend {@link DbusInterface}) are described
 * first and their members merged, the first base winning on a clash.  The
 * members declared in the class itself are then stamped with its
 * {@link DbusInterfaceName} and checked against the inherited ones: an
 * inherited key may only be redeclared by a method marked
 * {@link DbusOverload}, and only if the inherited member is a method.
 */
public final class InterfaceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InterfaceRegistry.class);

    private static final Map<Class<?>, InterfaceDescription> descriptions =
        new ConcurrentHashMap<Class<?>, InterfaceDescription>();

    private static final Comparator<Method> METHOD_ORDER = new Comparator<Method>() {
        public int compare(Method a, Method b) {
            int order = a.getName().compareTo(b.getName());
            if (order == 0) {
                order = Integer.compare(a.getParameterCount(), b.getParameterCount());
            }
            if (order == 0) {
                order = a.toGenericString().compareTo(b.toGenericString());
            }
            return order;
        }
    };

    private static final Comparator<Field> FIELD_ORDER = new Comparator<Field>() {
        public int compare(Field a, Field b) {
            return a.getName().compareTo(b.getName());
        }
    };

    private InterfaceRegistry() {}

    /**
     * Gets the description of a bus interface class, building it on first use.
     *
     * @param type a class or interface extending {@link DbusInterface}
     * @return the description
     * @throws AnnotationBusException if the declarations of the class or of
     *         one of its bases are invalid
     */
    public static InterfaceDescription describe(Class<?> type) throws AnnotationBusException {
        InterfaceDescription description = descriptions.get(type);
        if (description == null) {
            description = build(type);
            InterfaceDescription previous = descriptions.putIfAbsent(type, description);
            if (previous != null) {
                description = previous;
            }
        }
        return description;
    }

    private static InterfaceDescription build(Class<?> type) throws AnnotationBusException {
        if (!DbusInterface.class.isAssignableFrom(type)) {
            throw new AnnotationBusException(type.getName() + " does not extend " + DbusInterface.class.getName());
        }

        Map<String, MemberDescriptor> inherited = new LinkedHashMap<String, MemberDescriptor>();
        for (Class<?> base : bases(type)) {
            for (MemberDescriptor member : describe(base).getMembers()) {
                if (!inherited.containsKey(member.getKey())) {
                    inherited.put(member.getKey(), member);
                }
            }
        }

        DbusInterfaceName busInterface = type.getAnnotation(DbusInterfaceName.class);
        String interfaceName = null;
        boolean servingEnabled = true;
        if (busInterface != null) {
            interfaceName = busInterface.value();
            servingEnabled = busInterface.servingEnabled();
            NameValidator.checkInterfaceName(interfaceName);
        }

        Map<String, MemberDescriptor> declared = new LinkedHashMap<String, MemberDescriptor>();
        List<Method> setters = new ArrayList<Method>();
        for (Method method : declaredMethods(type)) {
            DbusMethod busMethod = method.getAnnotation(DbusMethod.class);
            DbusProperty busProperty = method.getAnnotation(DbusProperty.class);
            DbusPropertySetter busSetter = method.getAnnotation(DbusPropertySetter.class);
            DbusOverload overload = method.getAnnotation(DbusOverload.class);
            int annotations = (busMethod != null ? 1 : 0) + (busProperty != null ? 1 : 0)
                + (busSetter != null ? 1 : 0) + (overload != null ? 1 : 0);
            if (annotations > 1) {
                throw new AnnotationBusException(method + " carries more than one bus member annotation");
            }

            String key = method.getName();
            if (inherited.containsKey(key)) {
                declared.put(key, overload(type, method, overload, inherited.get(key)));
                continue;
            }
            if (overload != null) {
                throw new AnnotationBusException(method + " is marked @DbusOverload but "
                                                 + type.getName() + " inherits no bus member " + key);
            }

            if (busMethod != null) {
                checkUnique(declared, key, type);
                declared.put(key, MethodDescriptor.create(method, busMethod, interfaceName, servingEnabled));
            } else if (busProperty != null) {
                checkUnique(declared, key, type);
                declared.put(key, PropertyDescriptor.create(method, busProperty, interfaceName, servingEnabled));
            } else if (busSetter != null) {
                setters.add(method);
            }
        }

        for (Method setter : setters) {
            String key = setter.getAnnotation(DbusPropertySetter.class).value();
            MemberDescriptor property = declared.get(key);
            if (!(property instanceof PropertyDescriptor)) {
                throw new AnnotationBusException("Setter " + setter + " names " + key
                                                 + ", which is not a property declared in " + type.getName());
            }
            declared.put(key, ((PropertyDescriptor) property).withSetter(setter));
        }

        for (Field field : declaredFields(type)) {
            DbusSignal busSignal = field.getAnnotation(DbusSignal.class);
            if (busSignal == null) {
                continue;
            }
            String key = signalKey(field);
            if (inherited.containsKey(key)) {
                throw new AnnotationBusException("Signal " + key + " of " + type.getName()
                                                 + " redeclares an inherited bus member");
            }
            checkUnique(declared, key, type);
            declared.put(key, SignalDescriptor.create(key, type, busSignal, interfaceName, servingEnabled));
        }

        Map<String, MemberDescriptor> members = new LinkedHashMap<String, MemberDescriptor>(inherited);
        members.putAll(declared);
        if (!declared.isEmpty()) {
            log.debug("Described {}: {} declared, {} total members of {}", type.getName(),
                      declared.size(), members.size(), interfaceName);
        }
        return new InterfaceDescription(type, interfaceName, servingEnabled, declared.keySet(), members);
    }

    /**
     * Validates a redeclaration of an inherited key and returns the member
     * that replaces the inherited one.
     */
    private static MemberDescriptor overload(Class<?> type, Method method, DbusOverload overload,
                                             MemberDescriptor original) throws AnnotationBusException {
        if (overload == null) {
            throw new AnnotationBusException("Attempted to overload bus definition " + original
                                             + " in " + type.getName() + " without @DbusOverload");
        }
        if (!(original instanceof MethodDescriptor)) {
            throw new AnnotationBusException("Only bus methods can be overloaded; " + original
                                             + " in " + type.getName() + " cannot");
        }
        return ((MethodDescriptor) original).withImplementation(method);
    }

    private static void checkUnique(Map<String, MemberDescriptor> declared, String key, Class<?> type)
            throws AnnotationBusException {
        if (declared.containsKey(key)) {
            throw new AnnotationBusException("Bus member " + key + " is declared twice in " + type.getName());
        }
    }

    private static String signalKey(Field field) throws AnnotationBusException {
        int modifiers = field.getModifiers();
        if (!Modifier.isStatic(modifiers) || !Modifier.isFinal(modifiers) || field.getType() != String.class) {
            throw new AnnotationBusException("Signal field " + field + " must be a static final String");
        }
        Object key;
        try {
            field.setAccessible(true);
            key = field.get(null);
        } catch (IllegalAccessException ex) {
            throw new AnnotationBusException("Cannot read signal field " + field, ex);
        }
        if (key == null || ((String) key).isEmpty()) {
            throw new AnnotationBusException("Signal field " + field + " holds no key");
        }
        return (String) key;
    }

    private static List<Class<?>> bases(Class<?> type) {
        List<Class<?>> bases = new ArrayList<Class<?>>();
        Class<?> superclass = type.getSuperclass();
        if (superclass != null && DbusInterface.class.isAssignableFrom(superclass)) {
            bases.add(superclass);
        }
        for (Class<?> intf : type.getInterfaces()) {
            if (DbusInterface.class.isAssignableFrom(intf)) {
                bases.add(intf);
            }
        }
        return bases;
    }

    /* Reflection order is unspecified; sort so descriptions are reproducible. */
    private static List<Method> declaredMethods(Class<?> type) {
        List<Method> methods = new ArrayList<Method>();
        for (Method method : type.getDeclaredMethods()) {
            if (!method.isSynthetic() && !method.isBridge()) {
                methods.add(method);
            }
        }
        Collections.sort(methods, METHOD_ORDER);
        return methods;
    }

    private static List<Field> declaredFields(Class<?> type) {
        List<Field> fields = new ArrayList<Field>(Arrays.asList(type.getDeclaredFields()));
        Collections.sort(fields, FIELD_ORDER);
        return fields;
    }
}
