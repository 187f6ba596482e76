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

import org.jsdbus.annotation.DbusMethod;
import org.jsdbus.annotation.DefaultValue;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A D-Bus method declared with {@link DbusMethod}.
 * <p>
 * Besides the wire contract the descriptor records the argument names and
 * the trailing run of default values, which is what lets a call made with a
 * mix of positional and keyword arguments be turned into the complete
 * positional list the wire needs.
 */
public final class MethodDescriptor extends MemberDescriptor {

    private final Method method;

    private final String methodName;

    private final String inputSignature;

    private final String resultSignature;

    private final List<String> argsNames;

    private final List<String> resultArgsNames;

    private final Object[] argsDefaults;

    private final int defaultArgsStartAt;

    private MethodDescriptor(String key, Class<?> declaringClass, String interfaceName,
                             boolean servingEnabled, int flags, Method method, String methodName,
                             String inputSignature, String resultSignature, List<String> argsNames,
                             List<String> resultArgsNames, Object[] argsDefaults) {
        super(key, declaringClass, interfaceName, servingEnabled, flags);
        this.method = method;
        this.methodName = methodName;
        this.inputSignature = inputSignature;
        this.resultSignature = resultSignature;
        this.argsNames = argsNames;
        this.resultArgsNames = resultArgsNames;
        this.argsDefaults = argsDefaults;
        this.defaultArgsStartAt = argsNames.size() - argsDefaults.length;
    }

    /**
     * Creates the descriptor of an annotated method.
     *
     * @param method the implementation
     * @param busMethod its annotation
     * @param interfaceName the interface name of the declaring class
     * @param servingEnabled the serving flag of the declaring class
     * @return the descriptor
     * @throws AnnotationBusException if the declaration is malformed
     */
    static MethodDescriptor create(Method method, DbusMethod busMethod, String interfaceName,
                                   boolean servingEnabled) throws AnnotationBusException {
        if (Modifier.isStatic(method.getModifiers())) {
            throw new AnnotationBusException("Static method " + method + " cannot be a bus method");
        }
        String name = busMethod.name().length() > 0
            ? busMethod.name()
            : NameConverter.toWireName(method.getName());
        NameValidator.checkMemberName("method", name);

        Parameter[] parameters = method.getParameters();
        List<String> names = new ArrayList<String>();
        if (busMethod.inputArgsNames().length > 0) {
            if (busMethod.inputArgsNames().length != parameters.length) {
                throw new AnnotationBusException("inputArgsNames of " + method + " must name "
                                                 + parameters.length + " arguments");
            }
            names.addAll(Arrays.asList(busMethod.inputArgsNames()));
        } else {
            for (Parameter p : parameters) {
                names.add(p.getName());
            }
        }

        List<Object> defaults = new ArrayList<Object>();
        for (Parameter p : parameters) {
            DefaultValue defaultValue = p.getAnnotation(DefaultValue.class);
            if (defaultValue != null) {
                defaults.add(convertDefault(defaultValue.value(), p.getType(), method));
            } else if (!defaults.isEmpty()) {
                throw new AnnotationBusException("Parameter " + p.getName() + " of " + method
                                                 + " without default follows a parameter with default");
            }
        }

        method.setAccessible(true);
        return new MethodDescriptor(method.getName(), method.getDeclaringClass(), interfaceName,
                                    servingEnabled, busMethod.flags(), method, name,
                                    busMethod.inputSignature(), busMethod.resultSignature(),
                                    Collections.unmodifiableList(names),
                                    Collections.unmodifiableList(Arrays.asList(busMethod.resultArgsNames())),
                                    defaults.toArray());
    }

    /**
     * Pairs the wire contract of this method with another implementation.
     * Interface name, names, signatures, defaults and flags are kept.
     *
     * @param replacement the overriding method
     * @return the new descriptor
     * @throws AnnotationBusException if the replacement takes a different number of arguments
     */
    MethodDescriptor withImplementation(Method replacement) throws AnnotationBusException {
        if (Modifier.isStatic(replacement.getModifiers())
            || replacement.getParameterCount() != argsNames.size()) {
            throw new AnnotationBusException(replacement + " does not match the arguments of " + method);
        }
        replacement.setAccessible(true);
        return new MethodDescriptor(getKey(), replacement.getDeclaringClass(), getInterfaceName(),
                                    isServingEnabled(), getFlags(), replacement, methodName,
                                    inputSignature, resultSignature, argsNames, resultArgsNames,
                                    argsDefaults);
    }

    private static Object convertDefault(String literal, Class<?> type, Method method)
            throws AnnotationBusException {
        try {
            if (type == String.class || type == Object.class || type == CharSequence.class) {
                return literal;
            } else if (type == int.class || type == Integer.class) {
                return Integer.valueOf(literal);
            } else if (type == long.class || type == Long.class) {
                return Long.valueOf(literal);
            } else if (type == short.class || type == Short.class) {
                return Short.valueOf(literal);
            } else if (type == byte.class || type == Byte.class) {
                return Byte.valueOf(literal);
            } else if (type == double.class || type == Double.class) {
                return Double.valueOf(literal);
            } else if (type == float.class || type == Float.class) {
                return Float.valueOf(literal);
            } else if (type == boolean.class || type == Boolean.class) {
                if (!"true".equals(literal) && !"false".equals(literal)) {
                    throw new IllegalArgumentException("not a boolean");
                }
                return Boolean.valueOf(literal);
            } else if (type.isEnum()) {
                return enumConstant(type, literal);
            }
        } catch (IllegalArgumentException ex) {
            throw new AnnotationBusException("Bad default value \"" + literal + "\" for " + method, ex);
        }
        throw new AnnotationBusException("Default values of type " + type.getName()
                                         + " are not supported (" + method + ")");
    }

    private static Object enumConstant(Class<?> type, String literal) {
        for (Object constant : type.getEnumConstants()) {
            if (((Enum<?>) constant).name().equals(literal)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("no constant " + literal + " in " + type.getName());
    }

    /**
     * Builds the complete positional argument list of a call.  Each slot is
     * taken, in order of preference, from the positional arguments, from the
     * keyword argument of the same name and from the declared default.
     *
     * @param args the positional arguments
     * @param keywordArgs the keyword arguments
     * @return one value per declared argument
     * @throws ArgumentBusException if a slot cannot be filled, or an argument
     *         is unknown or given twice
     */
    Object[] rebuildArgs(Object[] args, Map<String, ?> keywordArgs) throws ArgumentBusException {
        if (args.length > argsNames.size()) {
            throw new ArgumentBusException(getName() + " takes " + argsNames.size()
                                           + " arguments but " + args.length + " were given");
        }
        for (String keyword : keywordArgs.keySet()) {
            int index = argsNames.indexOf(keyword);
            if (index < 0) {
                throw new ArgumentBusException(getName() + " has no argument named " + keyword);
            }
            if (index < args.length) {
                throw new ArgumentBusException(getName() + " got multiple values for argument " + keyword);
            }
        }

        Object[] rebuilt = new Object[argsNames.size()];
        for (int i = 0; i < rebuilt.length; ++i) {
            String name = argsNames.get(i);
            if (i < args.length) {
                rebuilt[i] = args[i];
            } else if (keywordArgs.containsKey(name)) {
                rebuilt[i] = keywordArgs.get(name);
            } else if (i >= defaultArgsStartAt) {
                rebuilt[i] = argsDefaults[i - defaultArgsStartAt];
            } else {
                throw new ArgumentBusException("Could not resolve argument " + name + " of " + getName());
            }
        }
        return rebuilt;
    }

    /**
     * Runs the local implementation.  Implementations may return a plain
     * value or a {@link CompletionStage}; failures complete the future
     * exceptionally.
     */
    CompletableFuture<Object> invokeLocal(Object target, Object[] args) {
        Object result;
        try {
            result = invoke(method, target, args);
        } catch (BusException ex) {
            return CompletableFuture.failedFuture(ex);
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        if (result instanceof CompletionStage) {
            @SuppressWarnings(value = "unchecked")
            CompletionStage<Object> stage = (CompletionStage<Object>) result;
            return stage.toCompletableFuture();
        }
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public String getName() {
        return methodName;
    }

    @Override
    public BoundMethod bind(DbusInterfaceBase instance) {
        return new BoundMethod(this, instance);
    }

    /** @return the current implementation */
    public Method getMethod() {
        return method;
    }

    public String getInputSignature() {
        return inputSignature;
    }

    public String getResultSignature() {
        return resultSignature;
    }

    public List<String> getArgsNames() {
        return argsNames;
    }

    public List<String> getResultArgsNames() {
        return resultArgsNames;
    }

    /** @return the number of positional arguments */
    public int getArgsCount() {
        return argsNames.size();
    }

    /** @return the index of the first argument with a default value */
    public int getDefaultArgsStartAt() {
        return defaultArgsStartAt;
    }
}
