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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The table of one interface served at an object path: its methods with
 * their dispatch entry points, its properties with get/set entry points and
 * its signals.  Built by {@link DbusInterfaceBase#startServing} and handed
 * to {@link Bus#addInterface}.
 */
public class ServedInterface {

    /** Dispatches an incoming method call; the handler sends the reply itself. */
    public interface MethodHandler {
        CompletableFuture<Void> handle(Message request);
    }

    /** Reads a property value for an incoming Get. */
    public interface PropertyGetter {
        Object get() throws BusException;
    }

    /** Writes a property value for an incoming Set. */
    public interface PropertySetter {
        void set(Object value) throws BusException;
    }

    public static final class MethodEntry {

        private final String name;
        private final String inputSignature;
        private final List<String> inputArgsNames;
        private final String resultSignature;
        private final List<String> resultArgsNames;
        private final int flags;
        private final MethodHandler handler;

        MethodEntry(String name, String inputSignature, List<String> inputArgsNames,
                    String resultSignature, List<String> resultArgsNames, int flags,
                    MethodHandler handler) {
            this.name = name;
            this.inputSignature = inputSignature;
            this.inputArgsNames = inputArgsNames;
            this.resultSignature = resultSignature;
            this.resultArgsNames = resultArgsNames;
            this.flags = flags;
            this.handler = handler;
        }

        public String getName() { return name; }

        public String getInputSignature() { return inputSignature; }

        public List<String> getInputArgsNames() { return inputArgsNames; }

        public String getResultSignature() { return resultSignature; }

        public List<String> getResultArgsNames() { return resultArgsNames; }

        public int getFlags() { return flags; }

        public MethodHandler getHandler() { return handler; }
    }

    public static final class PropertyEntry {

        private final String name;
        private final String signature;
        private final PropertyGetter getter;
        private final PropertySetter setter;
        private final int flags;

        PropertyEntry(String name, String signature, PropertyGetter getter, PropertySetter setter,
                      int flags) {
            this.name = name;
            this.signature = signature;
            this.getter = getter;
            this.setter = setter;
            this.flags = flags;
        }

        public String getName() { return name; }

        public String getSignature() { return signature; }

        public PropertyGetter getGetter() { return getter; }

        /** @return the setter, or {@code null} for a read-only property */
        public PropertySetter getSetter() { return setter; }

        public int getFlags() { return flags; }
    }

    public static final class SignalEntry {

        private final String name;
        private final String signature;
        private final List<String> argNames;
        private final int flags;

        SignalEntry(String name, String signature, List<String> argNames, int flags) {
            this.name = name;
            this.signature = signature;
            this.argNames = argNames;
            this.flags = flags;
        }

        public String getName() { return name; }

        public String getSignature() { return signature; }

        public List<String> getArgNames() { return argNames; }

        public int getFlags() { return flags; }
    }

    private final String interfaceName;

    private final List<MethodEntry> methods = new ArrayList<MethodEntry>();

    private final List<PropertyEntry> properties = new ArrayList<PropertyEntry>();

    private final List<SignalEntry> signals = new ArrayList<SignalEntry>();

    public ServedInterface(String interfaceName) {
        this.interfaceName = interfaceName;
    }

    public void addMethod(String name, String inputSignature, List<String> inputArgsNames,
                          String resultSignature, List<String> resultArgsNames, int flags,
                          MethodHandler handler) {
        methods.add(new MethodEntry(name, inputSignature, inputArgsNames, resultSignature,
                                    resultArgsNames, flags, handler));
    }

    public void addProperty(String name, String signature, PropertyGetter getter,
                            PropertySetter setter, int flags) {
        properties.add(new PropertyEntry(name, signature, getter, setter, flags));
    }

    public void addSignal(String name, String signature, List<String> argNames, int flags) {
        signals.add(new SignalEntry(name, signature, argNames, flags));
    }

    public String getInterfaceName() {
        return interfaceName;
    }

    public List<MethodEntry> getMethods() {
        return Collections.unmodifiableList(methods);
    }

    public List<PropertyEntry> getProperties() {
        return Collections.unmodifiableList(properties);
    }

    public List<SignalEntry> getSignals() {
        return Collections.unmodifiableList(signals);
    }

    /**
     * Looks up a method by its D-Bus name.
     *
     * @param name the method name
     * @return the entry, or {@code null}
     */
    public MethodEntry getMethod(String name) {
        for (MethodEntry m : methods) {
            if (m.getName().equals(name)) {
                return m;
            }
        }
        return null;
    }

    /**
     * Looks up a property by its D-Bus name.
     *
     * @param name the property name
     * @return the entry, or {@code null}
     */
    public PropertyEntry getProperty(String name) {
        for (PropertyEntry p : properties) {
            if (p.getName().equals(name)) {
                return p;
            }
        }
        return null;
    }
}
