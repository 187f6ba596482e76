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

import org.jsdbus.annotation.DbusSignal;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A D-Bus signal declared with {@link DbusSignal}.
 */
public final class SignalDescriptor extends MemberDescriptor {

    private final String signalName;

    private final String signature;

    private final List<String> argNames;

    private SignalDescriptor(String key, Class<?> declaringClass, String interfaceName,
                             boolean servingEnabled, int flags, String signalName, String signature,
                             List<String> argNames) {
        super(key, declaringClass, interfaceName, servingEnabled, flags);
        this.signalName = signalName;
        this.signature = signature;
        this.argNames = argNames;
    }

    static SignalDescriptor create(String key, Class<?> declaringClass, DbusSignal busSignal,
                                   String interfaceName, boolean servingEnabled)
            throws AnnotationBusException {
        NameValidator.checkMemberName("signal", busSignal.name());
        return new SignalDescriptor(key, declaringClass, interfaceName, servingEnabled,
                                    busSignal.flags(), busSignal.name(), busSignal.signature(),
                                    Collections.unmodifiableList(Arrays.asList(busSignal.argNames())));
    }

    @Override
    public String getName() {
        return signalName;
    }

    @Override
    public BoundSignal<Object> bind(DbusInterfaceBase instance) {
        return new BoundSignal<Object>(this, instance);
    }

    public String getSignature() {
        return signature;
    }

    public List<String> getArgNames() {
        return argNames;
    }
}
