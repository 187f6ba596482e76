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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * InterfaceDescription represents the validated bus surface of one class:
 * the members it declares itself and every member it inherits.
 * Instances are built by {@link InterfaceRegistry} and never change.
 */
public final class InterfaceDescription {

    private final Class<?> type;

    private final String interfaceName;

    private final boolean servingEnabled;

    private final Set<String> declaredKeys;

    private final Map<String, MemberDescriptor> members;

    InterfaceDescription(Class<?> type, String interfaceName, boolean servingEnabled,
                         Set<String> declaredKeys, Map<String, MemberDescriptor> members) {
        this.type = type;
        this.interfaceName = interfaceName;
        this.servingEnabled = servingEnabled;
        this.declaredKeys = Collections.unmodifiableSet(declaredKeys);
        this.members = Collections.unmodifiableMap(members);
    }

    /** @return the described class */
    public Class<?> getType() {
        return type;
    }

    /**
     * Gets the interface name given to the members declared directly in the
     * described class.
     *
     * @return the interface name, or {@code null}
     */
    public String getInterfaceName() {
        return interfaceName;
    }

    public boolean isServingEnabled() {
        return servingEnabled;
    }

    /**
     * Gets the keys of the members declared or overloaded directly in the
     * described class.
     *
     * @return the keys
     */
    public Set<String> getDeclaredKeys() {
        return declaredKeys;
    }

    /**
     * Gets the keys of all members, declared and inherited.
     *
     * @return the keys
     */
    public Set<String> getMemberKeys() {
        return members.keySet();
    }

    /** @return all member descriptors, inherited ones first */
    public Collection<MemberDescriptor> getMembers() {
        return members.values();
    }

    /**
     * Gets a member by key.
     *
     * @param key the Java method name, or the value of a signal field
     * @return the descriptor, or {@code null}
     */
    public MemberDescriptor getMember(String key) {
        return members.get(key);
    }
}
