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
 * Thrown when an interface, member, object path or bus name does not follow
 * the D-Bus naming rules.
 */
public class InvalidNameException extends AnnotationBusException {

    private final String name;

    /**
     * Constructs an InvalidNameException.
     *
     * @param kind what the name was meant to be, e.g. "interface name"
     * @param name the offending name
     */
    public InvalidNameException(String kind, String name) {
        super("Invalid " + kind + ": \"" + name + "\"");
        this.name = name;
    }

    /** @return the offending name */
    public String getName() {
        return name;
    }
}
