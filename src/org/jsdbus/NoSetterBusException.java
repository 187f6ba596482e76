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
 * Thrown when a read-only property is set locally.
 */
public class NoSetterBusException extends BusException {

    private final String propertyName;

    /**
     * Constructs a NoSetterBusException.
     *
     * @param propertyName the wire name of the read-only property
     */
    public NoSetterBusException(String propertyName) {
        super("Property " + propertyName + " has no setter");
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
