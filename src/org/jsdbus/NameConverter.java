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
 * Converts Java member names into D-Bus member names.
 */
public final class NameConverter {

    private NameConverter() {}

    /**
     * Converts a member name to the wire convention.
     * The first character is upper-cased, every underscore is removed and
     * the character following it is upper-cased; everything else is kept.
     * So {@code get_machine_id} and {@code getMachineId} both become
     * {@code GetMachineId}.
     * <p>
     * Underscores never reach the output: a leading underscore upper-cases
     * the character after it, runs of underscores behave like a single one
     * and a trailing underscore is dropped.
     *
     * @param name the Java name
     * @return the D-Bus name
     */
    public static String toWireName(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        boolean upperNext = true;
        for (int i = 0; i < name.length(); ++i) {
            char c = name.charAt(i);
            if (c == '_') {
                upperNext = true;
            } else if (upperNext) {
                sb.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
