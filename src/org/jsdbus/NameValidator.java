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

import java.util.regex.Pattern;

/**
 * The D-Bus naming rules for interfaces, members, object paths and bus names.
 */
public final class NameValidator {

    private static final int MAX_NAME_LENGTH = 255;

    private static final Pattern INTERFACE_NAME =
        Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)+");

    private static final Pattern MEMBER_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Pattern OBJECT_PATH = Pattern.compile("/|(/[A-Za-z0-9_]+)+");

    private static final Pattern UNIQUE_BUS_NAME = Pattern.compile(":[A-Za-z0-9_-]+(\\.[A-Za-z0-9_-]+)+");

    private static final Pattern WELL_KNOWN_BUS_NAME =
        Pattern.compile("[A-Za-z_-][A-Za-z0-9_-]*(\\.[A-Za-z_-][A-Za-z0-9_-]*)+");

    private NameValidator() {}

    public static boolean isInterfaceNameValid(String name) {
        return name != null && name.length() <= MAX_NAME_LENGTH && INTERFACE_NAME.matcher(name).matches();
    }

    /** Method, property and signal names share the same rule. */
    public static boolean isMemberNameValid(String name) {
        return name != null && name.length() <= MAX_NAME_LENGTH && MEMBER_NAME.matcher(name).matches();
    }

    public static boolean isObjectPathValid(String path) {
        return path != null && OBJECT_PATH.matcher(path).matches();
    }

    public static boolean isBusNameValid(String name) {
        return name != null && name.length() <= MAX_NAME_LENGTH
            && (UNIQUE_BUS_NAME.matcher(name).matches() || WELL_KNOWN_BUS_NAME.matcher(name).matches());
    }

    static void checkInterfaceName(String name) throws InvalidNameException {
        if (!isInterfaceNameValid(name)) {
            throw new InvalidNameException("interface name", name);
        }
    }

    static void checkMemberName(String kind, String name) throws InvalidNameException {
        if (!isMemberNameValid(name)) {
            throw new InvalidNameException(kind + " name", name);
        }
    }

    static void checkObjectPath(String path) throws InvalidNameException {
        if (!isObjectPathValid(path)) {
            throw new InvalidNameException("object path", path);
        }
    }

    static void checkBusName(String name) throws InvalidNameException {
        if (!isBusNameValid(name)) {
            throw new InvalidNameException("bus name", name);
        }
    }
}
