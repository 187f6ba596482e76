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

package org.jsdbus.ifaces;

import org.jsdbus.DbusInterface;
import org.jsdbus.annotation.DbusInterfaceName;
import org.jsdbus.annotation.DbusMethod;

/**
 * The standard org.freedesktop.DBus.Peer interface.  Every bus engine
 * answers it on behalf of the connection, so it is never served by objects
 * and is only useful on proxies.
 */
@DbusInterfaceName(value = "org.freedesktop.DBus.Peer", servingEnabled = false)
public interface DbusPeerInterface extends DbusInterface {

    /**
     * Send a ping message to a remote connection and get a method reply in
     * response.
     */
    @DbusMethod
    default void ping() {
        throw new UnsupportedOperationException("Ping is answered by the bus engine");
    }

    /**
     * Get the machine id of the remote peer.
     *
     * @return the machine id
     */
    @DbusMethod(resultSignature = "s")
    default String getMachineId() {
        throw new UnsupportedOperationException("GetMachineId is answered by the bus engine");
    }
}
