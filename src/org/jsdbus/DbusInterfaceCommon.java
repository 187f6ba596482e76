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

import org.jsdbus.ifaces.DbusIntrospectable;
import org.jsdbus.ifaces.DbusPeerInterface;

/**
 * Base class with the standard Peer and Introspectable interfaces.  Usable
 * directly as a proxy of any remote object:
 * <pre>
 * DbusInterfaceCommon peer = DbusInterfaceBase.newProxy(DbusInterfaceCommon.class, bus,
 *                                                       "org.example.Service", "/");
 * peer.method("ping").call().get();
 * </pre>
 */
public class DbusInterfaceCommon extends DbusInterfaceBase implements DbusPeerInterface, DbusIntrospectable {
}
