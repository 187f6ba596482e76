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
 * Service interface implemented by bus engines.  Providers are located with
 * {@link java.util.ServiceLoader} from
 * {@code META-INF/services/org.jsdbus.BusProvider}.
 */
public interface BusProvider {

    /**
     * Opens the default bus of this engine.
     *
     * @return the connected bus
     * @throws BusException if the bus could not be opened
     */
    Bus open() throws BusException;
}
