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

import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The process-wide default bus.  It is opened on first use and shared by
 * every object that is connected or served without an explicit bus.
 * <p>
 * The engine is found through {@link BusProvider} services.  When more than
 * one engine is on the class path the system property
 * {@value #PROVIDER_PROPERTY} names the provider class to use.
 */
public final class DefaultBus {

    private static final Logger log = LoggerFactory.getLogger(DefaultBus.class);

    /** System property selecting the bus provider class. */
    public static final String PROVIDER_PROPERTY = "jsdbus.bus.provider";

    private static Bus bus;

    private DefaultBus() {}

    /**
     * Gets the default bus, opening it if this is the first call.
     *
     * @return the default bus
     * @throws BusException if no provider is available or opening fails
     */
    public static synchronized Bus get() throws BusException {
        if (bus == null) {
            bus = open();
        }
        return bus;
    }

    private static Bus open() throws BusException {
        String wanted = System.getProperty(PROVIDER_PROPERTY);
        try {
            for (BusProvider provider : ServiceLoader.load(BusProvider.class)) {
                if (wanted == null || wanted.equals(provider.getClass().getName())) {
                    log.debug("Opening default bus with {}", provider.getClass().getName());
                    return provider.open();
                }
            }
        } catch (ServiceConfigurationError ex) {
            throw new BusException("Cannot load bus provider", ex);
        }
        throw new BusException(wanted == null
                               ? "No bus provider available"
                               : "Bus provider " + wanted + " not found");
    }
}
