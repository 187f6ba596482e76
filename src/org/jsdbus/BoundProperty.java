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

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * A property bound to an object.
 * <p>
 * {@link #getAsync()} and {@link #setAsync(Object)} go to the remote peer
 * when the object is connected to one and to the local getter and setter
 * otherwise; application code should use them.  {@link #getSync()} and
 * {@link #setSync(Object)} always use the local getter and setter, also on
 * connected objects; they are what incoming Get and Set requests are
 * answered with.
 *
 * @param <T> the property type
 */
public class BoundProperty<T> extends BoundMember {

    private final PropertyDescriptor descriptor;

    BoundProperty(PropertyDescriptor descriptor, DbusInterfaceBase instance) {
        super(instance);
        this.descriptor = descriptor;
    }

    @Override
    public PropertyDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * Reads the property with the local getter.
     *
     * @return the value
     * @throws BusException if the getter fails
     */
    public T getSync() throws BusException {
        @SuppressWarnings(value = "unchecked")
        T value = (T) descriptor.get(getInstance());
        return value;
    }

    /**
     * Writes the property with the local setter.
     *
     * @param value the new value
     * @throws NoSetterBusException if the property is read-only
     * @throws BusException if the setter fails
     */
    public void setSync(T value) throws BusException {
        descriptor.set(getInstance(), value);
    }

    /**
     * Reads the property.
     *
     * @return the value
     * @throws BusException if the request cannot be sent
     */
    public CompletableFuture<T> getAsync() throws BusException {
        DbusInterfaceBase obj = getInstance();
        if (!obj.isBound()) {
            try {
                return CompletableFuture.completedFuture(getSync());
            } catch (BusException ex) {
                return CompletableFuture.failedFuture(ex);
            } catch (RuntimeException ex) {
                return CompletableFuture.failedFuture(ex);
            }
        }

        Bus bus = obj.getAttachedBus();
        Message get = bus.newPropertyGetMessage(obj.getRemoteServiceName(), obj.getRemoteObjectPath(),
                                                requireInterfaceName(), descriptor.getName());
        return bus.callAsync(get).thenCompose(REPLY_CONTENTS).thenApply(new Function<Object, T>() {
            public T apply(Object contents) {
                return value(contents);
            }
        });
    }

    /**
     * Writes the property.
     *
     * @param value the new value
     * @return completes once the value is written
     * @throws NoSetterBusException if the object is local and the property is read-only
     * @throws BusException if the local setter fails or the request cannot be sent
     */
    public CompletableFuture<Void> setAsync(T value) throws BusException {
        DbusInterfaceBase obj = getInstance();
        if (!obj.isBound()) {
            setSync(value);
            return CompletableFuture.completedFuture(null);
        }

        Bus bus = obj.getAttachedBus();
        Message set = bus.newPropertySetMessage(obj.getRemoteServiceName(), obj.getRemoteObjectPath(),
                                                requireInterfaceName(), descriptor.getName());
        set.appendData("v", new Variant(descriptor.getSignature(), value));
        return bus.callAsync(set).thenCompose(REPLY_CONTENTS).thenApply(new Function<Object, Void>() {
            public Void apply(Object ignored) {
                return null;
            }
        });
    }

    /* The Get reply carries a variant, either decoded or as a (signature, value) pair. */
    @SuppressWarnings(value = "unchecked")
    private static <T> T value(Object contents) {
        if (contents instanceof Variant) {
            return (T) ((Variant) contents).getObject();
        }
        if (contents instanceof Object[] && ((Object[]) contents).length == 2
            && ((Object[]) contents)[0] instanceof String) {
            return (T) ((Object[]) contents)[1];
        }
        return (T) contents;
    }

    @Override
    void addTo(ServedInterface served) {
        final DbusInterfaceBase obj = getInstance();
        ServedInterface.PropertySetter setter = null;
        if (descriptor.hasSetter()) {
            setter = new ServedInterface.PropertySetter() {
                public void set(Object value) throws BusException {
                    descriptor.set(obj, value);
                }
            };
        }
        served.addProperty(descriptor.getName(), descriptor.getSignature(), new ServedInterface.PropertyGetter() {
            public Object get() throws BusException {
                return descriptor.get(obj);
            }
        }, setter, descriptor.getFlags());
    }
}
