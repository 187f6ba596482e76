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

import java.lang.ref.WeakReference;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of objects with a bus interface.
 * <p>
 * The same class works in two ways.  Connected to a remote object with
 * {@link #connect}, it is a proxy: its methods, properties and signals go to
 * that object over the bus.  Served with {@link #startServing}, it answers
 * calls from the bus with its own implementations.  An object that is
 * neither simply runs its implementations when called.  Connecting and
 * serving exclude each other and neither can be undone.
 * <p>
 * Members are reached through fresh bound wrappers:
 * <pre>
 * String reply = obj.method("ping").&lt;String&gt;call("hello").get();
 * </pre>
 * <p>
 * Instances are not thread-safe; an object is expected to be used from one
 * event loop at a time.
 */
public abstract class DbusInterfaceBase implements DbusInterface {

    private static final Logger log = LoggerFactory.getLogger(DbusInterfaceBase.class);

    private final List<ServedInterface> activatedInterfaces = new ArrayList<ServedInterface>();

    private boolean bound;

    private String remoteServiceName;

    private String remoteObjectPath;

    private Bus attachedBus;

    private String servingObjectPath;

    private final Map<SignalDescriptor, List<WeakReference<AsyncQueue<?>>>> localSignalQueues =
        new HashMap<SignalDescriptor, List<WeakReference<AsyncQueue<?>>>>();

    protected DbusInterfaceBase() {
    }

    /**
     * Creates an object of the given class and connects it to a remote
     * object.  The class needs a no-argument constructor.
     *
     * @param type the bus interface class
     * @param bus the bus the remote object is on
     * @param serviceName well-known or unique bus name of the remote peer
     * @param objectPath object path of the remote object
     * @return the proxy
     * @throws BusException if the class is invalid or cannot be instantiated
     */
    public static <T extends DbusInterfaceBase> T newProxy(Class<T> type, Bus bus, String serviceName,
                                                           String objectPath) throws BusException {
        T obj;
        try {
            Constructor<T> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            obj = constructor.newInstance();
        } catch (InvocationTargetException ex) {
            throw new BusException("Cannot create " + type.getName(), ex.getCause());
        } catch (ReflectiveOperationException ex) {
            throw new BusException("Cannot create " + type.getName(), ex);
        }
        obj.connect(bus, serviceName, objectPath);
        return obj;
    }

    /**
     * Creates a proxy on the default bus.
     *
     * @see #newProxy(Class, Bus, String, String)
     * @see DefaultBus
     */
    public static <T extends DbusInterfaceBase> T newProxy(Class<T> type, String serviceName,
                                                           String objectPath) throws BusException {
        return newProxy(type, DefaultBus.get(), serviceName, objectPath);
    }

    /**
     * Gets the bus interface description of this object's class.
     *
     * @return the description
     * @throws AnnotationBusException if the class declarations are invalid
     */
    public InterfaceDescription getDescription() throws AnnotationBusException {
        return InterfaceRegistry.describe(getClass());
    }

    /**
     * Looks up a member and binds it to this object.
     *
     * @param key the Java method name, or the value of a signal field
     * @return a new bound member
     * @throws BusException if there is no such member
     */
    public BoundMember member(String key) throws BusException {
        MemberDescriptor descriptor = getDescription().getMember(key);
        if (descriptor == null) {
            throw new BusException(getClass().getName() + " has no bus member " + key);
        }
        return descriptor.bind(this);
    }

    /**
     * Looks up a method.
     *
     * @param key the Java method name
     * @return a new bound method
     * @throws BusException if there is no such method
     */
    public BoundMethod method(String key) throws BusException {
        return member(key, MethodDescriptor.class).bind(this);
    }

    /**
     * Looks up a property.
     *
     * @param key the Java getter name
     * @return a new bound property
     * @throws BusException if there is no such property
     */
    public <T> BoundProperty<T> property(String key) throws BusException {
        return new BoundProperty<T>(member(key, PropertyDescriptor.class), this);
    }

    /**
     * Looks up a signal.
     *
     * @param key the value of the signal field
     * @return a new bound signal
     * @throws BusException if there is no such signal
     */
    public <T> BoundSignal<T> signal(String key) throws BusException {
        return new BoundSignal<T>(member(key, SignalDescriptor.class), this);
    }

    /**
     * Binds every member, inherited ones included.
     *
     * @return new bound members
     * @throws AnnotationBusException if the class declarations are invalid
     */
    public List<BoundMember> members() throws AnnotationBusException {
        List<BoundMember> members = new ArrayList<BoundMember>();
        for (MemberDescriptor descriptor : getDescription().getMembers()) {
            members.add(descriptor.bind(this));
        }
        return members;
    }

    private <D extends MemberDescriptor> D member(String key, Class<D> kind) throws BusException {
        MemberDescriptor descriptor = getDescription().getMember(key);
        if (!kind.isInstance(descriptor)) {
            throw new BusException(getClass().getName() + " has no bus "
                                   + kind.getSimpleName().replace("Descriptor", "").toLowerCase() + " " + key);
        }
        return kind.cast(descriptor);
    }

    /**
     * Connects this object to a remote object.  From now on its members
     * forward to that object.
     *
     * @param bus the bus the remote object is on
     * @param serviceName well-known or unique bus name of the remote peer
     * @param objectPath object path of the remote object
     * @throws BusException if this object is already connected or served,
     *         a name is invalid or the class declarations are invalid
     */
    public void connect(Bus bus, String serviceName, String objectPath) throws BusException {
        if (bound) {
            throw new BusException("Already connected to " + remoteServiceName + " " + remoteObjectPath);
        }
        if (servingObjectPath != null) {
            throw new BusException("Served at " + servingObjectPath + ", cannot connect to a remote object");
        }
        NameValidator.checkBusName(serviceName);
        NameValidator.checkObjectPath(objectPath);
        getDescription();

        this.bound = true;
        this.attachedBus = bus;
        this.remoteServiceName = serviceName;
        this.remoteObjectPath = objectPath;
        log.debug("{} connected to {} {}", getClass().getName(), serviceName, objectPath);
    }

    /**
     * Connects this object to a remote object on the default bus.
     *
     * @see #connect(Bus, String, String)
     */
    public void connect(String serviceName, String objectPath) throws BusException {
        connect(DefaultBus.get(), serviceName, objectPath);
    }

    /**
     * Serves this object.  Every member with serving enabled and an interface
     * name is registered; one interface table per interface name.
     *
     * @param bus the bus to serve on
     * @param objectPath the object path to serve at
     * @throws BusException if this object is already connected or served,
     *         the path is invalid, the class declarations are invalid or the
     *         bus refuses an interface
     */
    public void startServing(Bus bus, String objectPath) throws BusException {
        if (bound) {
            throw new BusException("Connected to " + remoteServiceName + ", cannot be served");
        }
        if (servingObjectPath != null) {
            throw new BusException("Already served at " + servingObjectPath);
        }
        NameValidator.checkObjectPath(objectPath);

        Map<String, ServedInterface> interfaces = new LinkedHashMap<String, ServedInterface>();
        for (MemberDescriptor descriptor : getDescription().getMembers()) {
            String interfaceName = descriptor.getInterfaceName();
            if (!descriptor.isServingEnabled() || interfaceName == null) {
                continue;
            }
            ServedInterface served = interfaces.get(interfaceName);
            if (served == null) {
                served = new ServedInterface(interfaceName);
                interfaces.put(interfaceName, served);
            }
            descriptor.bind(this).addTo(served);
        }

        for (ServedInterface served : interfaces.values()) {
            // A refused interface leaves the ones registered before it served.
            bus.addInterface(served, objectPath, served.getInterfaceName());
            this.attachedBus = bus;
            this.servingObjectPath = objectPath;
            activatedInterfaces.add(served);
            log.debug("Serving {} at {}", served.getInterfaceName(), objectPath);
        }
    }

    /**
     * Serves this object on the default bus.
     *
     * @see #startServing(Bus, String)
     */
    public void startServing(String objectPath) throws BusException {
        startServing(DefaultBus.get(), objectPath);
    }

    /** @return {@code true} if this object is a proxy of a remote object */
    public boolean isBound() {
        return bound;
    }

    /** @return {@code true} if at least one interface of this object is served */
    public boolean hasActivatedInterfaces() {
        return !activatedInterfaces.isEmpty();
    }

    /** @return the interface tables registered by {@link #startServing} */
    public List<ServedInterface> getActivatedInterfaces() {
        return Collections.unmodifiableList(activatedInterfaces);
    }

    /** @return the bus this object is connected or served on, or {@code null} */
    public Bus getAttachedBus() {
        return attachedBus;
    }

    public String getRemoteServiceName() {
        return remoteServiceName;
    }

    public String getRemoteObjectPath() {
        return remoteObjectPath;
    }

    public String getServingObjectPath() {
        return servingObjectPath;
    }

    void addLocalQueue(SignalDescriptor signal, AsyncQueue<?> queue) {
        List<WeakReference<AsyncQueue<?>>> queues = localSignalQueues.get(signal);
        if (queues == null) {
            queues = new ArrayList<WeakReference<AsyncQueue<?>>>();
            localSignalQueues.put(signal, queues);
        }
        queues.add(new WeakReference<AsyncQueue<?>>(queue));
    }

    void removeLocalQueue(SignalDescriptor signal, AsyncQueue<?> queue) {
        List<WeakReference<AsyncQueue<?>>> queues = localSignalQueues.get(signal);
        if (queues == null) {
            return;
        }
        for (Iterator<WeakReference<AsyncQueue<?>>> it = queues.iterator(); it.hasNext();) {
            AsyncQueue<?> q = it.next().get();
            if (q == null || q == queue) {
                it.remove();
            }
        }
    }

    /**
     * Gets the queues of the open local subscriptions to a signal, dropping
     * those whose subscription was garbage collected.
     */
    @SuppressWarnings(value = "unchecked")
    List<AsyncQueue<Object>> liveLocalQueues(SignalDescriptor signal) {
        List<WeakReference<AsyncQueue<?>>> queues = localSignalQueues.get(signal);
        if (queues == null) {
            return Collections.emptyList();
        }
        List<AsyncQueue<Object>> live = new ArrayList<AsyncQueue<Object>>();
        for (Iterator<WeakReference<AsyncQueue<?>>> it = queues.iterator(); it.hasNext();) {
            AsyncQueue<?> q = it.next().get();
            if (q == null) {
                it.remove();
            } else {
                live.add((AsyncQueue<Object>) q);
            }
        }
        return live;
    }
}
