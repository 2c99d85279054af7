package org.glossa.node.spi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A type-keyed container of the shared services handed to controllers.
 */
public final class ServiceRegistry {

    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    /**
     * Registers a service instance.
     *
     * @param type     the type to register under
     * @param instance the instance
     * @throws IllegalArgumentException if the type is already registered
     */
    public void register(final Class<?> type, final Object instance) {
        if (services.putIfAbsent(type, instance) != null) {
            throw new IllegalArgumentException("Service of type " + type.getName() + " is already registered.");
        }
    }

    /**
     * Retrieves a service instance.
     *
     * @param type the registered type
     * @param <T>  the service type
     * @return the instance
     * @throws IllegalArgumentException if nothing is registered for the type
     */
    @SuppressWarnings("unchecked")
    public <T> T get(final Class<T> type) {
        final Object instance = services.get(type);
        if (instance == null) {
            throw new IllegalArgumentException("No service registered for type " + type.getName());
        }
        return (T) instance;
    }
}
