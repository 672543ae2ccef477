package org.swarmsim.node.spi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type-keyed container for the services a process hands to its controllers.
 */
public final class ServiceRegistry {

    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    /**
     * Registers a service under its type.
     *
     * @throws IllegalArgumentException if the type is already registered.
     */
    public <T> void register(final Class<T> type, final T instance) {
        if (services.putIfAbsent(type, instance) != null) {
            throw new IllegalArgumentException("Service of type " + type.getName() + " is already registered.");
        }
    }

    /**
     * @return The service registered under {@code type}.
     * @throws IllegalArgumentException if there is none.
     */
    public <T> T get(final Class<T> type) {
        final Object instance = services.get(type);
        if (instance == null) {
            throw new IllegalArgumentException("No service registered for type " + type.getName());
        }
        return type.cast(instance);
    }

    public boolean hasService(final Class<?> type) {
        return services.containsKey(type);
    }
}
