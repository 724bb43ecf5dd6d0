package com.airmonitor.ingestion.live;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Which observer connections are watching which device.
 *
 * <p>A single lock guards the whole map; cardinalities are in the low thousands so contention is
 * not a concern. An entry exists only while its set is non-empty. Connections are compared by
 * identity.
 */
@Component
@Slf4j
public class SubscriptionRegistry {

    private final Object lock = new Object();
    private final Map<String, Set<ObserverConnection>> subscribers = new HashMap<>();
    private int connections;

    public SubscriptionRegistry(MeterRegistry meterRegistry) {
        Gauge.builder("live.registry.devices", this, SubscriptionRegistry::deviceCount)
                .description("Devices with at least one live observer")
                .register(meterRegistry);
        Gauge.builder("live.registry.connections", this, SubscriptionRegistry::connectionCount)
                .description("Registered live observer connections")
                .register(meterRegistry);
    }

    /**
     * Adds the connection to the device's set. Registering the same pair twice has no effect.
     */
    public void register(String deviceId, ObserverConnection connection) {
        synchronized (lock) {
            boolean added = subscribers
                    .computeIfAbsent(deviceId, id -> Collections.newSetFromMap(new IdentityHashMap<>()))
                    .add(connection);
            if (added) {
                connections++;
            }
            log.debug("Registered {} (added={}, device now has {} observers)",
                    connection, added, subscribers.get(deviceId).size());
        }
    }

    /**
     * Removes the connection from the device's set, dropping the entry once it is empty.
     * Unknown devices or connections are ignored.
     */
    public void unregister(String deviceId, ObserverConnection connection) {
        synchronized (lock) {
            Set<ObserverConnection> set = subscribers.get(deviceId);
            if (set == null || !set.remove(connection)) {
                return;
            }
            connections--;
            if (set.isEmpty()) {
                subscribers.remove(deviceId);
            }
            log.debug("Unregistered {}", connection);
        }
    }

    /**
     * Immutable copy of the device's current observers; safe to iterate while others register or leave.
     */
    public Set<ObserverConnection> subscribersOf(String deviceId) {
        synchronized (lock) {
            Set<ObserverConnection> set = subscribers.get(deviceId);
            if (set == null) {
                return Set.of();
            }
            Set<ObserverConnection> copy = Collections.newSetFromMap(new IdentityHashMap<>(set.size()));
            copy.addAll(set);
            return Collections.unmodifiableSet(copy);
        }
    }

    public boolean hasEntry(String deviceId) {
        synchronized (lock) {
            return subscribers.containsKey(deviceId);
        }
    }

    public int deviceCount() {
        synchronized (lock) {
            return subscribers.size();
        }
    }

    public int connectionCount() {
        synchronized (lock) {
            return connections;
        }
    }
}
