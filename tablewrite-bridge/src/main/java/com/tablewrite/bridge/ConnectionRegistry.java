package com.tablewrite.bridge;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * Tracks the currently attached Foundry clients.
 * Identities are random UUIDs and are never handed out twice, so a stale id
 * cannot alias a newer connection. Fan-out order is unspecified.
 */
@Slf4j
public class ConnectionRegistry {

    private final Map<String, BridgeConnection> connections = new ConcurrentHashMap<>();

    /**
     * Register a connection and return its freshly generated identity.
     */
    public String register(BridgeConnection connection) {
        String id = UUID.randomUUID().toString();
        while (connections.putIfAbsent(id, connection) != null) {
            id = UUID.randomUUID().toString();
        }
        log.debug("registry:add conn={} total={}", id, connections.size());
        return id;
    }

    /**
     * Remove a connection. Unknown ids are ignored.
     *
     * @return the removed connection, or null if it was not registered
     */
    public BridgeConnection unregister(String id) {
        if (id == null)
            return null;
        BridgeConnection removed = connections.remove(id);
        if (removed != null) {
            log.debug("registry:remove conn={} total={}", id, connections.size());
        }
        return removed;
    }

    public BridgeConnection get(String id) {
        return id != null ? connections.get(id) : null;
    }

    public boolean contains(String id) {
        return id != null && connections.containsKey(id);
    }

    public int count() {
        return connections.size();
    }

    public boolean isEmpty() {
        return connections.isEmpty();
    }

    /** Snapshot of the registered identities. */
    public List<String> ids() {
        return List.copyOf(connections.keySet());
    }

    /**
     * Visit every registered connection. The visitor may unregister
     * connections while iterating.
     */
    public void forEach(BiConsumer<String, BridgeConnection> visitor) {
        connections.forEach(visitor);
    }
}
