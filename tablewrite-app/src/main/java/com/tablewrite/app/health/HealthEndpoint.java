package com.tablewrite.app.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tablewrite.bridge.BridgeDispatcher;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;

/**
 * Liveness probe and bridge status.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper = new ObjectMapper();
    private final BridgeDispatcher dispatcher;

    public HealthEndpoint(BridgeDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "healthy");
        node.put("service", "tablewrite-bridge");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());
        return node;
    }

    /**
     * Whether any Foundry client is attached, and how many calls are waiting
     * on one.
     */
    @GetMapping("/api/foundry/status")
    public ObjectNode foundryStatus() {
        int clients = dispatcher.connectionCount();
        var node = mapper.createObjectNode();
        node.put("connected_clients", clients);
        node.put("pending_calls", dispatcher.pendingCount());
        node.put("status", clients > 0 ? "connected" : "disconnected");
        return node;
    }
}
