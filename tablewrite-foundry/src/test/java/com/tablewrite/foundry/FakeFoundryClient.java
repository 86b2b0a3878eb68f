package com.tablewrite.foundry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tablewrite.bridge.BridgeConnection;
import com.tablewrite.bridge.BridgeDispatcher;
import com.tablewrite.bridge.ConnectionRegistry;
import com.tablewrite.bridge.DispatcherOptions;
import com.tablewrite.bridge.PendingCallTable;
import com.tablewrite.bridge.protocol.BridgeProtocol.BridgeMessage;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory stand-in for the Foundry module. Replies synchronously to the
 * commands it has a script for and stays silent on everything else.
 */
public class FakeFoundryClient implements BridgeConnection {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private final BridgeDispatcher dispatcher;
    private final Map<String, Function<BridgeMessage, BridgeMessage>> scripts = new ConcurrentHashMap<>();
    private final List<BridgeMessage> received = new CopyOnWriteArrayList<>();
    private volatile String clientId;
    private volatile boolean open = true;

    public FakeFoundryClient(BridgeDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /** Dispatcher with a 5 s default timeout completing futures on the replying thread. */
    public static BridgeDispatcher newDispatcher() {
        var options = new DispatcherOptions(Duration.ofSeconds(5), Duration.ofMinutes(1), Duration.ofMinutes(1));
        return new BridgeDispatcher(new ConnectionRegistry(), new PendingCallTable(), MAPPER, options,
                null, Runnable::run);
    }

    public static ObjectNode json(String json) {
        try {
            return (ObjectNode) MAPPER.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException(json, e);
        }
    }

    public FakeFoundryClient connect() {
        clientId = dispatcher.attach(this);
        return this;
    }

    public String clientId() {
        return clientId;
    }

    /** Answer {@code command} with {@code replyType} and {@code data}. */
    public FakeFoundryClient reply(String command, String replyType, String dataJson) {
        JsonNode data = dataJson != null ? json(dataJson) : null;
        scripts.put(command, request -> BridgeMessage.reply(replyType, data, request.getRequestId()));
        return this;
    }

    /** Answer {@code command} with an error tag and message. */
    public FakeFoundryClient fail(String command, String errorType, String error) {
        scripts.put(command, request -> BridgeMessage.errorReply(errorType, error, request.getRequestId()));
        return this;
    }

    public FakeFoundryClient script(String command, Function<BridgeMessage, BridgeMessage> script) {
        scripts.put(command, script);
        return this;
    }

    /** Last command of this type the client received. */
    public BridgeMessage lastReceived(String type) {
        for (int i = received.size() - 1; i >= 0; i--) {
            if (type.equals(received.get(i).getType())) {
                return received.get(i);
            }
        }
        return null;
    }

    public int receivedCount() {
        return received.size();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(BridgeMessage message) {
        received.add(message);
        Function<BridgeMessage, BridgeMessage> script = scripts.get(message.getType());
        if (script != null && message.hasRequestId()) {
            dispatcher.handleInbound(clientId, script.apply(message));
        }
    }

    @Override
    public void close() {
        open = false;
    }
}
