package com.tablewrite.bridge.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablewrite.bridge.BridgeDispatcher;
import com.tablewrite.bridge.protocol.BridgeProtocol.BridgeMessage;
import com.tablewrite.common.config.TablewriteConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket endpoint the Foundry module connects to.
 *
 * <p>
 * On open the session is registered with the dispatcher and greeted with
 * {@code {type:"connected", client_id}}. Every text frame is decoded and
 * handed to {@link BridgeDispatcher#handleInbound}; frames that are not JSON
 * are logged and dropped without closing the session.
 */
@Slf4j
public class FoundryWebSocketHandler extends TextWebSocketHandler {

    /** Session attribute holding the bridge client id. */
    public static final String ATTR_CLIENT_ID = "bridge.clientId";

    private final ObjectMapper objectMapper;
    private final BridgeDispatcher dispatcher;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeLimit;
    private final boolean traceFrames;

    public FoundryWebSocketHandler(ObjectMapper objectMapper, BridgeDispatcher dispatcher,
            TablewriteConfig config) {
        this.objectMapper = objectMapper;
        this.dispatcher = dispatcher;
        this.sendTimeLimitMs = config.getBridge().getSendTimeLimitMs();
        this.sendBufferSizeLimit = config.getBridge().getSendBufferSizeLimit();
        this.traceFrames = config.getLogging() != null && config.getLogging().isTraceFrames();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var concurrent = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit);
        var connection = new WebSocketBridgeConnection(concurrent, objectMapper);
        String clientId = dispatcher.attach(connection);
        session.getAttributes().put(ATTR_CLIENT_ID, clientId);

        log.info("ws:open conn={} session={} remote={} clients={}",
                clientId, session.getId(), connection.getRemoteAddress(), dispatcher.connectionCount());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String clientId = clientId(session);
        if (clientId == null) {
            return;
        }
        String payload = message.getPayload();
        if (traceFrames) {
            log.debug("ws:in conn={} frame={}", clientId, payload);
        }

        BridgeMessage inbound;
        try {
            inbound = objectMapper.readValue(payload, BridgeMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("ws:parse-error conn={}: {}", clientId, e.getOriginalMessage());
            return;
        }
        dispatcher.handleInbound(clientId, inbound);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String clientId = clientId(session);
        dispatcher.detach(clientId);
        log.info("ws:close conn={} code={} reason={} clients={}",
                clientId, status.getCode(), status.getReason(), dispatcher.connectionCount());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("ws:error conn={}: {}", clientId(session), exception.getMessage());
    }

    private static String clientId(WebSocketSession session) {
        Object id = session.getAttributes().get(ATTR_CLIENT_ID);
        return id != null ? id.toString() : null;
    }
}
