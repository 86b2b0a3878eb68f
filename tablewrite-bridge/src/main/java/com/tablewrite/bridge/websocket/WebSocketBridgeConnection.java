package com.tablewrite.bridge.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablewrite.bridge.BridgeConnection;
import com.tablewrite.bridge.protocol.BridgeProtocol.BridgeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * {@link BridgeConnection} over a Spring WebSocket session.
 * The session is expected to be wrapped in a
 * {@code ConcurrentWebSocketSessionDecorator} so concurrent calls can write.
 */
@Slf4j
public class WebSocketBridgeConnection implements BridgeConnection {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketBridgeConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(BridgeMessage message) throws IOException {
        String json = objectMapper.writeValueAsString(message);
        if (!session.isOpen()) {
            throw new IOException("Session closed");
        }
        session.sendMessage(new TextMessage(json));
    }

    @Override
    public void close() {
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.SESSION_NOT_RELIABLE);
            }
        } catch (Exception e) {
            log.debug("close error session={}: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public String getRemoteAddress() {
        InetSocketAddress remote = session.getRemoteAddress();
        // Host string works for unresolved addresses too.
        return remote != null ? remote.getHostString() : null;
    }
}
