package com.tablewrite.bridge;

import com.tablewrite.bridge.protocol.BridgeProtocol.BridgeMessage;

import java.io.IOException;

/**
 * One persistent channel to a remote Foundry client.
 * <p>
 * Implemented over a Spring WebSocket session in production and by in-memory
 * fakes in tests. The identity of a connection is assigned by
 * {@link ConnectionRegistry}, not by the connection itself.
 * </p>
 */
public interface BridgeConnection {

    /** Whether the underlying channel can still carry frames. */
    boolean isOpen();

    /**
     * Send one message.
     *
     * @throws IOException when the frame cannot be written
     */
    void send(BridgeMessage message) throws IOException;

    /** Close the channel, ignoring errors. */
    void close();

    /** Remote address for log lines, may be null. */
    default String getRemoteAddress() {
        return null;
    }
}
