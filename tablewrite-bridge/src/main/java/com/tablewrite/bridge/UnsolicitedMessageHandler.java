package com.tablewrite.bridge;

import com.tablewrite.bridge.protocol.BridgeProtocol.BridgeMessage;

/**
 * Receives inbound messages that are neither keep-alives nor replies to a
 * waiting call.
 */
@FunctionalInterface
public interface UnsolicitedMessageHandler {

    /**
     * @param connectionId  the connection the message arrived on
     * @param message       the message
     * @param endedCommand  command of the already-ended call the message's
     *                      request id belonged to, or null if the id is unknown
     */
    void handle(String connectionId, BridgeMessage message, String endedCommand);
}
