package com.tablewrite.bridge;

import com.tablewrite.bridge.protocol.BridgeProtocol;
import com.tablewrite.bridge.protocol.BridgeProtocol.BridgeMessage;
import lombok.extern.slf4j.Slf4j;

/**
 * Default unsolicited handler: logs and drops.
 */
@Slf4j
public class LoggingUnsolicitedMessageHandler implements UnsolicitedMessageHandler {

    @Override
    public void handle(String connectionId, BridgeMessage message, String endedCommand) {
        if (endedCommand != null) {
            log.debug("bridge:late-reply conn={} id={} type={} command={}",
                    connectionId, message.getRequestId(), message.getType(), endedCommand);
        } else if (BridgeProtocol.TYPE_PONG.equals(message.getType())) {
            log.trace("bridge:pong conn={}", connectionId);
        } else if (message.hasRequestId()) {
            log.warn("bridge:drop conn={} id={} type={} reason=unknown-request-id",
                    connectionId, message.getRequestId(), message.getType());
        } else {
            log.info("bridge:drop conn={} type={} reason=unsolicited", connectionId, message.getType());
        }
    }
}
