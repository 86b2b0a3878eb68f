package com.tablewrite.bridge.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Foundry bridge wire protocol.
 *
 * <p>
 * Every frame is a JSON object:
 * <ul>
 * <li>{@code {type, data, request_id}} – backend→client command</li>
 * <li>{@code {type, data?, error?, request_id}} – client→backend reply, echoing the id</li>
 * <li>{@code {type:"ping"}} / {@code {type:"pong"}} – keep-alive, never correlated</li>
 * <li>{@code {type:"connected", client_id}} – sent once when a client attaches</li>
 * </ul>
 */
public final class BridgeProtocol {

    private BridgeProtocol() {
    }

    public static final String TYPE_PING = "ping";
    public static final String TYPE_PONG = "pong";
    public static final String TYPE_CONNECTED = "connected";

    /** Suffix of the reply tags a client uses to report a failed command. */
    public static final String ERROR_SUFFIX = "_error";

    // ── Message ──────────────────────────────────────────────────

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BridgeMessage {
        private String type;
        private JsonNode data;
        @JsonProperty("request_id")
        private String requestId;
        private String error;
        @JsonProperty("client_id")
        private String clientId;

        public static BridgeMessage request(String type, JsonNode data, String requestId) {
            return new BridgeMessage(type, data, requestId, null, null);
        }

        public static BridgeMessage reply(String type, JsonNode data, String requestId) {
            return new BridgeMessage(type, data, requestId, null, null);
        }

        public static BridgeMessage errorReply(String type, String error, String requestId) {
            return new BridgeMessage(type, null, requestId, error, null);
        }

        public static BridgeMessage pong() {
            return new BridgeMessage(TYPE_PONG, null, null, null, null);
        }

        public static BridgeMessage connected(String clientId) {
            return new BridgeMessage(TYPE_CONNECTED, null, null, null, clientId);
        }

        public boolean isKeepAlive() {
            return TYPE_PING.equals(type);
        }

        public boolean hasRequestId() {
            return requestId != null && !requestId.isEmpty();
        }
    }
}
