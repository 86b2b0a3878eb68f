package com.tablewrite.common.config;

import lombok.Data;

import java.util.List;

/**
 * Root configuration type for the Tablewrite backend.
 * Loaded from {@code ~/.tablewrite/config.json} by {@link ConfigService}.
 */
@Data
public class TablewriteConfig {

    /** Foundry bridge settings. */
    private BridgeConfig bridge;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class BridgeConfig {
        /** WebSocket endpoint path the Foundry module connects to. */
        private String path;
        /** Default per-call deadline when the caller does not pass one. */
        private Long defaultTimeoutMs;
        private List<String> allowedOrigins;
        /** Maximum inbound text frame size. */
        private Integer maxMessageBytes;
        /** Per-session send time limit before the session is considered stuck. */
        private Integer sendTimeLimitMs;
        private Integer sendBufferSizeLimit;
        /** How long the id of an ended call is remembered to classify late replies. */
        private Long lateReplyRetentionMs;
        /** Interval of the backstop sweep over the pending-call table. */
        private Long sweepIntervalMs;
    }

    @Data
    public static class LoggingConfig {
        private String level;
        /** Log every inbound and outbound frame at debug level. */
        private boolean traceFrames;
    }
}
