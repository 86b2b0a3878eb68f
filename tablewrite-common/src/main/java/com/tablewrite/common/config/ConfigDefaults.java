package com.tablewrite.common.config;

import java.util.List;

/**
 * Default values applied to a freshly loaded {@link TablewriteConfig}.
 */
public final class ConfigDefaults {

    private ConfigDefaults() {
    }

    public static final String DEFAULT_BRIDGE_PATH = "/ws/foundry";
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_MAX_MESSAGE_BYTES = 10 * 1024 * 1024; // 10 MB
    public static final int DEFAULT_SEND_TIME_LIMIT_MS = 10_000;
    public static final int DEFAULT_SEND_BUFFER_SIZE_LIMIT = 10 * 1024 * 1024;
    public static final long DEFAULT_LATE_REPLY_RETENTION_MS = 5 * 60_000L;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 60_000L;

    /**
     * Fill every unset field. Returns the same instance.
     */
    public static TablewriteConfig apply(TablewriteConfig config) {
        if (config.getBridge() == null) {
            config.setBridge(new TablewriteConfig.BridgeConfig());
        }
        TablewriteConfig.BridgeConfig bridge = config.getBridge();
        if (bridge.getPath() == null || bridge.getPath().isBlank()) {
            bridge.setPath(DEFAULT_BRIDGE_PATH);
        }
        if (bridge.getDefaultTimeoutMs() == null || bridge.getDefaultTimeoutMs() <= 0) {
            bridge.setDefaultTimeoutMs(DEFAULT_TIMEOUT_MS);
        }
        if (bridge.getAllowedOrigins() == null || bridge.getAllowedOrigins().isEmpty()) {
            bridge.setAllowedOrigins(List.of("*"));
        }
        if (bridge.getMaxMessageBytes() == null || bridge.getMaxMessageBytes() <= 0) {
            bridge.setMaxMessageBytes(DEFAULT_MAX_MESSAGE_BYTES);
        }
        if (bridge.getSendTimeLimitMs() == null || bridge.getSendTimeLimitMs() <= 0) {
            bridge.setSendTimeLimitMs(DEFAULT_SEND_TIME_LIMIT_MS);
        }
        if (bridge.getSendBufferSizeLimit() == null || bridge.getSendBufferSizeLimit() <= 0) {
            bridge.setSendBufferSizeLimit(DEFAULT_SEND_BUFFER_SIZE_LIMIT);
        }
        if (bridge.getLateReplyRetentionMs() == null || bridge.getLateReplyRetentionMs() < 0) {
            bridge.setLateReplyRetentionMs(DEFAULT_LATE_REPLY_RETENTION_MS);
        }
        if (bridge.getSweepIntervalMs() == null || bridge.getSweepIntervalMs() <= 0) {
            bridge.setSweepIntervalMs(DEFAULT_SWEEP_INTERVAL_MS);
        }

        if (config.getLogging() == null) {
            config.setLogging(new TablewriteConfig.LoggingConfig());
        }
        if (config.getLogging().getLevel() == null) {
            config.getLogging().setLevel("info");
        }
        return config;
    }
}
