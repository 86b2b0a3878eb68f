package com.tablewrite.bridge;

import com.tablewrite.common.config.ConfigDefaults;
import com.tablewrite.common.config.TablewriteConfig;

import java.time.Duration;

/**
 * Timing knobs of a {@link BridgeDispatcher}.
 *
 * @param defaultTimeout     deadline used when a caller passes none
 * @param lateReplyRetention how long ended request ids are remembered
 * @param sweepInterval      period of the backstop sweep over pending calls
 */
public record DispatcherOptions(Duration defaultTimeout, Duration lateReplyRetention, Duration sweepInterval) {

    public static DispatcherOptions defaults() {
        return new DispatcherOptions(
                Duration.ofMillis(ConfigDefaults.DEFAULT_TIMEOUT_MS),
                Duration.ofMillis(ConfigDefaults.DEFAULT_LATE_REPLY_RETENTION_MS),
                Duration.ofMillis(ConfigDefaults.DEFAULT_SWEEP_INTERVAL_MS));
    }

    public static DispatcherOptions from(TablewriteConfig.BridgeConfig bridge) {
        return new DispatcherOptions(
                Duration.ofMillis(bridge.getDefaultTimeoutMs()),
                Duration.ofMillis(bridge.getLateReplyRetentionMs()),
                Duration.ofMillis(bridge.getSweepIntervalMs()));
    }
}
