package com.tablewrite.app.config;

import com.tablewrite.common.config.ConfigService;
import com.tablewrite.common.config.TablewriteConfig;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Applies the configured log level to the {@code com.tablewrite} loggers and
 * reports where the bridge is listening once the server is up.
 */
@Slf4j
@Component
public class BridgeBootstrap {

    private final ConfigService configService;

    public BridgeBootstrap(ConfigService configService) {
        this.configService = configService;
    }

    @PostConstruct
    public void init() {
        TablewriteConfig config = configService.loadConfig();
        String level = config.getLogging().getLevel();
        try {
            LoggingSystem.get(getClass().getClassLoader())
                    .setLogLevel("com.tablewrite", LogLevel.valueOf(level.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown log level '{}'", level);
        }
        log.debug("Bridge config loaded from {}", configService.getConfigPath());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        TablewriteConfig.BridgeConfig bridge = configService.bridge();
        log.info("Foundry bridge ready (path={}, defaultTimeoutMs={}, allowedOrigins={})",
                bridge.getPath(), bridge.getDefaultTimeoutMs(), bridge.getAllowedOrigins());
    }
}
