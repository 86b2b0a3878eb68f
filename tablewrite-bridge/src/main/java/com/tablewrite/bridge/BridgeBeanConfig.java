package com.tablewrite.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablewrite.common.config.ConfigService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for the bridge core. One registry, one pending-call
 * table and one dispatcher per process.
 */
@Configuration
public class BridgeBeanConfig {

    @Value("${tablewrite.config.path:~/.tablewrite/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(Path.of(configPath));
    }

    @Bean
    public ConnectionRegistry connectionRegistry() {
        return new ConnectionRegistry();
    }

    @Bean
    public PendingCallTable pendingCallTable() {
        return new PendingCallTable();
    }

    @Bean(destroyMethod = "close")
    public BridgeDispatcher bridgeDispatcher(ConnectionRegistry registry, PendingCallTable pendingCalls,
            ObjectMapper objectMapper, ConfigService configService) {
        return new BridgeDispatcher(registry, pendingCalls, objectMapper,
                DispatcherOptions.from(configService.bridge()));
    }
}
