package com.tablewrite.bridge.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablewrite.bridge.BridgeDispatcher;
import com.tablewrite.common.config.ConfigService;
import com.tablewrite.common.config.TablewriteConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket configuration for the Foundry bridge.
 * Registers the bridge endpoint at the configured path (default
 * {@code /ws/foundry}).
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ObjectMapper objectMapper;
    private final BridgeDispatcher dispatcher;
    private final ConfigService configService;

    public WebSocketConfig(ObjectMapper objectMapper, BridgeDispatcher dispatcher, ConfigService configService) {
        this.objectMapper = objectMapper;
        this.dispatcher = dispatcher;
        this.configService = configService;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        TablewriteConfig.BridgeConfig bridge = configService.bridge();
        registry.addHandler(foundryWebSocketHandler(), bridge.getPath())
                .setAllowedOriginPatterns(bridge.getAllowedOrigins().toArray(String[]::new));
    }

    @Bean
    public FoundryWebSocketHandler foundryWebSocketHandler() {
        return new FoundryWebSocketHandler(objectMapper, dispatcher, configService.loadConfig());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        int maxBytes = configService.bridge().getMaxMessageBytes();
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxBytes);
        container.setMaxBinaryMessageBufferSize(maxBytes);
        container.setMaxSessionIdleTimeout(0L); // keep-alive is driven by client pings
        return container;
    }
}
