package com.tablewrite.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the Tablewrite configuration file.
 * A missing or unreadable file yields the defaults from {@link ConfigDefaults}.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, TablewriteConfig> cache;
    private final Path configPath;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public TablewriteConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public TablewriteConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Shortcut for the bridge section with defaults applied.
     */
    public TablewriteConfig.BridgeConfig bridge() {
        return loadConfig().getBridge();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private TablewriteConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return ConfigDefaults.apply(new TablewriteConfig());
        }
        try {
            String raw = Files.readString(configPath);
            raw = substituteEnvVars(raw);
            TablewriteConfig config = objectMapper.readValue(raw, TablewriteConfig.class);
            if (config == null) {
                config = new TablewriteConfig();
            }
            log.info("Config loaded from: {}", configPath);
            return ConfigDefaults.apply(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return ConfigDefaults.apply(new TablewriteConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Map<String, String> env = System.getenv();
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
