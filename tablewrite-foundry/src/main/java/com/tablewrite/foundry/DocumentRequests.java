package com.tablewrite.foundry;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Outbound payloads shared by the actor, journal and scene adapters.
 */
public final class DocumentRequests {

    private DocumentRequests() {
    }

    /** {@code {uuid}} for get and delete. */
    public record ByUuid(String uuid) {
    }

    /** {@code {uuid, updates}}; updates use Foundry's dotted-path keys. */
    public record Update(String uuid, JsonNode updates) {
    }

    /** List commands carry an empty object. */
    public static final Map<String, Object> LIST_ALL = Map.of();
}
