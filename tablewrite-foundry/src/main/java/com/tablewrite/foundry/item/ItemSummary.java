package com.tablewrite.foundry.item;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Compendium index entry. {@code pack} is the compendium's display label;
 * {@code system} carries the few indexed system fields (spell level and
 * school) when the client includes them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ItemSummary(String uuid, String id, String name, String type, String img, String pack,
        JsonNode system) {

    /** Spell level from the indexed system data, or -1. */
    public int spellLevel() {
        return system != null ? system.path("level").asInt(-1) : -1;
    }
}
