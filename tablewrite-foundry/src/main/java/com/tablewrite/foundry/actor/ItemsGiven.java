package com.tablewrite.foundry.actor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of copying compendium items onto an actor. {@code errors} lists the
 * items that could not be fetched; the rest were still added.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ItemsGiven(
        @JsonProperty("actor_uuid") String actorUuid,
        @JsonProperty("items_added") int itemsAdded,
        @JsonProperty("errors") List<String> errors) {

    public ItemsGiven {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
