package com.tablewrite.foundry.actor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ItemsRemoved(
        @JsonProperty("actor_uuid") String actorUuid,
        @JsonProperty("items_removed") int itemsRemoved,
        @JsonProperty("removed_names") List<String> removedNames) {

    public ItemsRemoved {
        removedNames = removedNames != null ? List.copyOf(removedNames) : List.of();
    }
}
