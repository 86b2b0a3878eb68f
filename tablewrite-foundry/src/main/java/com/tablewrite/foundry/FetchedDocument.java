package com.tablewrite.foundry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Full document data as the client serialized it.
 */
public record FetchedDocument(JsonNode entity) {

    public FetchedDocument {
        entity = entity != null ? entity : MissingNode.getInstance();
    }

    public String name() {
        return entity.path("name").asText(null);
    }

    public boolean isEmpty() {
        return entity.isMissingNode() || entity.isNull();
    }
}
