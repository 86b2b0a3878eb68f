package com.tablewrite.foundry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Identity of a document a client created or updated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreatedDocument(String uuid, String id, String name) {
}
