package com.tablewrite.foundry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DeletedDocument(String uuid, String name) {
}
