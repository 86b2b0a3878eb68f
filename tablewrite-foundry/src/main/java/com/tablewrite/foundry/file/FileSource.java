package com.tablewrite.foundry.file;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Foundry file storage roots.
 */
public enum FileSource {
    DATA("data"),
    PUBLIC("public"),
    S3("s3");

    private final String wireName;

    FileSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
