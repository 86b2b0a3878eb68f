package com.tablewrite.foundry.folder;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Document collections a Foundry folder can hold.
 */
public enum FolderType {
    ACTOR("Actor"),
    JOURNAL_ENTRY("JournalEntry"),
    ITEM("Item"),
    SCENE("Scene");

    private final String documentName;

    FolderType(String documentName) {
        this.documentName = documentName;
    }

    @JsonValue
    public String documentName() {
        return documentName;
    }
}
