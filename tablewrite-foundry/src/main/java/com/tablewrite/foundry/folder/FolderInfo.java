package com.tablewrite.foundry.folder;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A folder as listed by the client. {@code type} is the Foundry document
 * name ({@code Actor}, {@code JournalEntry}, ...); {@code parent} is null
 * for top-level folders.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FolderInfo(String id, String name, String type, String parent) {
}
