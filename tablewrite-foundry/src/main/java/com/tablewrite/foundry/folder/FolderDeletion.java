package com.tablewrite.foundry.folder;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code deletedCount} includes the documents inside the folder when their
 * deletion was requested.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FolderDeletion(
        @JsonProperty("deleted_count") int deletedCount,
        @JsonProperty("folder_name") String folderName) {
}
