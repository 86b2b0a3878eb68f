package com.tablewrite.foundry.folder;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FolderRef(
        @JsonProperty("folder_id") String folderId,
        @JsonProperty("folder_uuid") String folderUuid,
        @JsonProperty("name") String name) {
}
