package com.tablewrite.foundry.folder;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablewrite.bridge.BridgeDispatcher;
import com.tablewrite.foundry.FoundryBridgeSupport;
import com.tablewrite.foundry.FoundryCommand;
import com.tablewrite.foundry.FoundryResult;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Folder management, used to file generated documents under a common root.
 */
public class FolderBridge extends FoundryBridgeSupport {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GetOrCreateRequest(String name, FolderType type, String parent) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ListRequest(FolderType type) {
    }

    record DeleteRequest(@JsonProperty("folder_id") String folderId,
            @JsonProperty("delete_contents") boolean deleteContents) {
    }

    public FolderBridge(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        super(dispatcher, objectMapper);
    }

    public CompletableFuture<FoundryResult<FolderRef>> getOrCreate(String name, FolderType type) {
        return getOrCreate(name, type, null, null);
    }

    /**
     * Find the folder with this name, type and parent, creating it when
     * absent. Idempotent on the client side.
     *
     * @param parentId parent folder id, null for a top-level folder
     */
    public CompletableFuture<FoundryResult<FolderRef>> getOrCreate(String name, FolderType type, String parentId,
            Duration timeout) {
        if (isBlank(name) || type == null) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Missing name or type"));
        }
        return exchange(FoundryCommand.GET_OR_CREATE_FOLDER, new GetOrCreateRequest(name, type, parentId),
                timeout, as(FolderRef.class));
    }

    /**
     * @param type only folders of this type; null for all
     */
    public CompletableFuture<FoundryResult<List<FolderInfo>>> list(FolderType type, Duration timeout) {
        return exchange(FoundryCommand.LIST_FOLDERS, new ListRequest(type), timeout,
                listOf("folders", FolderInfo.class));
    }

    public CompletableFuture<FoundryResult<FolderDeletion>> delete(String folderId, boolean deleteContents,
            Duration timeout) {
        if (isBlank(folderId)) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Missing folder_id"));
        }
        return exchange(FoundryCommand.DELETE_FOLDER, new DeleteRequest(folderId, deleteContents), timeout,
                as(FolderDeletion.class));
    }
}
