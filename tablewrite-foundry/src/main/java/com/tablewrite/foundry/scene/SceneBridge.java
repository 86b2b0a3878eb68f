package com.tablewrite.foundry.scene;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablewrite.bridge.BridgeDispatcher;
import com.tablewrite.foundry.CreatedDocument;
import com.tablewrite.foundry.DeletedDocument;
import com.tablewrite.foundry.DocumentRequests;
import com.tablewrite.foundry.DocumentSummary;
import com.tablewrite.foundry.FetchedDocument;
import com.tablewrite.foundry.FoundryBridgeSupport;
import com.tablewrite.foundry.FoundryCommand;
import com.tablewrite.foundry.FoundryResult;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public class SceneBridge extends FoundryBridgeSupport {

    record CreateRequest(JsonNode scene) {
    }

    public SceneBridge(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        super(dispatcher, objectMapper);
    }

    /**
     * Create a scene. Background image, grid and walls are part of the scene
     * data; the background must already be uploaded (see
     * {@link com.tablewrite.foundry.file.FileBridge#upload}).
     */
    public CompletableFuture<FoundryResult<CreatedDocument>> create(JsonNode scene, Duration timeout) {
        if (scene == null || !scene.isObject()) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Scene data is required"));
        }
        return exchange(FoundryCommand.CREATE_SCENE, new CreateRequest(scene), timeout,
                as(CreatedDocument.class));
    }

    public CompletableFuture<FoundryResult<FetchedDocument>> get(String uuid, Duration timeout) {
        if (isBlank(uuid)) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Scene uuid is required"));
        }
        return exchange(FoundryCommand.GET_SCENE, new DocumentRequests.ByUuid(uuid), timeout, entity("entity"));
    }

    public CompletableFuture<FoundryResult<DeletedDocument>> delete(String uuid, Duration timeout) {
        if (isBlank(uuid)) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Scene uuid is required"));
        }
        return exchange(FoundryCommand.DELETE_SCENE, new DocumentRequests.ByUuid(uuid), timeout,
                as(DeletedDocument.class));
    }

    public CompletableFuture<FoundryResult<List<DocumentSummary>>> list(Duration timeout) {
        return exchange(FoundryCommand.LIST_SCENES, DocumentRequests.LIST_ALL, timeout,
                listOf("scenes", DocumentSummary.class));
    }
}
