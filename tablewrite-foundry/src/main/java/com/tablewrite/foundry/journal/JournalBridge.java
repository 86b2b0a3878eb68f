package com.tablewrite.foundry.journal;

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

/**
 * Journal entry operations. A journal arrives with its pages already
 * rendered to HTML.
 */
public class JournalBridge extends FoundryBridgeSupport {

    record CreateRequest(JsonNode journal) {
    }

    public JournalBridge(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        super(dispatcher, objectMapper);
    }

    public CompletableFuture<FoundryResult<CreatedDocument>> create(JsonNode journal) {
        return create(journal, null);
    }

    public CompletableFuture<FoundryResult<CreatedDocument>> create(JsonNode journal, Duration timeout) {
        if (journal == null || !journal.isObject()) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Journal data is required"));
        }
        return exchange(FoundryCommand.CREATE_JOURNAL, new CreateRequest(journal), timeout,
                as(CreatedDocument.class));
    }

    public CompletableFuture<FoundryResult<FetchedDocument>> get(String uuid, Duration timeout) {
        if (isBlank(uuid)) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Journal uuid is required"));
        }
        return exchange(FoundryCommand.GET_JOURNAL, new DocumentRequests.ByUuid(uuid), timeout,
                entity("entity"));
    }

    public CompletableFuture<FoundryResult<DeletedDocument>> delete(String uuid, Duration timeout) {
        if (isBlank(uuid)) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Journal uuid is required"));
        }
        return exchange(FoundryCommand.DELETE_JOURNAL, new DocumentRequests.ByUuid(uuid), timeout,
                as(DeletedDocument.class));
    }

    public CompletableFuture<FoundryResult<List<DocumentSummary>>> list() {
        return list(null);
    }

    public CompletableFuture<FoundryResult<List<DocumentSummary>>> list(Duration timeout) {
        return exchange(FoundryCommand.LIST_JOURNALS, DocumentRequests.LIST_ALL, timeout,
                listOf("journals", DocumentSummary.class));
    }

    public CompletableFuture<FoundryResult<CreatedDocument>> update(String uuid, JsonNode updates,
            Duration timeout) {
        if (isBlank(uuid) || updates == null || !updates.isObject()) {
            return CompletableFuture.completedFuture(
                    FoundryResult.failure("Journal uuid and updates are required"));
        }
        return exchange(FoundryCommand.UPDATE_JOURNAL, new DocumentRequests.Update(uuid, updates), timeout,
                as(CreatedDocument.class));
    }
}
