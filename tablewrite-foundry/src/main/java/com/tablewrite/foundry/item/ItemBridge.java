package com.tablewrite.foundry.item;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablewrite.bridge.BridgeDispatcher;
import com.tablewrite.foundry.DocumentRequests;
import com.tablewrite.foundry.FetchedDocument;
import com.tablewrite.foundry.FoundryBridgeSupport;
import com.tablewrite.foundry.FoundryCommand;
import com.tablewrite.foundry.FoundryResult;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Compendium item lookups. The client caps a search at 200 entries; listing
 * a whole sub type is not capped and is the cheaper way to load every spell.
 */
public class ItemBridge extends FoundryBridgeSupport {

    /** Compendium document type searched when none is given. */
    public static final String DEFAULT_DOCUMENT_TYPE = "Item";

    // The Foundry module reads these keys in camelCase.
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SearchRequest(String query, String documentType, String subType) {
    }

    public ItemBridge(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        super(dispatcher, objectMapper);
    }

    public CompletableFuture<FoundryResult<List<ItemSummary>>> search(String query, String subType) {
        return search(query, DEFAULT_DOCUMENT_TYPE, subType, null);
    }

    /**
     * Case-insensitive name search across compendiums of {@code documentType}.
     *
     * @param subType item type filter such as {@code spell} or {@code weapon}; null for all
     */
    public CompletableFuture<FoundryResult<List<ItemSummary>>> search(String query, String documentType,
            String subType, Duration timeout) {
        SearchRequest request = new SearchRequest(query != null ? query : "",
                documentType != null ? documentType : DEFAULT_DOCUMENT_TYPE, subType);
        return exchange(FoundryCommand.SEARCH_ITEMS, request, timeout, listOf("results", ItemSummary.class));
    }

    public CompletableFuture<FoundryResult<List<ItemSummary>>> listCompendium(String subType, Duration timeout) {
        SearchRequest request = new SearchRequest(null, DEFAULT_DOCUMENT_TYPE, subType);
        return exchange(FoundryCommand.LIST_COMPENDIUM_ITEMS, request, timeout,
                listOf("results", ItemSummary.class));
    }

    public CompletableFuture<FoundryResult<FetchedDocument>> get(String uuid) {
        return get(uuid, null);
    }

    public CompletableFuture<FoundryResult<FetchedDocument>> get(String uuid, Duration timeout) {
        if (isBlank(uuid)) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Item uuid is required"));
        }
        // Older clients reply with "entity" instead of "item".
        return exchange(FoundryCommand.GET_ITEM, new DocumentRequests.ByUuid(uuid), timeout,
                entity("item", "entity"));
    }
}
