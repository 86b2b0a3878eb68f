package com.tablewrite.foundry.actor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
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
 * Actor operations against a connected Foundry world.
 * <p>
 * Actor payloads arrive already converted to Foundry's document schema;
 * this class only frames them.
 */
public class ActorBridge extends FoundryBridgeSupport {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CreateRequest(JsonNode actor, @JsonProperty("spell_uuids") List<String> spellUuids) {
    }

    record GiveItemsRequest(@JsonProperty("actor_uuid") String actorUuid,
            @JsonProperty("item_uuids") List<String> itemUuids) {
    }

    record RemoveItemsRequest(@JsonProperty("actor_uuid") String actorUuid,
            @JsonProperty("item_names") List<String> itemNames) {
    }

    public ActorBridge(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        super(dispatcher, objectMapper);
    }

    public CompletableFuture<FoundryResult<CreatedDocument>> create(JsonNode actor) {
        return create(actor, List.of(), null);
    }

    /**
     * Create a world actor. {@code spellUuids} are compendium spells the
     * client attaches after creation.
     */
    public CompletableFuture<FoundryResult<CreatedDocument>> create(JsonNode actor, List<String> spellUuids,
            Duration timeout) {
        if (actor == null || !actor.isObject()) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Actor data is required"));
        }
        return exchange(FoundryCommand.CREATE_ACTOR, new CreateRequest(actor,
                spellUuids == null || spellUuids.isEmpty() ? null : spellUuids), timeout,
                as(CreatedDocument.class));
    }

    public CompletableFuture<FoundryResult<FetchedDocument>> get(String uuid) {
        return get(uuid, null);
    }

    public CompletableFuture<FoundryResult<FetchedDocument>> get(String uuid, Duration timeout) {
        if (isBlank(uuid)) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Actor uuid is required"));
        }
        return exchange(FoundryCommand.GET_ACTOR, new DocumentRequests.ByUuid(uuid), timeout, entity("entity"));
    }

    public CompletableFuture<FoundryResult<DeletedDocument>> delete(String uuid) {
        return delete(uuid, null);
    }

    public CompletableFuture<FoundryResult<DeletedDocument>> delete(String uuid, Duration timeout) {
        if (isBlank(uuid)) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Actor uuid is required"));
        }
        return exchange(FoundryCommand.DELETE_ACTOR, new DocumentRequests.ByUuid(uuid), timeout,
                as(DeletedDocument.class));
    }

    /** World actors only; compendium entries are not listed. */
    public CompletableFuture<FoundryResult<List<DocumentSummary>>> list() {
        return list(null);
    }

    public CompletableFuture<FoundryResult<List<DocumentSummary>>> list(Duration timeout) {
        return exchange(FoundryCommand.LIST_ACTORS, DocumentRequests.LIST_ALL, timeout,
                listOf("actors", DocumentSummary.class));
    }

    public CompletableFuture<FoundryResult<CreatedDocument>> update(String uuid, JsonNode updates,
            Duration timeout) {
        if (isBlank(uuid) || updates == null || !updates.isObject()) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Actor uuid and updates are required"));
        }
        return exchange(FoundryCommand.UPDATE_ACTOR, new DocumentRequests.Update(uuid, updates), timeout,
                as(CreatedDocument.class));
    }

    /**
     * Copy compendium items (spells, weapons, features) onto an actor.
     */
    public CompletableFuture<FoundryResult<ItemsGiven>> giveItems(String actorUuid, List<String> itemUuids,
            Duration timeout) {
        if (isBlank(actorUuid) || itemUuids == null || itemUuids.isEmpty()) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Missing actor_uuid or item_uuids"));
        }
        return exchange(FoundryCommand.GIVE_ITEMS, new GiveItemsRequest(actorUuid, itemUuids),
                timeout, as(ItemsGiven.class));
    }

    /** Remove embedded items from an actor by item name. */
    public CompletableFuture<FoundryResult<ItemsRemoved>> removeItems(String actorUuid, List<String> itemNames,
            Duration timeout) {
        if (isBlank(actorUuid) || itemNames == null || itemNames.isEmpty()) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Missing actor_uuid or item_names"));
        }
        return exchange(FoundryCommand.REMOVE_ACTOR_ITEMS,
                new RemoveItemsRequest(actorUuid, itemNames), timeout, as(ItemsRemoved.class));
    }
}
