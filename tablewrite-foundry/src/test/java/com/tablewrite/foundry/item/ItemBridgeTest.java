package com.tablewrite.foundry.item;

import com.tablewrite.bridge.BridgeDispatcher;
import com.tablewrite.bridge.protocol.BridgeProtocol.BridgeMessage;
import com.tablewrite.foundry.FakeFoundryClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ItemBridgeTest {

    private static final String FIRE_RESULTS = "{\"results\":["
            + "{\"uuid\":\"Compendium.dnd5e.spells.Item.abc123\",\"id\":\"abc123\",\"name\":\"Fireball\","
            + "\"type\":\"spell\",\"img\":\"icons/fire.webp\",\"pack\":\"DnD5e Spells\",\"system\":{\"level\":3}},"
            + "{\"uuid\":\"Compendium.dnd5e.spells.Item.def456\",\"id\":\"def456\",\"name\":\"Fire Bolt\","
            + "\"type\":\"spell\",\"img\":\"icons/bolt.webp\",\"pack\":\"DnD5e Spells\"}]}";

    private BridgeDispatcher dispatcher;
    private ItemBridge items;

    @BeforeEach
    void setUp() {
        dispatcher = FakeFoundryClient.newDispatcher();
        items = new ItemBridge(dispatcher, FakeFoundryClient.MAPPER);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    @Test
    void search_decodesResultsAndSendsCamelCaseFilters() throws Exception {
        var client = new FakeFoundryClient(dispatcher).connect().reply("search_items", "items_found", FIRE_RESULTS);

        var result = items.search("fire", "spell").get(2, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        List<ItemSummary> found = result.getValue();
        assertEquals(2, found.size());
        assertEquals("Fireball", found.get(0).name());
        assertEquals(3, found.get(0).spellLevel());
        assertEquals(-1, found.get(1).spellLevel());
        assertEquals("DnD5e Spells", found.get(1).pack());

        BridgeMessage sent = client.lastReceived("search_items");
        assertEquals("fire", sent.getData().path("query").asText());
        assertEquals("Item", sent.getData().path("documentType").asText());
        assertEquals("spell", sent.getData().path("subType").asText());
    }

    @Test
    void search_noMatches_isEmptySuccess() throws Exception {
        new FakeFoundryClient(dispatcher).connect().reply("search_items", "items_found", "{\"results\":[]}");

        var result = items.search("xyznonexistent123", null).get(2, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertTrue(result.getValue().isEmpty());
        assertNull(result.getError());
    }

    @Test
    void search_noClient_fails() throws Exception {
        var result = items.search("fire", null).get(2, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertEquals("No connection or timeout", result.getError());
    }

    @Test
    void search_clientError() throws Exception {
        new FakeFoundryClient(dispatcher).connect().fail("search_items", "search_error", "Index unavailable");

        assertEquals("Index unavailable", items.search("fire", null).get(2, TimeUnit.SECONDS).getError());
    }

    @Test
    void listCompendium_usesCompendiumTags() throws Exception {
        var client = new FakeFoundryClient(dispatcher).connect()
                .reply("list_compendium_items", "compendium_items", FIRE_RESULTS);

        var result = items.listCompendium("spell", null).get(2, TimeUnit.SECONDS);

        assertEquals(2, result.getValue().size());
        assertFalse(client.lastReceived("list_compendium_items").getData().has("query"));
    }

    @Test
    void get_acceptsItemOrEntityField() throws Exception {
        var client = new FakeFoundryClient(dispatcher).connect()
                .reply("get_item", "item_data", "{\"item\":{\"name\":\"Longsword\"}}");
        assertEquals("Longsword", items.get("Item.x").get(2, TimeUnit.SECONDS).getValue().name());

        client.reply("get_item", "item_data", "{\"entity\":{\"name\":\"Dagger\"}}");
        assertEquals("Dagger", items.get("Item.y").get(2, TimeUnit.SECONDS).getValue().name());
    }
}
