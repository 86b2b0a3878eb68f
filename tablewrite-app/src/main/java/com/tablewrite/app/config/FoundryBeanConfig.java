package com.tablewrite.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablewrite.bridge.BridgeDispatcher;
import com.tablewrite.foundry.actor.ActorBridge;
import com.tablewrite.foundry.file.FileBridge;
import com.tablewrite.foundry.folder.FolderBridge;
import com.tablewrite.foundry.item.ItemBridge;
import com.tablewrite.foundry.journal.JournalBridge;
import com.tablewrite.foundry.scene.SceneBridge;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Document adapters, all sharing the process-wide dispatcher.
 */
@Configuration
public class FoundryBeanConfig {

    @Bean
    public ActorBridge actorBridge(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        return new ActorBridge(dispatcher, objectMapper);
    }

    @Bean
    public ItemBridge itemBridge(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        return new ItemBridge(dispatcher, objectMapper);
    }

    @Bean
    public JournalBridge journalBridge(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        return new JournalBridge(dispatcher, objectMapper);
    }

    @Bean
    public SceneBridge sceneBridge(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        return new SceneBridge(dispatcher, objectMapper);
    }

    @Bean
    public FolderBridge folderBridge(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        return new FolderBridge(dispatcher, objectMapper);
    }

    @Bean
    public FileBridge fileBridge(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        return new FileBridge(dispatcher, objectMapper);
    }
}
