package com.tablewrite.app.api;

import com.tablewrite.foundry.DocumentSummary;
import com.tablewrite.foundry.FoundryResult;
import com.tablewrite.foundry.actor.ActorBridge;
import com.tablewrite.foundry.journal.JournalBridge;
import com.tablewrite.foundry.scene.SceneBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * REST access to world documents through the connected Foundry client.
 * <p>
 * Single-document failures map to 404, list failures to 503; the body always
 * carries the adapter's message unchanged. Handlers return futures so no
 * servlet thread waits on the bridge.
 */
@Slf4j
@RestController
@RequestMapping("/api/foundry")
public class FoundryController {

    private final ActorBridge actors;
    private final JournalBridge journals;
    private final SceneBridge scenes;

    public FoundryController(ActorBridge actors, JournalBridge journals, SceneBridge scenes) {
        this.actors = actors;
        this.journals = journals;
        this.scenes = scenes;
    }

    @GetMapping("/actor/{uuid}")
    public CompletableFuture<ResponseEntity<Object>> getActor(@PathVariable String uuid) {
        return actors.get(uuid).thenApply(result -> {
            if (!result.isSuccess()) {
                return error(HttpStatus.NOT_FOUND, result.getError());
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("uuid", uuid);
            body.put("name", result.getValue().name());
            body.put("entity", result.getValue().entity());
            return ResponseEntity.ok(body);
        });
    }

    @DeleteMapping("/actor/{uuid}")
    public CompletableFuture<ResponseEntity<Object>> deleteActor(@PathVariable String uuid) {
        return actors.delete(uuid).thenApply(result -> {
            if (!result.isSuccess()) {
                return error(HttpStatus.NOT_FOUND, result.getError());
            }
            log.info("api:delete actor uuid={} name={}", uuid, result.getValue().name());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("uuid", result.getValue().uuid() != null ? result.getValue().uuid() : uuid);
            body.put("name", result.getValue().name());
            return ResponseEntity.ok(body);
        });
    }

    @GetMapping("/actors")
    public CompletableFuture<ResponseEntity<Object>> listActors() {
        return actors.list().thenApply(result -> listing("actors", result));
    }

    @GetMapping("/journals")
    public CompletableFuture<ResponseEntity<Object>> listJournals() {
        return journals.list().thenApply(result -> listing("journals", result));
    }

    @GetMapping("/scenes")
    public CompletableFuture<ResponseEntity<Object>> listScenes() {
        return scenes.list(null).thenApply(result -> listing("scenes", result));
    }

    private static ResponseEntity<Object> listing(String field, FoundryResult<List<DocumentSummary>> result) {
        if (!result.isSuccess()) {
            return error(HttpStatus.SERVICE_UNAVAILABLE, result.getError());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("count", result.getValue().size());
        body.put(field, result.getValue());
        return ResponseEntity.ok(body);
    }

    private static ResponseEntity<Object> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
