package com.tablewrite.foundry.file;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablewrite.bridge.BridgeDispatcher;
import com.tablewrite.foundry.FoundryBridgeSupport;
import com.tablewrite.foundry.FoundryCommand;
import com.tablewrite.foundry.FoundryResult;

import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Browsing and uploading files in the Foundry data directory.
 */
public class FileBridge extends FoundryBridgeSupport {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record ListRequest(String path, FileSource source, boolean recursive, List<String> extensions) {
    }

    record UploadRequest(String filename, String content, String destination) {
    }

    public FileBridge(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        super(dispatcher, objectMapper);
    }

    /**
     * List file paths under {@code path}.
     *
     * @param extensions suffix filter such as {@code .webp}; empty for all files
     */
    public CompletableFuture<FoundryResult<List<String>>> list(String path, FileSource source, boolean recursive,
            List<String> extensions, Duration timeout) {
        if (isBlank(path)) {
            return CompletableFuture.completedFuture(FoundryResult.failure("Path is required"));
        }
        ListRequest request = new ListRequest(path, source != null ? source : FileSource.PUBLIC, recursive,
                extensions);
        return exchange(FoundryCommand.LIST_FILES, request, timeout, listOf("files", String.class));
    }

    /**
     * Upload into {@code worlds/<world>/<destination>/}. The content travels
     * base64-encoded inside one frame, so it must fit the configured maximum
     * message size.
     */
    public CompletableFuture<FoundryResult<UploadedFile>> upload(String filename, byte[] content,
            String destination, Duration timeout) {
        if (isBlank(filename) || content == null || isBlank(destination)) {
            return CompletableFuture.completedFuture(
                    FoundryResult.failure("Missing filename, content or destination"));
        }
        UploadRequest request = new UploadRequest(filename, Base64.getEncoder().encodeToString(content),
                destination);
        return exchange(FoundryCommand.UPLOAD_FILE, request, timeout, as(UploadedFile.class));
    }
}
