package com.tablewrite.foundry.file;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code path} is relative to Foundry's data root, e.g.
 * {@code worlds/myworld/uploaded-maps/cave.webp}, and can be used directly as
 * an image source in document data.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadedFile(String path) {
}
