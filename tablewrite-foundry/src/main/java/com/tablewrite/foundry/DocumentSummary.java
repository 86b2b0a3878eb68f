package com.tablewrite.foundry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One row of a world document listing. {@code folder} is the containing
 * folder id, absent at the top level.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentSummary(String uuid, String id, String name, String folder) {
}
