package com.tablewrite.foundry;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Turns the {@code data} object of a success reply into a typed value.
 * Never sees failure replies.
 */
@FunctionalInterface
public interface ReplyDecoder<T> {

    /**
     * @param data the reply's data object, never null
     * @throws IOException if the data does not have the expected shape
     */
    T decode(JsonNode data) throws IOException;
}
