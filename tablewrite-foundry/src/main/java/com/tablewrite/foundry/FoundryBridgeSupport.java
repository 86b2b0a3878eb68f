package com.tablewrite.foundry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablewrite.bridge.BridgeDispatcher;
import com.tablewrite.bridge.CallOutcome;
import com.tablewrite.bridge.protocol.BridgeProtocol.BridgeMessage;
import com.tablewrite.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Base for the document adapters: issues one command through the
 * {@link BridgeDispatcher} and maps whatever comes back onto a
 * {@link FoundryResult}. The returned futures never complete exceptionally.
 */
@Slf4j
public abstract class FoundryBridgeSupport {

    /** Reported for every call that produced no reply at all. */
    public static final String NO_CONNECTION_OR_TIMEOUT = "No connection or timeout";

    protected final BridgeDispatcher dispatcher;
    protected final ObjectMapper objectMapper;

    protected FoundryBridgeSupport(BridgeDispatcher dispatcher, ObjectMapper objectMapper) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Send {@code command} and decode its success reply.
     *
     * @param timeout null for the dispatcher's default
     */
    protected <T> CompletableFuture<FoundryResult<T>> exchange(FoundryCommand command, Object payload,
            Duration timeout, ReplyDecoder<T> decoder) {
        CompletableFuture<CallOutcome> call;
        try {
            call = dispatcher.call(command.tag(), payload, timeout);
        } catch (RuntimeException e) {
            log.warn("foundry:{} not sent: {}", command.tag(), ErrorUtils.formatErrorMessage(e));
            return CompletableFuture.completedFuture(FoundryResult.failure(ErrorUtils.formatErrorMessage(e)));
        }
        CompletableFuture<FoundryResult<T>> result = call.<FoundryResult<T>>handle((outcome, err) -> {
            if (err != null) {
                log.debug("foundry:{} call ended abnormally: {}", command.tag(), ErrorUtils.formatErrorMessage(err));
                return FoundryResult.failure(NO_CONNECTION_OR_TIMEOUT);
            }
            return interpret(command, outcome, decoder);
        });
        // Callers only hold the derived future; cancelling it must release the waiter.
        result.whenComplete((value, err) -> {
            if (err instanceof CancellationException) {
                call.cancel(false);
            }
        });
        return result;
    }

    <T> FoundryResult<T> interpret(FoundryCommand command, CallOutcome outcome, ReplyDecoder<T> decoder) {
        if (outcome == null || !outcome.isReplied()) {
            log.debug("foundry:{} no reply status={}", command.tag(), outcome != null ? outcome.status() : null);
            return FoundryResult.failure(NO_CONNECTION_OR_TIMEOUT);
        }
        BridgeMessage reply = outcome.reply();
        if (!command.successTag().equals(reply.getType())) {
            String error = errorText(reply);
            log.info("foundry:{} failed type={} error={}", command.tag(), reply.getType(), error);
            return FoundryResult.failure(error);
        }

        JsonNode data = reply.getData();
        if (data == null || data.isNull()) {
            data = objectMapper.createObjectNode();
        }
        if (!data.isObject()) {
            return malformed(reply.getType(), "data is " + data.getNodeType().name().toLowerCase());
        }
        try {
            T value = decoder.decode(data);
            if (value == null) {
                return malformed(reply.getType(), "nothing decoded");
            }
            return FoundryResult.ok(value);
        } catch (IOException | RuntimeException e) {
            return malformed(reply.getType(), ErrorUtils.formatErrorMessage(e));
        }
    }

    private <T> FoundryResult<T> malformed(String type, String detail) {
        log.warn("foundry:decode failed type={}: {}", type, detail);
        return FoundryResult.failure("Malformed " + type + " reply: " + detail);
    }

    private static String errorText(BridgeMessage reply) {
        String error = reply.getError();
        if ((error == null || error.isBlank()) && reply.getData() != null) {
            JsonNode nested = reply.getData().path("error");
            error = nested.isTextual() ? nested.asText() : null;
        }
        if (error == null || error.isBlank()) {
            return "Unexpected response type: " + reply.getType();
        }
        return error;
    }

    protected static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    // --- Decoders ---

    /** Bind the whole data object to {@code type}. */
    protected <T> ReplyDecoder<T> as(Class<T> type) {
        return data -> objectMapper.treeToValue(data, type);
    }

    /** Bind the array under {@code field}; absent or null yields an empty list. */
    protected <E> ReplyDecoder<List<E>> listOf(String field, Class<E> elementType) {
        return data -> {
            JsonNode node = data.get(field);
            if (node == null || node.isNull()) {
                return List.of();
            }
            if (!node.isArray()) {
                throw new IOException("'" + field + "' is not an array");
            }
            List<E> items = objectMapper.readerForListOf(elementType).readValue(node);
            if (items.contains(null)) {
                throw new IOException("null entry in '" + field + "'");
            }
            return List.copyOf(items);
        };
    }

    /** Keep the JSON under the first present field, for full document fetches. */
    protected static ReplyDecoder<FetchedDocument> entity(String... fields) {
        return data -> {
            for (String field : fields) {
                JsonNode node = data.get(field);
                if (node != null && !node.isNull()) {
                    if (!node.isObject()) {
                        throw new IOException("'" + field + "' is not an object");
                    }
                    return new FetchedDocument(node);
                }
            }
            return new FetchedDocument(null);
        };
    }
}
