package com.tablewrite.foundry;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.Objects;

/**
 * Outcome of one adapter operation: either a decoded value or an error
 * message suitable for showing to a user as-is.
 *
 * @param <T> decoded success type
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FoundryResult<T> {

    private final boolean success;
    private final T value;
    private final String error;

    private FoundryResult(boolean success, T value, String error) {
        this.success = success;
        this.value = value;
        this.error = error;
    }

    public static <T> FoundryResult<T> ok(T value) {
        return new FoundryResult<>(true, Objects.requireNonNull(value, "value"), null);
    }

    public static <T> FoundryResult<T> failure(String error) {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error message is required");
        }
        return new FoundryResult<>(false, null, error);
    }
}
