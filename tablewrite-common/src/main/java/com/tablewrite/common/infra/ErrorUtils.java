package com.tablewrite.common.infra;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Error formatting utilities.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        Throwable cause = unwrap(err);
        String msg = cause.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return cause.getClass().getSimpleName();
    }

    /**
     * Strip the wrappers added by {@code CompletableFuture} and
     * {@code Future#get}.
     */
    public static Throwable unwrap(Throwable err) {
        Throwable current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
