package com.purchasingpower.ragstore.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for {@link java.util.concurrent.CompletableFuture} pipelines.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException}
     * wrappers to reach the failure that was actually thrown.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
