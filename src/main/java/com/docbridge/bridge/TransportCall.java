package com.docbridge.bridge;

import java.util.concurrent.CompletableFuture;

/**
 * A collaborator call that has not been started yet.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface TransportCall<T> {

    /**
     * Starts the call. Invoked exactly once, on a runtime thread.
     */
    CompletableFuture<T> start();
}
