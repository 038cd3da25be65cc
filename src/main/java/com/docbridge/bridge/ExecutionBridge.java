package com.docbridge.bridge;

import com.docbridge.adapter.spi.OperationType;
import com.docbridge.exceptions.OperationException;
import com.docbridge.exceptions.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs collaborator calls on one process-wide runtime.
 *
 * <p>The runtime is built lazily on first use, exactly once, and never shut down.
 * {@link #runBlocking} starts a call on a runtime thread and parks only the calling
 * thread until it completes; failures are translated here and nowhere else.
 * {@link #runAsync} hands a task to the bounded dispatcher and returns immediately.
 * Neither path imposes a timeout.
 */
public final class ExecutionBridge {

    private static final Logger log = LoggerFactory.getLogger(ExecutionBridge.class);

    private static final ExecutionBridge SHARED =
            new ExecutionBridge(() -> BridgeRuntime.create(BridgeSettings.fromSystemProperties()));

    private final Supplier<BridgeRuntime> runtimeFactory;
    private final AtomicInteger constructions = new AtomicInteger();
    private volatile BridgeRuntime runtime;

    ExecutionBridge(Supplier<BridgeRuntime> runtimeFactory) {
        this.runtimeFactory = Objects.requireNonNull(runtimeFactory, "runtimeFactory must not be null");
    }

    /**
     * The bridge shared by every client in this process.
     */
    public static ExecutionBridge shared() {
        return SHARED;
    }

    /**
     * Runs a call to completion, blocking only the current thread.
     *
     * @throws OperationException translated from whatever the call failed with
     */
    public <T> T runBlocking(OperationType operation, TransportCall<T> call) {
        Objects.requireNonNull(call, "call must not be null");
        long startNanos = System.nanoTime();
        CompletableFuture<T> future = CompletableFuture
                .supplyAsync(call::start, runtime().runtime())
                .thenCompose(Function.identity());
        try {
            T result = future.get();
            if (log.isDebugEnabled()) {
                log.debug("{} completed in {} us", operation.operationName(),
                        TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - startNanos));
            }
            return result;
        } catch (ExecutionException e) {
            OperationException translated = ErrorTranslator.translate(e);
            log.debug("{} failed with {}: {}", operation.operationName(),
                    translated.getErrorKind(), translated.getMessage());
            throw translated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(operation.operationName() + " interrupted while waiting for a response", e);
        }
    }

    /**
     * Runs a task on the dispatcher.
     *
     * <p>Cancelling the returned future is best effort: a task that has not started is
     * skipped, a task already waiting on the network runs to completion and its result
     * is discarded.
     */
    public <T> CompletableFuture<T> runAsync(OperationType operation, Callable<T> task) {
        Objects.requireNonNull(task, "task must not be null");
        CompletableFuture<T> result = new CompletableFuture<>();
        runtime().dispatcher().execute(() -> {
            if (result.isDone()) {
                log.debug("{} cancelled before dispatch", operation.operationName());
                return;
            }
            try {
                result.complete(task.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            } catch (Error e) {
                result.completeExceptionally(e);
                throw e;
            }
        });
        return result;
    }

    BridgeRuntime runtime() {
        BridgeRuntime current = runtime;
        if (current == null) {
            synchronized (this) {
                current = runtime;
                if (current == null) {
                    current = runtimeFactory.get();
                    constructions.incrementAndGet();
                    runtime = current;
                    log.info("Execution runtime started ({} dispatcher threads)",
                            current.settings().dispatcherThreads());
                }
            }
        }
        return current;
    }

    /**
     * Number of times the runtime has been built; 0 or 1.
     */
    int constructionCount() {
        return constructions.get();
    }
}
