package com.docbridge.client.async;

import com.docbridge.adapter.spi.ClientConfig;
import com.docbridge.adapter.spi.Credential;
import com.docbridge.adapter.spi.DocumentTransportFactory;
import com.docbridge.adapter.spi.OperationType;
import com.docbridge.adapter.spi.RequestOptions;
import com.docbridge.bridge.ExecutionBridge;
import com.docbridge.client.DocumentClient;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking counterpart of {@link DocumentClient}.
 *
 * <p>Every operation returns immediately with a future completed on the shared
 * dispatcher, with the same results and the same exceptions as the blocking handle.
 * Handle accessors and {@link #close()} do no I/O and stay synchronous.
 */
public class AsyncDocumentClient implements AutoCloseable {

    private final DocumentClient client;
    private final ExecutionBridge bridge;

    public AsyncDocumentClient(String endpoint, String key) {
        this(new DocumentClient(endpoint, key));
    }

    public AsyncDocumentClient(String endpoint, Credential credential) {
        this(new DocumentClient(endpoint, credential));
    }

    public AsyncDocumentClient(ClientConfig config) {
        this(new DocumentClient(config));
    }

    public AsyncDocumentClient(ClientConfig config, DocumentTransportFactory transportFactory) {
        this(new DocumentClient(config, transportFactory));
    }

    /**
     * Wraps an open blocking client. Closing either closes both.
     */
    public AsyncDocumentClient(DocumentClient client) {
        this(client, ExecutionBridge.shared());
    }

    AsyncDocumentClient(DocumentClient client, ExecutionBridge bridge) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.bridge = Objects.requireNonNull(bridge, "bridge must not be null");
    }

    public String getEndpoint() {
        return client.getEndpoint();
    }

    public AsyncDatabaseProxy getDatabaseClient(String databaseId) {
        return new AsyncDatabaseProxy(client.getDatabaseClient(databaseId), bridge);
    }

    public CompletableFuture<Map<String, Object>> createDatabase(String databaseId) {
        return createDatabase(databaseId, RequestOptions.none());
    }

    public CompletableFuture<Map<String, Object>> createDatabase(String databaseId, RequestOptions options) {
        return bridge.runAsync(OperationType.CREATE_DATABASE, () -> client.createDatabase(databaseId, options));
    }

    public CompletableFuture<Void> deleteDatabase(String databaseId) {
        return deleteDatabase(databaseId, RequestOptions.none());
    }

    public CompletableFuture<Void> deleteDatabase(String databaseId, RequestOptions options) {
        return bridge.runAsync(OperationType.DELETE_DATABASE, () -> {
            client.deleteDatabase(databaseId, options);
            return null;
        });
    }

    public CompletableFuture<List<Map<String, Object>>> listDatabases() {
        return listDatabases(RequestOptions.none());
    }

    public CompletableFuture<List<Map<String, Object>>> listDatabases(RequestOptions options) {
        return bridge.runAsync(OperationType.LIST_DATABASES, () -> client.listDatabases(options));
    }

    public boolean isClosed() {
        return client.isClosed();
    }

    @Override
    public void close() {
        client.close();
    }
}
