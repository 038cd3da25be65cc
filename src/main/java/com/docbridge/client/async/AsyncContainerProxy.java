package com.docbridge.client.async;

import com.docbridge.adapter.spi.OperationType;
import com.docbridge.adapter.spi.RequestOptions;
import com.docbridge.bridge.ExecutionBridge;
import com.docbridge.client.ContainerProxy;
import com.docbridge.partition.PartitionKeyPath;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking counterpart of {@link ContainerProxy}.
 *
 * <p>Payload and partition-key errors are reported through the returned future, never
 * thrown from the calling thread.
 */
public class AsyncContainerProxy {

    private final ContainerProxy container;
    private final ExecutionBridge bridge;

    AsyncContainerProxy(ContainerProxy container, ExecutionBridge bridge) {
        this.container = container;
        this.bridge = bridge;
    }

    public String getId() {
        return container.getId();
    }

    public String getDatabaseId() {
        return container.getDatabaseId();
    }

    public CompletableFuture<Map<String, Object>> createItem(Object body) {
        return createItem(body, RequestOptions.none());
    }

    public CompletableFuture<Map<String, Object>> createItem(Object body, RequestOptions options) {
        return bridge.runAsync(OperationType.CREATE_ITEM, () -> container.createItem(body, options));
    }

    public CompletableFuture<Map<String, Object>> upsertItem(Object body) {
        return upsertItem(body, RequestOptions.none());
    }

    public CompletableFuture<Map<String, Object>> upsertItem(Object body, RequestOptions options) {
        return bridge.runAsync(OperationType.UPSERT_ITEM, () -> container.upsertItem(body, options));
    }

    public CompletableFuture<Map<String, Object>> readItem(String itemId, Object partitionKey) {
        return readItem(itemId, partitionKey, RequestOptions.none());
    }

    public CompletableFuture<Map<String, Object>> readItem(String itemId, Object partitionKey,
                                                           RequestOptions options) {
        return bridge.runAsync(OperationType.READ_ITEM, () -> container.readItem(itemId, partitionKey, options));
    }

    public CompletableFuture<Map<String, Object>> replaceItem(String itemId, Object body, Object partitionKey) {
        return replaceItem(itemId, body, RequestOptions.partitionKey(partitionKey));
    }

    public CompletableFuture<Map<String, Object>> replaceItem(String itemId, Object body, RequestOptions options) {
        return bridge.runAsync(OperationType.REPLACE_ITEM, () -> container.replaceItem(itemId, body, options));
    }

    public CompletableFuture<Void> deleteItem(String itemId, Object partitionKey) {
        return deleteItem(itemId, partitionKey, RequestOptions.none());
    }

    public CompletableFuture<Void> deleteItem(String itemId, Object partitionKey, RequestOptions options) {
        return bridge.runAsync(OperationType.DELETE_ITEM, () -> {
            container.deleteItem(itemId, partitionKey, options);
            return null;
        });
    }

    public CompletableFuture<List<Map<String, Object>>> queryItems(String query, Object partitionKey) {
        return queryItems(query, RequestOptions.partitionKey(partitionKey));
    }

    public CompletableFuture<List<Map<String, Object>>> queryItems(String query, RequestOptions options) {
        return bridge.runAsync(OperationType.QUERY_ITEMS, () -> container.queryItems(query, options));
    }

    public CompletableFuture<Map<String, Object>> read() {
        return bridge.runAsync(OperationType.READ_CONTAINER, container::read);
    }

    public CompletableFuture<Optional<PartitionKeyPath>> getPartitionKeyPath() {
        return bridge.runAsync(OperationType.READ_CONTAINER, container::getPartitionKeyPath);
    }

    public CompletableFuture<Void> delete() {
        return bridge.runAsync(OperationType.DELETE_CONTAINER, () -> {
            container.delete();
            return null;
        });
    }
}
