package com.docbridge.client.async;

import com.docbridge.adapter.spi.OperationType;
import com.docbridge.adapter.spi.RequestOptions;
import com.docbridge.bridge.ExecutionBridge;
import com.docbridge.client.DatabaseProxy;
import com.docbridge.partition.PartitionKeyDefinition;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking counterpart of {@link DatabaseProxy}.
 */
public class AsyncDatabaseProxy {

    private final DatabaseProxy database;
    private final ExecutionBridge bridge;

    AsyncDatabaseProxy(DatabaseProxy database, ExecutionBridge bridge) {
        this.database = database;
        this.bridge = bridge;
    }

    public String getId() {
        return database.getId();
    }

    public AsyncContainerProxy getContainerClient(String containerId) {
        return new AsyncContainerProxy(database.getContainerClient(containerId), bridge);
    }

    public AsyncContainerProxy getContainerClient(String containerId, String partitionKeyPath) {
        return new AsyncContainerProxy(database.getContainerClient(containerId, partitionKeyPath), bridge);
    }

    public CompletableFuture<Map<String, Object>> createContainer(String containerId, String partitionKeyPath) {
        return bridge.runAsync(OperationType.CREATE_CONTAINER,
                () -> database.createContainer(containerId, partitionKeyPath));
    }

    public CompletableFuture<Map<String, Object>> createContainer(String containerId, Map<String, ?> partitionKey) {
        return bridge.runAsync(OperationType.CREATE_CONTAINER,
                () -> database.createContainer(containerId, partitionKey));
    }

    public CompletableFuture<Map<String, Object>> createContainer(String containerId,
                                                                  PartitionKeyDefinition partitionKey,
                                                                  RequestOptions options) {
        return bridge.runAsync(OperationType.CREATE_CONTAINER,
                () -> database.createContainer(containerId, partitionKey, options));
    }

    public CompletableFuture<Void> deleteContainer(String containerId) {
        return deleteContainer(containerId, RequestOptions.none());
    }

    public CompletableFuture<Void> deleteContainer(String containerId, RequestOptions options) {
        return bridge.runAsync(OperationType.DELETE_CONTAINER, () -> {
            database.deleteContainer(containerId, options);
            return null;
        });
    }

    public CompletableFuture<List<Map<String, Object>>> listContainers() {
        return bridge.runAsync(OperationType.LIST_CONTAINERS, database::listContainers);
    }

    public CompletableFuture<Map<String, Object>> read() {
        return bridge.runAsync(OperationType.READ_DATABASE, database::read);
    }

    public CompletableFuture<Void> delete() {
        return bridge.runAsync(OperationType.DELETE_DATABASE, () -> {
            database.delete();
            return null;
        });
    }
}
