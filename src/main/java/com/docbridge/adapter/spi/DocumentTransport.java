package com.docbridge.adapter.spi;

import com.docbridge.partition.PartitionKeyDefinition;
import com.docbridge.partition.PartitionKeyValue;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous document database verbs consumed by the client handles.
 *
 * <p>Implementations own connection setup, authentication, retries and wire formats.
 * They must be safe for concurrent use: one instance is shared by every handle of a
 * client without additional locking. Failures should complete the returned future
 * exceptionally with a {@link TransportFailure}; any other throwable is treated as an
 * unclassified failure.
 *
 * <p>Every call is started on a thread of the shared execution runtime, so an
 * implementation may block inside a verb as long as it returns a completed future.
 */
public interface DocumentTransport extends AutoCloseable {

    CompletableFuture<ObjectNode> createDatabase(String databaseId, RequestOptions options);

    CompletableFuture<ObjectNode> readDatabase(String databaseId, RequestOptions options);

    CompletableFuture<Void> deleteDatabase(String databaseId, RequestOptions options);

    CompletableFuture<List<ObjectNode>> listDatabases(RequestOptions options);

    CompletableFuture<ObjectNode> createContainer(
            String databaseId, String containerId, PartitionKeyDefinition partitionKey, RequestOptions options);

    CompletableFuture<ObjectNode> readContainer(ContainerAddress container, RequestOptions options);

    CompletableFuture<Void> deleteContainer(ContainerAddress container, RequestOptions options);

    CompletableFuture<List<ObjectNode>> listContainers(String databaseId, RequestOptions options);

    CompletableFuture<ObjectNode> createItem(
            ContainerAddress container, PartitionKeyValue partitionKey, ObjectNode item, RequestOptions options);

    CompletableFuture<ObjectNode> readItem(
            ContainerAddress container, String itemId, PartitionKeyValue partitionKey, RequestOptions options);

    CompletableFuture<ObjectNode> upsertItem(
            ContainerAddress container, PartitionKeyValue partitionKey, ObjectNode item, RequestOptions options);

    CompletableFuture<ObjectNode> replaceItem(
            ContainerAddress container, String itemId, PartitionKeyValue partitionKey, ObjectNode item,
            RequestOptions options);

    CompletableFuture<Void> deleteItem(
            ContainerAddress container, String itemId, PartitionKeyValue partitionKey, RequestOptions options);

    /**
     * Runs a query within a single partition.
     */
    CompletableFuture<List<ObjectNode>> queryItems(
            ContainerAddress container, String query, PartitionKeyValue partitionKey, RequestOptions options);

    /**
     * Releases connections held by this transport.
     */
    @Override
    void close();
}
