package com.docbridge.client;

import com.docbridge.adapter.spi.OperationType;
import com.docbridge.adapter.spi.RequestOptions;
import com.docbridge.exceptions.InvalidPayloadException;
import com.docbridge.partition.PartitionKeyDefinition;
import com.docbridge.partition.PartitionKeyPath;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Handle for one database. Cheap to create; holds no resources.
 */
public class DatabaseProxy {

    private final ClientConnection connection;
    private final String id;

    DatabaseProxy(ClientConnection connection, String id) {
        this.connection = connection;
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Returns a handle for a container. Performs no I/O; the partition-key path is
     * fetched later on demand.
     */
    public ContainerProxy getContainerClient(String containerId) {
        Objects.requireNonNull(containerId, "containerId must not be null");
        return new ContainerProxy(connection, id, containerId, null);
    }

    /**
     * Returns a handle for a container whose partition-key path is already known,
     * so item writes can read the key from the body without a metadata lookup.
     *
     * @throws InvalidPayloadException if the path is malformed
     */
    public ContainerProxy getContainerClient(String containerId, String partitionKeyPath) {
        Objects.requireNonNull(containerId, "containerId must not be null");
        return new ContainerProxy(connection, id, containerId,
                definitionOf(() -> PartitionKeyPath.parse(partitionKeyPath)));
    }

    /**
     * Creates a container partitioned on a single path such as {@code /category}.
     *
     * @throws InvalidPayloadException if the path is malformed
     */
    public Map<String, Object> createContainer(String containerId, String partitionKeyPath) {
        return createContainer(containerId, definitionOf(() -> PartitionKeyDefinition.of(partitionKeyPath)),
                RequestOptions.none());
    }

    /**
     * Creates a container from a definition map such as
     * {@code {"paths": ["/category"], "kind": "Hash"}}.
     *
     * @throws InvalidPayloadException if the map is not a usable definition
     */
    public Map<String, Object> createContainer(String containerId, Map<String, ?> partitionKey) {
        PartitionKeyDefinition definition = definitionOf(
                () -> PartitionKeyDefinition.fromJson(connection.marshaler().encode(partitionKey)));
        return createContainer(containerId, definition, RequestOptions.none());
    }

    public Map<String, Object> createContainer(String containerId, PartitionKeyDefinition partitionKey) {
        return createContainer(containerId, partitionKey, RequestOptions.none());
    }

    /**
     * Creates a container.
     *
     * @throws com.docbridge.exceptions.ResourceExistsException if it already exists
     */
    public Map<String, Object> createContainer(String containerId, PartitionKeyDefinition partitionKey,
                                               RequestOptions options) {
        Objects.requireNonNull(containerId, "containerId must not be null");
        Objects.requireNonNull(partitionKey, "partitionKey must not be null");
        return connection.executeForMap(OperationType.CREATE_CONTAINER,
                () -> connection.transport().createContainer(id, containerId, partitionKey, options));
    }

    public void deleteContainer(String containerId) {
        deleteContainer(containerId, RequestOptions.none());
    }

    public void deleteContainer(String containerId, RequestOptions options) {
        getContainerClient(containerId).delete(options);
    }

    public List<Map<String, Object>> listContainers() {
        return listContainers(RequestOptions.none());
    }

    public List<Map<String, Object>> listContainers(RequestOptions options) {
        return connection.executeForList(OperationType.LIST_CONTAINERS,
                () -> connection.transport().listContainers(id, options));
    }

    /**
     * Reads the database properties.
     *
     * @throws com.docbridge.exceptions.ResourceNotFoundException if the database does not exist
     */
    public Map<String, Object> read() {
        return read(RequestOptions.none());
    }

    public Map<String, Object> read(RequestOptions options) {
        return connection.executeForMap(OperationType.READ_DATABASE,
                () -> connection.transport().readDatabase(id, options));
    }

    public void delete() {
        delete(RequestOptions.none());
    }

    public void delete(RequestOptions options) {
        connection.executeVoid(OperationType.DELETE_DATABASE,
                () -> connection.transport().deleteDatabase(id, options));
    }

    private static <T> T definitionOf(Supplier<T> parser) {
        try {
            return parser.get();
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException("Invalid partition key definition: " + e.getMessage(), e);
        }
    }
}
