package com.docbridge.client;

import com.docbridge.adapter.spi.ClientConfig;
import com.docbridge.adapter.spi.Credential;
import com.docbridge.adapter.spi.DocumentTransport;
import com.docbridge.adapter.spi.DocumentTransportFactory;
import com.docbridge.adapter.spi.KeyCredential;
import com.docbridge.adapter.spi.OperationType;
import com.docbridge.adapter.spi.RequestOptions;
import com.docbridge.adapter.spi.ValidationResult;
import com.docbridge.bridge.ExecutionBridge;
import com.docbridge.exceptions.ConfigurationException;
import com.docbridge.marshal.PayloadMarshaler;
import com.docbridge.partition.PartitionKeyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point: owns the connection to one database account.
 *
 * <p>Database and container handles obtained from a client borrow its connection and
 * hold no resources of their own. Closing the client (directly or by leaving a
 * try-with-resources block) releases the connection; afterwards every operation on
 * the client or its handles fails with
 * {@link com.docbridge.exceptions.ClientClosedException} without contacting the server.
 *
 * <pre>{@code
 * try (DocumentClient client = new DocumentClient("mongodb://localhost:27017", key)) {
 *     ContainerProxy products = client.getDatabaseClient("shop").getContainerClient("products");
 *     products.createItem(Map.of("id", "1", "category", "electronics", "name", "Laptop"));
 * }
 * }</pre>
 */
public class DocumentClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DocumentClient.class);

    private final ClientConnection connection;

    public DocumentClient(String endpoint, String key) {
        this(endpoint, keyCredential(key));
    }

    public DocumentClient(String endpoint, Credential credential) {
        this(ClientConfig.of(endpoint, credential));
    }

    /**
     * Opens a client with the transport registered for the endpoint's scheme.
     *
     * @throws ConfigurationException if the configuration is invalid or no transport supports the endpoint
     */
    public DocumentClient(ClientConfig config) {
        this(config, DocumentTransportFactory.forEndpoint(config.getEndpoint()));
    }

    public DocumentClient(ClientConfig config, DocumentTransportFactory transportFactory) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(transportFactory, "transportFactory must not be null");

        ValidationResult validation = transportFactory.validateConfig(config);
        if (validation.isInvalid()) {
            throw new ConfigurationException("Invalid configuration: " + validation.allErrorMessages());
        }
        PartitionKeyResolver resolver = new PartitionKeyResolver(config.getListOption(
                ClientConfig.PARTITION_KEY_CANDIDATES, PartitionKeyResolver.DEFAULT_CANDIDATE_FIELDS));
        DocumentTransport transport = transportFactory.open(config);

        this.connection = new ClientConnection(config, transport, ExecutionBridge.shared(),
                new PayloadMarshaler(), resolver);
        log.info("Opened client for {}", config.getEndpoint());
    }

    public String getEndpoint() {
        return connection.config().getEndpoint();
    }

    /**
     * Returns a handle for a database. Performs no I/O and does not check existence.
     */
    public DatabaseProxy getDatabaseClient(String databaseId) {
        Objects.requireNonNull(databaseId, "databaseId must not be null");
        return new DatabaseProxy(connection, databaseId);
    }

    /**
     * Creates a database.
     *
     * @return the database properties
     * @throws com.docbridge.exceptions.ResourceExistsException if it already exists
     */
    public Map<String, Object> createDatabase(String databaseId) {
        return createDatabase(databaseId, RequestOptions.none());
    }

    public Map<String, Object> createDatabase(String databaseId, RequestOptions options) {
        Objects.requireNonNull(databaseId, "databaseId must not be null");
        return connection.executeForMap(OperationType.CREATE_DATABASE,
                () -> connection.transport().createDatabase(databaseId, options));
    }

    /**
     * Deletes a database and everything in it.
     *
     * @throws com.docbridge.exceptions.ResourceNotFoundException if it does not exist
     */
    public void deleteDatabase(String databaseId) {
        deleteDatabase(databaseId, RequestOptions.none());
    }

    public void deleteDatabase(String databaseId, RequestOptions options) {
        Objects.requireNonNull(databaseId, "databaseId must not be null");
        connection.executeVoid(OperationType.DELETE_DATABASE,
                () -> connection.transport().deleteDatabase(databaseId, options));
    }

    public List<Map<String, Object>> listDatabases() {
        return listDatabases(RequestOptions.none());
    }

    public List<Map<String, Object>> listDatabases(RequestOptions options) {
        return connection.executeForList(OperationType.LIST_DATABASES,
                () -> connection.transport().listDatabases(options));
    }

    public boolean isClosed() {
        return connection.isClosed();
    }

    /**
     * Releases the connection. Idempotent.
     */
    @Override
    public void close() {
        connection.close();
    }

    private static Credential keyCredential(String key) {
        if (key == null || key.isBlank()) {
            throw new ConfigurationException("credential is required");
        }
        return new KeyCredential(key);
    }
}
