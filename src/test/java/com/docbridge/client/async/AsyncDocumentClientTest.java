package com.docbridge.client.async;

import com.docbridge.adapter.spi.ClientConfig;
import com.docbridge.adapter.spi.KeyCredential;
import com.docbridge.client.DocumentClient;
import com.docbridge.exceptions.ResourceExistsException;
import com.docbridge.exceptions.ResourceNotFoundException;
import com.docbridge.testing.CountingTransport;
import com.docbridge.testing.TestClients;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AsyncDocumentClient")
class AsyncDocumentClientTest {

    private CountingTransport transport;

    @BeforeEach
    void setUp() {
        transport = TestClients.countingTransport();
    }

    private AsyncDocumentClient open() {
        return new AsyncDocumentClient(
                ClientConfig.of(TestClients.ENDPOINT, new KeyCredential("test-key")), config -> transport);
    }

    @Test
    @DisplayName("should manage databases through futures")
    void databaseLifecycle_shouldComplete() throws Exception {
        try (AsyncDocumentClient client = open()) {
            client.createDatabase("shop").get(5, TimeUnit.SECONDS);
            client.createDatabase("archive").get(5, TimeUnit.SECONDS);
            client.deleteDatabase("archive").get(5, TimeUnit.SECONDS);

            List<Map<String, Object>> databases = client.listDatabases().get(5, TimeUnit.SECONDS);

            assertThat(databases).extracting(m -> m.get("id")).containsExactly("shop");
        }
    }

    @Test
    @DisplayName("should manage containers through futures")
    void containerLifecycle_shouldComplete() throws Exception {
        try (AsyncDocumentClient client = open()) {
            client.createDatabase("shop").get(5, TimeUnit.SECONDS);
            AsyncDatabaseProxy shop = client.getDatabaseClient("shop");

            shop.createContainer("products", Map.of("paths", List.of("/category"))).get(5, TimeUnit.SECONDS);
            shop.createContainer("orders", "/customerId").get(5, TimeUnit.SECONDS);
            shop.deleteContainer("orders").get(5, TimeUnit.SECONDS);

            assertThat(shop.listContainers().get(5, TimeUnit.SECONDS))
                    .extracting(m -> m.get("id")).containsExactly("products");
            assertThat(shop.read().get(5, TimeUnit.SECONDS)).containsEntry("id", "shop");
            assertThatThrownBy(() -> shop.createContainer("products", "/category").get(5, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(ResourceExistsException.class);
        }
    }

    @Test
    @DisplayName("should fail futures for missing databases")
    void deleteDatabase_missing_shouldFailFuture() {
        try (AsyncDocumentClient client = open()) {
            assertThatThrownBy(() -> client.getDatabaseClient("nope").delete().get(5, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    @DisplayName("should share closed state with a wrapped blocking client")
    void wrappedClient_shouldShareLifecycle() {
        DocumentClient blocking = TestClients.client(transport);
        AsyncDocumentClient client = new AsyncDocumentClient(blocking);

        assertThat(client.getEndpoint()).isEqualTo(TestClients.ENDPOINT);
        client.close();

        assertThat(blocking.isClosed()).isTrue();
        assertThat(client.isClosed()).isTrue();
        assertThat(transport.closeCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should hand out handles without I/O")
    void getDatabaseClient_shouldNotCallTransport() {
        try (AsyncDocumentClient client = open()) {
            AsyncContainerProxy container = client.getDatabaseClient("shop").getContainerClient("products", "/category");

            assertThat(container.getId()).isEqualTo("products");
            assertThat(container.getDatabaseId()).isEqualTo("shop");
            assertThat(transport.totalCalls()).isZero();
        }
    }
}
