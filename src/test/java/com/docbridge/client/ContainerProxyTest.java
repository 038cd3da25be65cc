package com.docbridge.client;

import com.docbridge.adapter.memory.InMemoryDocumentTransport;
import com.docbridge.adapter.spi.ContainerAddress;
import com.docbridge.adapter.spi.OperationType;
import com.docbridge.adapter.spi.RequestOptions;
import com.docbridge.adapter.spi.TransportFailure;
import com.docbridge.exceptions.ErrorKind;
import com.docbridge.exceptions.HttpResponseException;
import com.docbridge.exceptions.InvalidPayloadException;
import com.docbridge.exceptions.MissingPartitionKeyException;
import com.docbridge.exceptions.PreconditionFailedException;
import com.docbridge.exceptions.ResourceExistsException;
import com.docbridge.exceptions.ResourceNotFoundException;
import com.docbridge.exceptions.TransportException;
import com.docbridge.exceptions.TypeMismatchException;
import com.docbridge.partition.PartitionKeyValue;
import com.docbridge.testing.CountingTransport;
import com.docbridge.testing.TestClients;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ContainerProxy")
class ContainerProxyTest {

    private CountingTransport transport;
    private DocumentClient client;
    private ContainerProxy products;

    @BeforeEach
    void setUp() {
        transport = TestClients.countingTransport();
        client = TestClients.client(transport);
        client.createDatabase("shop");
        client.getDatabaseClient("shop").createContainer("products", "/category");
        products = client.getDatabaseClient("shop").getContainerClient("products");
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private static CountingTransport failingReads(TransportFailure failure) {
        return new CountingTransport(new InMemoryDocumentTransport()) {
            @Override
            public CompletableFuture<ObjectNode> readItem(ContainerAddress container, String itemId,
                                                          PartitionKeyValue partitionKey, RequestOptions options) {
                super.readItem(container, itemId, partitionKey, options);
                return CompletableFuture.failedFuture(failure);
            }
        };
    }

    private static Map<String, Object> laptop() {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("id", "1");
        item.put("category", "electronics");
        item.put("name", "Laptop");
        item.put("price", 999);
        return item;
    }

    @Nested
    @DisplayName("Local validation before any network call")
    class LocalValidationTests {

        @Test
        @DisplayName("should reject invalid JSON text without contacting the server")
        void createItem_invalidText_shouldNotCallTransport() {
            int before = transport.totalCalls();

            assertThatThrownBy(() -> products.createItem("{\"id\": \"1\", \"category\": "))
                    .isInstanceOf(InvalidPayloadException.class);

            assertThat(transport.totalCalls()).isEqualTo(before);
        }

        @Test
        @DisplayName("should fail with a missing partition key without contacting the server")
        void createItem_noCandidates_shouldNotCallTransport() {
            int before = transport.totalCalls();

            assertThatThrownBy(() -> products.createItem(Map.of("id", "1", "name", "Laptop")))
                    .isInstanceOf(MissingPartitionKeyException.class);

            assertThat(transport.totalCalls()).isEqualTo(before);
        }

        @Test
        @DisplayName("should reject unsupported bodies without contacting the server")
        void createItem_unsupportedBody_shouldNotCallTransport() {
            int before = transport.totalCalls();

            assertThatThrownBy(() -> products.upsertItem(42)).isInstanceOf(TypeMismatchException.class);
            assertThatThrownBy(() -> products.createItem("[1, 2]")).isInstanceOf(TypeMismatchException.class);

            assertThat(transport.totalCalls()).isEqualTo(before);
        }

        @Test
        @DisplayName("should require an explicit key for reads, replaces, deletes and queries")
        void explicitKeyOperations_withoutKey_shouldNotCallTransport() {
            int before = transport.totalCalls();

            assertThatThrownBy(() -> products.readItem("1", null)).isInstanceOf(MissingPartitionKeyException.class);
            assertThatThrownBy(() -> products.replaceItem("1", laptop(), RequestOptions.none()))
                    .isInstanceOf(MissingPartitionKeyException.class);
            assertThatThrownBy(() -> products.deleteItem("1", null)).isInstanceOf(MissingPartitionKeyException.class);
            assertThatThrownBy(() -> products.queryItems("SELECT * FROM c", RequestOptions.none()))
                    .isInstanceOf(MissingPartitionKeyException.class);

            assertThat(transport.totalCalls()).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("Partition key resolution")
    class PartitionKeyTests {

        @Test
        @DisplayName("should detect the key from a candidate field")
        void createItem_candidateField_shouldRouteByIt() {
            products.createItem(laptop());

            assertThat(transport.lastPartitionKey()).isEqualTo(PartitionKeyValue.of("electronics"));
            assertThat(products.readItem("1", "electronics")).containsEntry("name", "Laptop");
        }

        @Test
        @DisplayName("should detect the key from JSON text bodies too")
        void createItem_text_shouldRouteByCandidate() {
            products.createItem("{\"id\":\"2\",\"category\":\"books\",\"title\":\"Dune\"}");

            assertThat(transport.lastPartitionKey()).isEqualTo(PartitionKeyValue.of("books"));
        }

        @Test
        @DisplayName("should let an explicit key override detection")
        void createItem_explicitKey_shouldWin() {
            Map<String, Object> item = Map.of("id", "3", "type", "gadget");

            products.createItem(item, RequestOptions.partitionKey("accessories"));

            assertThat(transport.lastPartitionKey()).isEqualTo(PartitionKeyValue.of("accessories"));
        }

        @Test
        @DisplayName("should read the declared path once known")
        void createItem_knownPath_shouldUseDeclaredPath() {
            ContainerProxy known = client.getDatabaseClient("shop").getContainerClient("products", "/category");

            assertThatThrownBy(() -> known.createItem(Map.of("id", "4", "pk", "x")))
                    .isInstanceOf(MissingPartitionKeyException.class)
                    .hasMessageContaining("/category");
        }

        @Test
        @DisplayName("should fetch and cache the partition-key path on demand")
        void getPartitionKeyPath_shouldFetchOnce() {
            assertThat(products.getPartitionKeyPath()).hasValueSatisfying(p -> assertThat(p.path()).isEqualTo("/category"));
            assertThat(products.getPartitionKeyPath()).isPresent();

            assertThat(transport.calls(OperationType.READ_CONTAINER)).isEqualTo(1);
        }

        @Test
        @DisplayName("should cache the path when reading the container")
        void read_shouldCachePath() {
            Map<String, Object> properties = products.read();

            assertThat(properties).containsEntry("id", "products");
            products.getPartitionKeyPath();
            assertThat(transport.calls(OperationType.READ_CONTAINER)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Item operations")
    class ItemOperationTests {

        @Test
        @DisplayName("should return the stored item with system properties")
        void createItem_shouldReturnStoredItem() {
            Map<String, Object> stored = products.createItem(laptop());

            assertThat(stored).containsEntry("id", "1").containsEntry("price", 999).containsKeys("_etag", "_ts");
        }

        @Test
        @DisplayName("should replace with the partition key given positionally")
        void replaceItem_shouldReplace() {
            products.createItem(laptop());
            Map<String, Object> updated = laptop();
            updated.put("price", 899);

            products.replaceItem("1", updated, "electronics");

            assertThat(products.readItem("1", "electronics")).containsEntry("price", 899);
        }

        @Test
        @DisplayName("should upsert and delete")
        void upsertAndDelete_shouldRoundTrip() {
            products.upsertItem(laptop());
            products.upsertItem(laptop());

            products.deleteItem("1", "electronics");

            assertThatThrownBy(() -> products.readItem("1", "electronics"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("should query within one partition")
        void queryItems_shouldReturnDecodedItems() {
            products.createItem(laptop());
            products.createItem(Map.of("id", "2", "category", "electronics", "price", 20));
            products.createItem(Map.of("id", "3", "category", "books", "price", 10));

            List<Map<String, Object>> cheap = products.queryItems("SELECT * FROM c WHERE c.price < 100", "electronics");

            assertThat(cheap).extracting(m -> m.get("id")).containsExactly("2");
        }
    }

    @Nested
    @DisplayName("Failure classification")
    class FailureTests {

        @Test
        @DisplayName("should raise ResourceNotFoundException for missing items")
        void readItem_missing_shouldBeNotFound() {
            assertThatThrownBy(() -> products.readItem("nope", "electronics"))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .satisfies(e -> assertThat(((HttpResponseException) e).getStatusCode()).isEqualTo(404));
        }

        @Test
        @DisplayName("should raise ResourceExistsException for duplicate ids")
        void createItem_duplicate_shouldBeExists() {
            products.createItem(laptop());

            assertThatThrownBy(() -> products.createItem(laptop())).isInstanceOf(ResourceExistsException.class);
        }

        @Test
        @DisplayName("should raise PreconditionFailedException for stale etags")
        void replaceItem_staleEtag_shouldBePreconditionFailed() {
            products.createItem(laptop());

            assertThatThrownBy(() -> products.replaceItem("1", laptop(),
                    RequestOptions.partitionKey("electronics").with(RequestOptions.IF_MATCH, "stale")))
                    .isInstanceOf(PreconditionFailedException.class)
                    .isInstanceOf(HttpResponseException.class);
        }

        @Test
        @DisplayName("should raise a plain HttpResponseException for other server errors")
        void readItem_serverBusy_shouldKeepStatusAndMessage() {
            CountingTransport busy = failingReads(TransportFailure.httpError(503, "busy", null));
            try (DocumentClient busyClient = TestClients.client(busy)) {
                ContainerProxy container = busyClient.getDatabaseClient("shop").getContainerClient("products");

                Throwable thrown = catchThrowable(() -> container.readItem("1", "electronics"));

                assertThat(thrown).isExactlyInstanceOf(HttpResponseException.class);
                HttpResponseException error = (HttpResponseException) thrown;
                assertThat(error.getStatusCode()).isEqualTo(503);
                assertThat(error.getServerMessage()).isEqualTo("busy");
                assertThat(error.getErrorKind()).isEqualTo(ErrorKind.GENERIC_HTTP_ERROR);
                assertThat(busy.calls(OperationType.READ_ITEM)).isEqualTo(1);
            }
        }

        @Test
        @DisplayName("should raise TransportException when no response arrives")
        void readItem_noResponse_shouldBeTransportException() {
            CountingTransport silent = failingReads(TransportFailure.noResponse("connection reset", null));
            try (DocumentClient silentClient = TestClients.client(silent)) {
                ContainerProxy container = silentClient.getDatabaseClient("shop").getContainerClient("products");

                assertThatThrownBy(() -> container.readItem("1", "electronics"))
                        .isInstanceOf(TransportException.class)
                        .isNotInstanceOf(HttpResponseException.class);
            }
        }

        @Test
        @DisplayName("should reject out-of-range query literals with status 400")
        void queryItems_overflowingLiteral_shouldBeBadRequest() {
            assertThatThrownBy(() -> products.queryItems("SELECT * FROM c WHERE c.price < 1e400", "electronics"))
                    .isExactlyInstanceOf(HttpResponseException.class)
                    .satisfies(e -> assertThat(((HttpResponseException) e).getStatusCode()).isEqualTo(400));
        }

        @Test
        @DisplayName("should raise ResourceNotFoundException for a deleted container")
        void delete_thenRead_shouldBeNotFound() {
            products.delete();

            assertThatThrownBy(products::read).isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should overlap concurrent blocking reads")
        void readItem_concurrentCallers_shouldOverlap() throws Exception {
            Duration latency = Duration.ofMillis(200);
            CountingTransport slow = TestClients.countingTransport(latency);
            int callers = 8;
            try (DocumentClient slowClient = TestClients.client(slow)) {
                slowClient.createDatabase("shop");
                slowClient.getDatabaseClient("shop").createContainer("products", "/category");
                ContainerProxy container = slowClient.getDatabaseClient("shop").getContainerClient("products");
                container.createItem(laptop());

                ExecutorService pool = Executors.newFixedThreadPool(callers);
                try {
                    CountDownLatch start = new CountDownLatch(1);
                    List<Future<Map<String, Object>>> reads = new ArrayList<>();
                    for (int i = 0; i < callers; i++) {
                        reads.add(pool.submit(() -> {
                            start.await();
                            return container.readItem("1", "electronics");
                        }));
                    }
                    long begin = System.nanoTime();
                    start.countDown();
                    for (Future<Map<String, Object>> read : reads) {
                        assertThat(read.get(10, TimeUnit.SECONDS)).containsEntry("id", "1");
                    }
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - begin);

                    assertThat(elapsed).isLessThan(latency.multipliedBy(callers).dividedBy(2));
                } finally {
                    pool.shutdownNow();
                }
            }
        }
    }
}
