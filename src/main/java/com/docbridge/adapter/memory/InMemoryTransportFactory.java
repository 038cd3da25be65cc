package com.docbridge.adapter.memory;

import com.docbridge.adapter.spi.ClientConfig;
import com.docbridge.adapter.spi.DocumentTransport;
import com.docbridge.adapter.spi.DocumentTransportFactory;
import com.docbridge.adapter.spi.ValidationResult;
import com.docbridge.exceptions.ConfigurationException;
import com.docbridge.util.TimeSource;

import java.time.Duration;

/**
 * Opens {@link InMemoryDocumentTransport}s for {@code memory:} endpoints.
 *
 * <p>Each client gets an empty store of its own. The option {@value #LATENCY_MS}
 * adds a simulated round-trip delay to every call.
 */
public final class InMemoryTransportFactory implements DocumentTransportFactory {

    public static final String SCHEME = "memory:";

    public static final String LATENCY_MS = "latencyMs";

    @Override
    public boolean supports(String endpoint) {
        return endpoint != null && endpoint.startsWith(SCHEME);
    }

    @Override
    public ValidationResult validateConfig(ClientConfig config) {
        if (!supports(config.getEndpoint())) {
            return ValidationResult.failure("endpoint", "must start with " + SCHEME);
        }
        try {
            if (config.getIntOption(LATENCY_MS, 0) < 0) {
                return ValidationResult.failure(LATENCY_MS, "must not be negative");
            }
        } catch (ConfigurationException e) {
            return ValidationResult.failure(LATENCY_MS, e.getMessage());
        }
        return ValidationResult.success();
    }

    @Override
    public DocumentTransport open(ClientConfig config) {
        Duration latency = Duration.ofMillis(config.getIntOption(LATENCY_MS, 0));
        return new InMemoryDocumentTransport(TimeSource.system(), latency);
    }
}
