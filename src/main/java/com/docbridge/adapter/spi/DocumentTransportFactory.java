package com.docbridge.adapter.spi;

import com.docbridge.exceptions.ConfigurationException;

import java.util.ServiceLoader;

/**
 * Opens {@link DocumentTransport}s for a client.
 *
 * <p>Factories registered under {@code META-INF/services} are discovered by endpoint
 * scheme through {@link #forEndpoint(String)}.
 */
public interface DocumentTransportFactory {

    /**
     * Opens a transport. Called once per client.
     *
     * @throws ConfigurationException if the configuration is unusable
     */
    DocumentTransport open(ClientConfig config);

    /**
     * Returns true if this factory handles the given endpoint.
     */
    default boolean supports(String endpoint) {
        return false;
    }

    /**
     * Validates configuration without opening anything.
     */
    default ValidationResult validateConfig(ClientConfig config) {
        return ValidationResult.success();
    }

    /**
     * Finds the registered factory for an endpoint.
     *
     * @throws ConfigurationException if no registered factory supports the endpoint
     */
    static DocumentTransportFactory forEndpoint(String endpoint) {
        for (DocumentTransportFactory factory : ServiceLoader.load(DocumentTransportFactory.class)) {
            if (factory.supports(endpoint)) {
                return factory;
            }
        }
        throw new ConfigurationException("No transport registered for endpoint: " + endpoint);
    }
}
