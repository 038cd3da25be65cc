package com.docbridge.adapter.mongodb;

import com.docbridge.adapter.spi.ClientConfig;
import com.docbridge.adapter.spi.DocumentTransport;
import com.docbridge.adapter.spi.DocumentTransportFactory;
import com.docbridge.adapter.spi.KeyCredential;
import com.docbridge.adapter.spi.ValidationResult;
import com.docbridge.exceptions.ConfigurationException;
import com.docbridge.util.TimeSource;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.client.MongoClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Opens {@link MongoDBTransport}s for {@code mongodb://} and {@code mongodb+srv://} endpoints.
 *
 * <p>The account key is used as the password of a SCRAM credential when the
 * {@value #USERNAME} option is set; otherwise authentication is left to the
 * connection string.
 */
public class MongoDBTransportFactory implements DocumentTransportFactory {

    private static final Logger log = LoggerFactory.getLogger(MongoDBTransportFactory.class);

    public static final String MAX_POOL_SIZE = "maxPoolSize";
    public static final String MIN_POOL_SIZE = "minPoolSize";
    public static final String CONNECT_TIMEOUT_MS = "connectTimeoutMs";
    public static final String USERNAME = "username";
    public static final String AUTH_SOURCE = "authSource";
    public static final String SLOW_COMMAND_MS = "slowCommandMs";

    static final int DEFAULT_MAX_POOL_SIZE = 100;
    static final int DEFAULT_MIN_POOL_SIZE = 0;
    static final int DEFAULT_CONNECT_TIMEOUT_MS = 10000;
    static final String DEFAULT_AUTH_SOURCE = "admin";
    static final int DEFAULT_SLOW_COMMAND_MS = 100;

    @Override
    public boolean supports(String endpoint) {
        return endpoint != null && (endpoint.startsWith("mongodb://") || endpoint.startsWith("mongodb+srv://"));
    }

    @Override
    public ValidationResult validateConfig(ClientConfig config) {
        List<ValidationResult.ValidationError> errors = new ArrayList<>();

        String uri = config.getEndpoint();
        if (!supports(uri)) {
            errors.add(new ValidationResult.ValidationError("endpoint",
                    "URI must start with mongodb:// or mongodb+srv://"));
            return ValidationResult.failure(errors);
        }
        try {
            new ConnectionString(uri);
        } catch (IllegalArgumentException e) {
            errors.add(new ValidationResult.ValidationError("endpoint", e.getMessage()));
        }

        try {
            int maxPoolSize = config.getIntOption(MAX_POOL_SIZE, DEFAULT_MAX_POOL_SIZE);
            int minPoolSize = config.getIntOption(MIN_POOL_SIZE, DEFAULT_MIN_POOL_SIZE);
            if (maxPoolSize < 1) {
                errors.add(new ValidationResult.ValidationError(MAX_POOL_SIZE, "must be at least 1"));
            }
            if (minPoolSize < 0 || minPoolSize > maxPoolSize) {
                errors.add(new ValidationResult.ValidationError(MIN_POOL_SIZE,
                        "must be between 0 and " + MAX_POOL_SIZE));
            }
            if (config.getIntOption(CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS) < 0) {
                errors.add(new ValidationResult.ValidationError(CONNECT_TIMEOUT_MS, "must not be negative"));
            }
            if (config.getIntOption(SLOW_COMMAND_MS, DEFAULT_SLOW_COMMAND_MS) < 0) {
                errors.add(new ValidationResult.ValidationError(SLOW_COMMAND_MS, "must not be negative"));
            }
        } catch (ConfigurationException e) {
            errors.add(new ValidationResult.ValidationError("options", e.getMessage()));
        }

        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    /**
     * Returns the option names understood by this transport with a short description.
     */
    public Map<String, String> getConfigurationOptions() {
        return Map.of(
                MAX_POOL_SIZE, "Maximum connection pool size (default: " + DEFAULT_MAX_POOL_SIZE + ")",
                MIN_POOL_SIZE, "Minimum connection pool size (default: " + DEFAULT_MIN_POOL_SIZE + ")",
                CONNECT_TIMEOUT_MS, "Connection timeout in milliseconds (default: " + DEFAULT_CONNECT_TIMEOUT_MS + ")",
                USERNAME, "User name for SCRAM authentication with the account key as password",
                AUTH_SOURCE, "Authentication database (default: " + DEFAULT_AUTH_SOURCE + ")",
                SLOW_COMMAND_MS, "Commands at least this slow are logged (default: " + DEFAULT_SLOW_COMMAND_MS + ")"
        );
    }

    @Override
    public DocumentTransport open(ClientConfig config) {
        ValidationResult validation = validateConfig(config);
        if (validation.isInvalid()) {
            throw new ConfigurationException("Invalid configuration: " + validation.allErrorMessages());
        }
        MongoClientSettings settings = buildSettings(config);
        log.info("Connecting to MongoDB at {}", redact(config.getEndpoint()));
        return new MongoDBTransport(MongoClients.create(settings), TimeSource.system());
    }

    MongoClientSettings buildSettings(ClientConfig config) {
        CommandLoggingListener listener = new CommandLoggingListener(
                Duration.ofMillis(config.getIntOption(SLOW_COMMAND_MS, DEFAULT_SLOW_COMMAND_MS)));

        MongoClientSettings.Builder builder = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(config.getEndpoint()))
                .applyToConnectionPoolSettings(pool -> pool
                        .maxSize(config.getIntOption(MAX_POOL_SIZE, DEFAULT_MAX_POOL_SIZE))
                        .minSize(config.getIntOption(MIN_POOL_SIZE, DEFAULT_MIN_POOL_SIZE)))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(config.getIntOption(CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS),
                                TimeUnit.MILLISECONDS))
                .addCommandListener(listener);

        config.getOption(USERNAME).ifPresent(username -> {
            if (config.getCredential() instanceof KeyCredential key) {
                builder.credential(MongoCredential.createCredential(username.toString(),
                        config.getStringOption(AUTH_SOURCE, DEFAULT_AUTH_SOURCE), key.key().toCharArray()));
            } else {
                throw new ConfigurationException("Credential scheme " + config.getCredential().scheme()
                        + " is not supported by the MongoDB transport");
            }
        });
        return builder.build();
    }

    private static String redact(String uri) {
        int at = uri.indexOf('@');
        int scheme = uri.indexOf("://");
        if (at < 0 || scheme < 0) {
            return uri;
        }
        return uri.substring(0, scheme + 3) + "****" + uri.substring(at);
    }
}
