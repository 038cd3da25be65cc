package com.docbridge.bridge;

import com.docbridge.exceptions.ConfigurationException;

import java.util.Objects;
import java.util.Properties;

/**
 * Sizing of the shared runtime, read once when the runtime is built.
 *
 * @param dispatcherThreads worker threads of the asynchronous dispatcher
 * @param threadPrefix      prefix of runtime and dispatcher thread names
 */
public record BridgeSettings(int dispatcherThreads, String threadPrefix) {

    public static final String DISPATCHER_THREADS_PROPERTY = "docbridge.dispatcher.threads";
    public static final String THREAD_PREFIX_PROPERTY = "docbridge.runtime.thread-prefix";

    public static final String DEFAULT_THREAD_PREFIX = "docbridge";

    public BridgeSettings {
        if (dispatcherThreads < 1) {
            throw new ConfigurationException("dispatcherThreads must be positive, got " + dispatcherThreads);
        }
        Objects.requireNonNull(threadPrefix, "threadPrefix must not be null");
    }

    public static BridgeSettings defaults() {
        return new BridgeSettings(defaultDispatcherThreads(), DEFAULT_THREAD_PREFIX);
    }

    public static BridgeSettings fromSystemProperties() {
        return from(System.getProperties());
    }

    /**
     * Reads settings from properties, falling back to defaults for absent keys.
     *
     * @throws ConfigurationException if a value cannot be parsed
     */
    public static BridgeSettings from(Properties properties) {
        String threads = properties.getProperty(DISPATCHER_THREADS_PROPERTY);
        int dispatcherThreads = defaultDispatcherThreads();
        if (threads != null) {
            try {
                dispatcherThreads = Integer.parseInt(threads.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(DISPATCHER_THREADS_PROPERTY + " must be an integer, got: " + threads, e);
            }
        }
        String prefix = properties.getProperty(THREAD_PREFIX_PROPERTY, DEFAULT_THREAD_PREFIX);
        return new BridgeSettings(dispatcherThreads, prefix);
    }

    private static int defaultDispatcherThreads() {
        return Math.min(32, Runtime.getRuntime().availableProcessors() + 4);
    }
}
