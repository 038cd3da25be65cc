package com.docbridge.exceptions;

/**
 * Exception thrown when client configuration is invalid.
 */
public class ConfigurationException extends DocBridgeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
