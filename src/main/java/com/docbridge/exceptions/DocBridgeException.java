package com.docbridge.exceptions;

/**
 * Base exception for DocBridge errors.
 */
public class DocBridgeException extends RuntimeException {

    public DocBridgeException(String message) {
        super(message);
    }

    public DocBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
