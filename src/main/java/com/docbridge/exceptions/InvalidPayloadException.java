package com.docbridge.exceptions;

/**
 * Exception thrown when a payload has invalid syntax or unsupported content.
 * Raised before any network call.
 */
public class InvalidPayloadException extends OperationException {

    public InvalidPayloadException(String message) {
        super(ErrorKind.INVALID_PAYLOAD, message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(ErrorKind.INVALID_PAYLOAD, message, cause);
    }
}
