package com.docbridge.exceptions;

/**
 * Exception thrown when no response could be obtained from the server.
 */
public class TransportException extends OperationException {

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT_ERROR, message, cause);
    }
}
