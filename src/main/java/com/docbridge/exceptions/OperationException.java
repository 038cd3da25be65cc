package com.docbridge.exceptions;

import java.util.Objects;

/**
 * Exception thrown when a database operation fails.
 * Every instance carries exactly one {@link ErrorKind}.
 */
public abstract class OperationException extends DocBridgeException {

    private final ErrorKind errorKind;

    protected OperationException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind must not be null");
    }

    protected OperationException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind must not be null");
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
