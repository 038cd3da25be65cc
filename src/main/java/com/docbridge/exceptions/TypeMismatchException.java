package com.docbridge.exceptions;

/**
 * Exception thrown when a value has a shape the operation cannot accept.
 * Raised before any network call.
 */
public class TypeMismatchException extends OperationException {

    private final Class<?> actualType;

    public TypeMismatchException(String message, Class<?> actualType) {
        super(ErrorKind.TYPE_MISMATCH, message);
        this.actualType = actualType;
    }

    /**
     * The rejected value's class, or null when the value was null.
     */
    public Class<?> getActualType() {
        return actualType;
    }
}
