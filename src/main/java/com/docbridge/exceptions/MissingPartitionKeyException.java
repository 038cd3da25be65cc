package com.docbridge.exceptions;

/**
 * Exception thrown when an item operation has no resolvable partition key.
 * Raised before any network call.
 */
public class MissingPartitionKeyException extends OperationException {

    public MissingPartitionKeyException(String message) {
        super(ErrorKind.MISSING_PARTITION_KEY, message);
    }
}
