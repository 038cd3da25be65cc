package com.docbridge.exceptions;

/**
 * Exception thrown when a resource with the same id already exists.
 */
public class ResourceExistsException extends HttpResponseException {

    public static final int STATUS_CODE = 409;

    public ResourceExistsException(String serverMessage, Throwable cause) {
        super(ErrorKind.RESOURCE_EXISTS, STATUS_CODE, "Conflict", serverMessage, cause);
    }
}
