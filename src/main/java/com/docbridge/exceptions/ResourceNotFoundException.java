package com.docbridge.exceptions;

/**
 * Exception thrown when the addressed resource does not exist.
 */
public class ResourceNotFoundException extends HttpResponseException {

    public static final int STATUS_CODE = 404;

    public ResourceNotFoundException(String serverMessage, Throwable cause) {
        super(ErrorKind.RESOURCE_NOT_FOUND, STATUS_CODE, "NotFound", serverMessage, cause);
    }
}
