package com.docbridge.exceptions;

/**
 * Exception thrown when an access condition on the request was not met.
 */
public class PreconditionFailedException extends HttpResponseException {

    public static final int STATUS_CODE = 412;

    public PreconditionFailedException(String serverMessage, Throwable cause) {
        super(ErrorKind.PRECONDITION_FAILED, STATUS_CODE, "PreconditionFailed", serverMessage, cause);
    }
}
