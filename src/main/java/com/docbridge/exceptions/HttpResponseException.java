package com.docbridge.exceptions;

/**
 * Exception thrown when the server answered with a non-success status.
 *
 * <p>Root of the HTTP-class branch: {@link ResourceNotFoundException},
 * {@link ResourceExistsException} and {@link PreconditionFailedException} extend it, so
 * catching this type handles every server-side outcome uniformly.
 */
public class HttpResponseException extends OperationException {

    private final int statusCode;
    private final String serverMessage;

    public HttpResponseException(int statusCode, String serverMessage) {
        this(ErrorKind.GENERIC_HTTP_ERROR, statusCode, "Error", serverMessage, null);
    }

    public HttpResponseException(int statusCode, String serverMessage, Throwable cause) {
        this(ErrorKind.GENERIC_HTTP_ERROR, statusCode, "Error", serverMessage, cause);
    }

    protected HttpResponseException(ErrorKind kind, int statusCode, String reason,
                                    String serverMessage, Throwable cause) {
        super(kind, "(" + statusCode + ") " + reason + ": " + serverMessage, cause);
        this.statusCode = statusCode;
        this.serverMessage = serverMessage;
    }

    /**
     * Status code reported by the server, or 0 when none was reported.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * The server's message without the status prefix.
     */
    public String getServerMessage() {
        return serverMessage;
    }
}
