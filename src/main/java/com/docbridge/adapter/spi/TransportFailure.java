package com.docbridge.adapter.spi;

import java.util.Objects;

/**
 * Classified failure reported by a {@link DocumentTransport}.
 *
 * <p>Transports complete their futures exceptionally with this type whenever they can
 * tell what went wrong. The binding layer never inspects driver exceptions directly.
 */
public class TransportFailure extends RuntimeException {

    /**
     * How the server (or the lack of one) answered.
     */
    public enum Classification {
        NOT_FOUND,
        CONFLICT,
        PRECONDITION_FAILED,
        HTTP_ERROR,
        NO_RESPONSE
    }

    /**
     * Status code used when no response was received.
     */
    public static final int NO_STATUS = 0;

    private final Classification classification;
    private final int statusCode;

    public TransportFailure(Classification classification, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.classification = Objects.requireNonNull(classification, "classification must not be null");
        this.statusCode = statusCode;
    }

    public static TransportFailure notFound(String message) {
        return new TransportFailure(Classification.NOT_FOUND, 404, message, null);
    }

    public static TransportFailure conflict(String message, Throwable cause) {
        return new TransportFailure(Classification.CONFLICT, 409, message, cause);
    }

    public static TransportFailure preconditionFailed(String message) {
        return new TransportFailure(Classification.PRECONDITION_FAILED, 412, message, null);
    }

    public static TransportFailure badRequest(String message) {
        return new TransportFailure(Classification.HTTP_ERROR, 400, message, null);
    }

    public static TransportFailure httpError(int statusCode, String message, Throwable cause) {
        return new TransportFailure(Classification.HTTP_ERROR, statusCode, message, cause);
    }

    public static TransportFailure noResponse(String message, Throwable cause) {
        return new TransportFailure(Classification.NO_RESPONSE, NO_STATUS, message, cause);
    }

    public Classification getClassification() {
        return classification;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasResponse() {
        return classification != Classification.NO_RESPONSE;
    }
}
