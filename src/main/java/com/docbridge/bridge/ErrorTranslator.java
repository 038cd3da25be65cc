package com.docbridge.bridge;

import com.docbridge.adapter.spi.TransportFailure;
import com.docbridge.exceptions.ErrorKind;
import com.docbridge.exceptions.HttpResponseException;
import com.docbridge.exceptions.OperationException;
import com.docbridge.exceptions.PreconditionFailedException;
import com.docbridge.exceptions.ResourceExistsException;
import com.docbridge.exceptions.ResourceNotFoundException;
import com.docbridge.exceptions.TransportException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps collaborator failures onto the closed {@link ErrorKind} taxonomy.
 *
 * <p>Total: every throwable maps to exactly one exception. Classified
 * {@link TransportFailure}s map by classification; I/O, timeout and interruption
 * failures become {@link TransportException}; anything else is reported as a
 * {@link HttpResponseException} with status 0. The original failure is kept as the cause.
 */
public final class ErrorTranslator {

    private ErrorTranslator() {
    }

    public static OperationException translate(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof OperationException translated) {
            return translated;
        }
        if (cause instanceof TransportFailure transportFailure) {
            return fromTransportFailure(transportFailure);
        }
        if (cause instanceof IOException
                || cause instanceof UncheckedIOException
                || cause instanceof TimeoutException
                || cause instanceof InterruptedException) {
            return new TransportException("No response received: " + describe(cause), cause);
        }
        return new HttpResponseException(TransportFailure.NO_STATUS,
                "Unclassified failure: " + describe(cause), cause);
    }

    public static ErrorKind classify(Throwable failure) {
        return translate(failure).getErrorKind();
    }

    private static OperationException fromTransportFailure(TransportFailure failure) {
        String message = failure.getMessage() == null ? "no message" : failure.getMessage();
        switch (failure.getClassification()) {
            case NOT_FOUND:
                return new ResourceNotFoundException(message, failure);
            case CONFLICT:
                return new ResourceExistsException(message, failure);
            case PRECONDITION_FAILED:
                return new PreconditionFailedException(message, failure);
            case NO_RESPONSE:
                return new TransportException("No response received: " + message, failure);
            default:
                return new HttpResponseException(failure.getStatusCode(), message, failure);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
    }
}
