package com.docbridge.exceptions;

/**
 * Exception thrown when an operation is attempted on a closed client.
 * Local failure: the collaborator is never contacted.
 */
public class ClientClosedException extends DocBridgeException {

    private final String endpoint;

    public ClientClosedException(String endpoint) {
        super("Client for " + endpoint + " is closed");
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
