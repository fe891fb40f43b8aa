package com.hashicorp.vault.broker;

/**
 * A request to Vault did not produce a usable response: the connection failed,
 * timed out, or the server answered with an error status.
 */
public class TransportException extends VaultException {

    public TransportException(String message, int httpStatusCode) {
        super(message, httpStatusCode);
    }

    public TransportException(String message, int httpStatusCode, Throwable cause) {
        super(message, httpStatusCode, cause);
    }

    /**
     * Creates a TransportException from an HTTP error response.
     *
     * @param statusCode the HTTP status code
     * @param body       the response body (may contain JSON error details)
     * @return a new exception with the parsed error message
     */
    public static TransportException fromResponse(int statusCode, String body) {
        return new TransportException(describeErrorResponse(statusCode, body), statusCode);
    }

    /**
     * Returns true when no HTTP response was received (status code 0).
     */
    public boolean isConnectionFailure() {
        return getHttpStatusCode() == 0;
    }
}
