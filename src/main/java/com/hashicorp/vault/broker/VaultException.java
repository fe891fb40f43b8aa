package com.hashicorp.vault.broker;

import com.hashicorp.vault.broker.transport.Json;
import java.util.List;

/**
 * Base class for failures raised while talking to Vault.
 *
 * <p>Unchecked so it can complete a {@link java.util.concurrent.CompletableFuture}
 * or escape a pipeline stage without wrapping. The HTTP status code is 0 when the
 * failure did not come from an HTTP response (connection errors, local parsing).
 *
 * @see AuthenticationException
 * @see TransportException
 * @see MalformedResponseException
 */
public class VaultException extends RuntimeException {

    private final int httpStatusCode;

    public VaultException(String message, int httpStatusCode) {
        super(message);
        this.httpStatusCode = httpStatusCode;
    }

    public VaultException(String message, int httpStatusCode, Throwable cause) {
        super(message, cause);
        this.httpStatusCode = httpStatusCode;
    }

    /**
     * Gets the HTTP status code from the Vault response.
     *
     * @return the status code, or 0 if the failure did not come from an HTTP response
     */
    public int getHttpStatusCode() {
        return httpStatusCode;
    }

    /**
     * Builds a readable message from a Vault error body.
     *
     * <p>Vault error responses have the form {@code {"errors": ["message1", "message2"]}}.
     * When the body cannot be parsed the raw body is used, truncated to 200 characters.
     */
    static String describeErrorResponse(int statusCode, String body) {
        if (body == null || body.isBlank()) {
            return "Vault returned status " + statusCode;
        }

        List<String> errors = Json.parseErrors(body);
        if (!errors.isEmpty()) {
            return String.join("; ", errors);
        }

        String truncated = body.length() > 200 ? body.substring(0, 200) + "..." : body;
        return "Vault returned status " + statusCode + ": " + truncated;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "message='" + getMessage() + '\'' +
                ", httpStatusCode=" + httpStatusCode +
                '}';
    }
}
