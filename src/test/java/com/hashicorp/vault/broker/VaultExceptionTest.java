package com.hashicorp.vault.broker;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for the VaultException hierarchy and error parsing.
 */
class VaultExceptionTest {

    @Test
    void constructor_withMessageAndStatus_setsFields() {
        VaultException ex = new VaultException("test error", 403);

        assertThat(ex.getMessage()).isEqualTo("test error");
        assertThat(ex.getHttpStatusCode()).isEqualTo(403);
        assertThat(ex).isInstanceOf(RuntimeException.class);
    }

    @Test
    void constructor_withCause_setsCause() {
        RuntimeException cause = new RuntimeException("cause");
        VaultException ex = new VaultException("test error", 500, cause);

        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void fromResponse_withNullBody_returnsStatusMessage() {
        TransportException ex = TransportException.fromResponse(404, null);

        assertThat(ex.getMessage()).isEqualTo("Vault returned status 404");
        assertThat(ex.getHttpStatusCode()).isEqualTo(404);
    }

    @Test
    void fromResponse_withEmptyBody_returnsStatusMessage() {
        TransportException ex = TransportException.fromResponse(500, "");

        assertThat(ex.getMessage()).isEqualTo("Vault returned status 500");
    }

    @Test
    void fromResponse_withSingleError_parsesErrorMessage() {
        TransportException ex = TransportException.fromResponse(403, "{\"errors\":[\"permission denied\"]}");

        assertThat(ex.getMessage()).isEqualTo("permission denied");
        assertThat(ex.getHttpStatusCode()).isEqualTo(403);
    }

    @Test
    void fromResponse_withMultipleErrors_joinsWithSemicolon() {
        TransportException ex = TransportException.fromResponse(400, "{\"errors\":[\"error one\",\"error two\"]}");

        assertThat(ex.getMessage()).isEqualTo("error one; error two");
    }

    @Test
    void fromResponse_withEmptyErrorsArray_returnsStatusWithBody() {
        TransportException ex = TransportException.fromResponse(400, "{\"errors\":[]}");

        assertThat(ex.getMessage()).isEqualTo("Vault returned status 400: {\"errors\":[]}");
    }

    @Test
    void fromResponse_withVeryLongBody_truncatesBody() {
        String body = "x".repeat(500);

        TransportException ex = TransportException.fromResponse(502, body);

        assertThat(ex.getMessage()).endsWith("...").hasSize("Vault returned status 502: ".length() + 203);
    }

    @Test
    void isConnectionFailure_withStatusZero_returnsTrue() {
        assertThat(new TransportException("refused", 0).isConnectionFailure()).isTrue();
        assertThat(TransportException.fromResponse(503, null).isConnectionFailure()).isFalse();
    }

    @Test
    void authenticationException_takesStatusFromCause() {
        AuthenticationException ex = new AuthenticationException("login failed",
                TransportException.fromResponse(400, "{\"errors\":[\"invalid secret id\"]}"));

        assertThat(ex.getHttpStatusCode()).isEqualTo(400);
        assertThat(new AuthenticationException("x", new IllegalStateException()).getHttpStatusCode()).isZero();
    }

    @Test
    void toString_includesTypeMessageAndStatus() {
        VaultException ex = new MalformedResponseException("bad body", 200);

        assertThat(ex.toString())
                .contains("MalformedResponseException")
                .contains("bad body")
                .contains("200");
    }

    @Test
    void invalidCredentialsException_isConfigurationError() {
        assertThat(new InvalidCredentialsException("bad"))
                .isInstanceOf(VaultConfigurationException.class)
                .isInstanceOf(IllegalArgumentException.class);
    }
}
