package com.hashicorp.vault.broker.auth;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.http.SdkHttpRequest;
import software.amazon.awssdk.http.auth.aws.signer.AwsV4HttpSigner;
import software.amazon.awssdk.http.auth.spi.signer.SignedRequest;
import software.amazon.awssdk.identity.spi.AwsCredentialsIdentity;

/**
 * Signs the STS {@code GetCallerIdentity} request that Vault replays to verify an IAM
 * identity.
 */
class StsRequestSigner {

    static final String SERVICE = "sts";
    static final String GET_CALLER_IDENTITY_BODY = "Action=GetCallerIdentity&Version=2011-06-15";
    static final String CONTENT_TYPE = "application/x-www-form-urlencoded; charset=utf-8";
    static final String HEADER_SERVER_ID = "X-Vault-AWS-IAM-Server-ID";

    private final AwsV4HttpSigner signer;

    StsRequestSigner() {
        this(AwsV4HttpSigner.create());
    }

    StsRequestSigner(AwsV4HttpSigner signer) {
        this.signer = signer;
    }

    /**
     * Produces the signed request.
     *
     * @param credentials         AWS credentials to sign with
     * @param endpoint            STS endpoint
     * @param region              signing region
     * @param serverIdHeaderValue value for {@code X-Vault-AWS-IAM-Server-ID}, or null
     * @return method, URL, body and signed headers of the request
     */
    SignedStsRequest sign(AwsCredentialsIdentity credentials, URI endpoint, String region,
                          String serverIdHeaderValue) {
        SdkHttpRequest.Builder request = SdkHttpRequest.builder()
                .uri(endpoint)
                .method(SdkHttpMethod.POST)
                .putHeader("Content-Type", CONTENT_TYPE);
        if (serverIdHeaderValue != null) {
            request.putHeader(HEADER_SERVER_ID, serverIdHeaderValue);
        }

        byte[] body = GET_CALLER_IDENTITY_BODY.getBytes(StandardCharsets.UTF_8);
        SignedRequest signed = signer.sign(r -> r
                .identity(credentials)
                .request(request.build())
                .payload(() -> new ByteArrayInputStream(body))
                .putProperty(AwsV4HttpSigner.SERVICE_SIGNING_NAME, SERVICE)
                .putProperty(AwsV4HttpSigner.REGION_NAME, region));

        SdkHttpRequest signedRequest = signed.request();
        return new SignedStsRequest(signedRequest.method().name(), endpoint.toString(),
                GET_CALLER_IDENTITY_BODY, singleValued(signedRequest.headers()));
    }

    private static Map<String, String> singleValued(Map<String, List<String>> headers) {
        Map<String, String> result = new LinkedHashMap<>();
        headers.forEach((name, values) -> result.put(name, String.join(",", values)));
        return result;
    }

    /**
     * The parts of a signed request that go into the Vault login payload.
     */
    static final class SignedStsRequest {
        private final String method;
        private final String url;
        private final String body;
        private final Map<String, String> headers;

        SignedStsRequest(String method, String url, String body, Map<String, String> headers) {
            this.method = method;
            this.url = url;
            this.body = body;
            this.headers = headers;
        }

        String getMethod() {
            return method;
        }

        String getUrl() {
            return url;
        }

        String getBody() {
            return body;
        }

        Map<String, String> getHeaders() {
            return headers;
        }
    }
}
