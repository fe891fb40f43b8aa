package com.hashicorp.vault.broker.transport;

import com.hashicorp.vault.broker.Preconditions;
import com.hashicorp.vault.broker.TransportException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import javax.net.ssl.SSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VaultTransport} over the JDK {@link HttpClient}.
 *
 * <p>Handles:
 * <ul>
 *   <li>URL building from the server address and API version ({@code /v1} by default)</li>
 *   <li>Namespace support via X-Vault-Namespace header (Vault Enterprise)</li>
 *   <li>JSON request bodies and response parsing</li>
 *   <li>Translation of error statuses and I/O failures into {@link TransportException}</li>
 * </ul>
 */
public class HttpVaultTransport implements VaultTransport {

    private static final Logger logger = LoggerFactory.getLogger(HttpVaultTransport.class);

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_API_VERSION = "v1";
    private static final String CONTENT_TYPE_JSON = "application/json";

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiVersion;
    private final String namespace;
    private final Duration requestTimeout;

    /**
     * Creates a transport with default settings.
     *
     * @param baseUrl the Vault server URL (e.g., "https://vault:8200")
     */
    public HttpVaultTransport(String baseUrl) {
        this(baseUrl, DEFAULT_API_VERSION, null, null, DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * Creates a transport with its own {@link HttpClient}.
     *
     * @param baseUrl        the Vault server URL
     * @param apiVersion     API version path segment, or null for {@code v1}
     * @param namespace      default Vault namespace (Enterprise), or null for root namespace
     * @param sslContext     custom SSL context, or null for the JVM default
     * @param requestTimeout timeout for individual requests, or null for 30 seconds
     */
    public HttpVaultTransport(String baseUrl, String apiVersion, String namespace,
                              SSLContext sslContext, Duration requestTimeout) {
        this(buildHttpClient(sslContext), baseUrl, apiVersion, namespace, requestTimeout);
    }

    /**
     * Creates a transport with an injected HttpClient (for testing).
     */
    public HttpVaultTransport(HttpClient httpClient, String baseUrl, String apiVersion,
                              String namespace, Duration requestTimeout) {
        Preconditions.requireNonBlank(baseUrl, "Vault address");
        this.httpClient = httpClient;
        this.baseUrl = normalizeUrl(baseUrl);
        this.apiVersion = apiVersion != null && !apiVersion.isBlank() ? apiVersion : DEFAULT_API_VERSION;
        this.namespace = Preconditions.blankToNull(namespace);
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
    }

    private static HttpClient buildHttpClient(SSLContext sslContext) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL);

        if (sslContext != null) {
            builder.sslContext(sslContext);
        }

        return builder.build();
    }

    private static String normalizeUrl(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public CompletableFuture<VaultResponse> request(String method, String path,
                                                    Map<String, Object> body,
                                                    Map<String, String> headers) {
        HttpRequest request;
        try {
            request = buildRequest(method, path, body, headers);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new TransportException("Invalid Vault request " + method + " " + path
                            + ": " + e.getMessage(), 0, e));
        }

        logger.debug("Vault request: {} {}", request.method(), request.uri());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw connectionFailure(request, error);
                    }
                    return toVaultResponse(response);
                });
    }

    HttpRequest buildRequest(String method, String path, Map<String, Object> body,
                             Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(resolve(path)))
                .timeout(requestTimeout);

        boolean namespaceGiven = false;
        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                if (header.getValue() == null || header.getValue().isBlank()) {
                    continue;
                }
                builder.header(header.getKey(), header.getValue());
                namespaceGiven |= HEADER_VAULT_NAMESPACE.equalsIgnoreCase(header.getKey());
            }
        }
        if (!namespaceGiven && namespace != null) {
            builder.header(HEADER_VAULT_NAMESPACE, namespace);
        }

        if (body != null) {
            builder.header("Content-Type", CONTENT_TYPE_JSON);
            builder.method(method, HttpRequest.BodyPublishers.ofString(Json.write(body)));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    String resolve(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return baseUrl + "/" + apiVersion + "/" + relative;
    }

    private VaultResponse toVaultResponse(HttpResponse<String> response) {
        int status = response.statusCode();
        String body = response.body();

        logger.debug("Vault response: {} ({})", status,
                body != null ? body.length() + " bytes" : "empty");

        if (status >= 400) {
            throw TransportException.fromResponse(status, body);
        }
        return VaultResponse.fromJson(status, body);
    }

    private static TransportException connectionFailure(HttpRequest request, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        // Connection errors get status 0
        return new TransportException("Connection to Vault failed (" + request.method() + " "
                + request.uri() + "): " + cause.getMessage(), 0, cause);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public String getNamespace() {
        return namespace;
    }
}
