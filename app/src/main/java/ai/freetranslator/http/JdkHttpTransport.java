package ai.freetranslator.http;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HttpTransport} backed by {@link HttpClient}.
 */
public class JdkHttpTransport implements HttpTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpTransport.class);

    // HttpClient derives these from the URI and rejects them unless listed in this property.
    static final String ALLOW_RESTRICTED_HEADERS = "jdk.httpclient.allowRestrictedHeaders";
    private static final Set<String> RESTRICTED_HEADERS = Set.of("host", "connection", "content-length", "expect", "upgrade");

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final Set<String> managedHeaders;

    public JdkHttpTransport(Duration requestTimeout, Optional<InetSocketAddress> proxy) {
        this(buildClient(requestTimeout, proxy), requestTimeout);
    }

    public JdkHttpTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = requirePositive(requestTimeout);
        this.managedHeaders = managedHeaders(System.getProperty(ALLOW_RESTRICTED_HEADERS));
    }

    @Override
    public TransportResponse get(URI uri, Map<String, String> headers) {
        Objects.requireNonNull(uri, "uri");
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .GET();
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (managedHeaders.contains(name.toLowerCase(Locale.ROOT))) {
                    LOGGER.trace("Leaving header {} to the HTTP client", name);
                } else if (value != null) {
                    builder.header(name, value);
                }
            });
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw TransportException.networkFailure(uri, ex);
        } catch (IOException ex) {
            throw TransportException.networkFailure(uri, ex);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            LOGGER.debug("GET {} answered {}", uri.getHost(), response.statusCode());
            throw TransportException.protocolFailure(uri, response.statusCode());
        }
        return new TransportResponse(response.statusCode(), response.body(), response.headers().map());
    }

    /**
     * Restricted headers the client still sets itself, given the value of {@value #ALLOW_RESTRICTED_HEADERS}.
     * Running with {@code -Djdk.httpclient.allowRestrictedHeaders=host} lets the caller's {@code Host} through.
     */
    static Set<String> managedHeaders(String allowedProperty) {
        if (allowedProperty == null || allowedProperty.isBlank()) {
            return RESTRICTED_HEADERS;
        }
        Set<String> allowed = new HashSet<>();
        for (String name : allowedProperty.split(",")) {
            allowed.add(name.trim().toLowerCase(Locale.ROOT));
        }
        Set<String> managed = new HashSet<>(RESTRICTED_HEADERS);
        managed.removeAll(allowed);
        return Set.copyOf(managed);
    }

    private static HttpClient buildClient(Duration timeout, Optional<InetSocketAddress> proxy) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(requirePositive(timeout))
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (proxy != null && proxy.isPresent()) {
            LOGGER.info("Routing requests through proxy {}", proxy.get());
            builder.proxy(ProxySelector.of(proxy.get()));
        }
        return builder.build();
    }

    private static Duration requirePositive(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        return timeout;
    }
}
