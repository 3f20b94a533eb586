package ai.freetranslator.session;

import ai.freetranslator.http.BrowserHeaders;
import ai.freetranslator.http.HttpTransport;
import ai.freetranslator.http.TransportException;
import ai.freetranslator.http.TransportResponse;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the session cookie of one client instance.
 * <p>
 * The cookie is obtained lazily by loading the landing page once and is replaced whenever a later response
 * carries {@code Set-Cookie}. Concurrent handshakes are tolerated; the last stored cookie wins.
 */
public class SessionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

    static final String SET_COOKIE = "Set-Cookie";

    /**
     * Sent when no cookie could be obtained from the service.
     */
    public static final String FALLBACK_COOKIE = "NID=132=YSV6D_1_0-kurlU0FU1_McKljflccBTuJEM4tGzFWw8nZm90f-P7bzqrFnETlu4LLDf5GMwAD2oiRicTUeP_fftLO7Xy2OH0Vz2MerRlalbfmfHOf1Lrn3EN-_C3Pk2Y; "
            + "CONSENT=WP.26e489; 1P_JAR=2018-6-18-12; _ga=GA1.3.737450149.1529324066; _gid=GA1.3.606173287.1529324066";

    private final HttpTransport transport;
    private final URI landingPage;
    private final AtomicReference<String> cookie = new AtomicReference<>();

    public SessionManager(HttpTransport transport, URI landingPage) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.landingPage = Objects.requireNonNull(landingPage, "landingPage");
    }

    /**
     * Performs the handshake unless a cookie is already cached. Failures leave the cookie unset.
     */
    public void ensureCookie() {
        if (cookie.get() != null) {
            return;
        }
        try {
            TransportResponse response = transport.get(landingPage, BrowserHeaders.forPageLoad());
            if (!rememberCookie(response)) {
                LOGGER.debug("Handshake with {} returned no cookie", landingPage.getHost());
            }
        } catch (TransportException ex) {
            LOGGER.warn("Session handshake failed, continuing with the fallback cookie: {}", ex.getMessage());
        }
    }

    /**
     * Replaces the cached cookie when the response sets one.
     *
     * @return whether the response carried a cookie
     */
    public boolean rememberCookie(TransportResponse response) {
        Objects.requireNonNull(response, "response");
        Optional<String> parsed = toCookieHeader(response.headerValues(SET_COOKIE));
        parsed.ifPresent(cookie::set);
        return parsed.isPresent();
    }

    public Optional<String> currentCookie() {
        return Optional.ofNullable(cookie.get());
    }

    /**
     * Value for the {@code Cookie} request header.
     */
    public String cookieHeader() {
        String current = cookie.get();
        return current != null ? current : FALLBACK_COOKIE;
    }

    static Optional<String> toCookieHeader(List<String> setCookieHeaders) {
        if (setCookieHeaders == null || setCookieHeaders.isEmpty()) {
            return Optional.empty();
        }
        String joined = setCookieHeaders.stream()
                .map(SessionManager::nameValuePair)
                .filter(pair -> !pair.isEmpty())
                .collect(Collectors.joining("; "));
        return joined.isEmpty() ? Optional.empty() : Optional.of(joined);
    }

    private static String nameValuePair(String setCookie) {
        if (setCookie == null) {
            return "";
        }
        int attributes = setCookie.indexOf(';');
        String pair = attributes >= 0 ? setCookie.substring(0, attributes) : setCookie;
        pair = pair.trim();
        return pair.indexOf('=') > 0 ? pair : "";
    }
}
