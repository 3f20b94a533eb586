package ai.freetranslator.request;

import ai.freetranslator.http.BrowserHeaders;
import ai.freetranslator.language.Language;
import ai.freetranslator.language.LanguageCatalog;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Assembles {@code translate_a/single} requests for a configurable domain.
 */
public class RequestBuilder {

    public static final String DEFAULT_DOMAIN = "translate.google.com";
    static final String PATH = "/translate_a/single";

    private final LanguageCatalog catalog;
    private final String domain;

    public RequestBuilder(LanguageCatalog catalog, String domain) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.domain = requireDomain(domain);
    }

    public String domain() {
        return domain;
    }

    public URI endpoint() {
        return URI.create("https://" + domain + PATH);
    }

    /**
     * Checks the language pair before any network activity.
     *
     * @throws ai.freetranslator.language.UnsupportedLanguageException when either language is not in the catalog
     * @throws InvalidTargetLanguageException when the target is the auto-detect sentinel
     */
    public void validate(Language source, Language target) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        catalog.requireSupported(source);
        catalog.requireSupported(target);
        if (target.isAuto()) {
            throw new InvalidTargetLanguageException();
        }
    }

    public TranslateRequest build(String text, Language source, Language target, String token, String cookie) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(token, "token");
        validate(source, target);

        StringBuilder query = new StringBuilder(128 + text.length() * 3);
        query.append("sl=").append(encode(source.iso639()))
                .append("&tl=").append(encode(target.iso639()))
                .append("&hl=en")
                .append("&q=").append(encode(text))
                .append("&tk=").append(encode(token))
                .append("&client=t");
        for (DataType dataType : DataType.values()) {
            query.append("&dt=").append(dataType.flag());
        }
        query.append("&ie=UTF-8&oe=UTF-8&otf=1&ssel=0&tsel=0&kc=7");

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", BrowserHeaders.USER_AGENT);
        headers.put("Accept-Language", BrowserHeaders.ACCEPT_LANGUAGE);
        headers.put("Host", BrowserHeaders.SERVICE_HOST);
        if (cookie != null && !cookie.isBlank()) {
            headers.put("Cookie", cookie);
        }
        return new TranslateRequest(URI.create(endpoint() + "?" + query), headers);
    }

    /**
     * RFC 3986 percent-encoding: spaces become {@code %20}, unreserved characters stay literal.
     */
    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    private static String requireDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain must not be blank");
        }
        String trimmed = domain.trim();
        if (trimmed.contains("/") || trimmed.contains(" ")) {
            throw new IllegalArgumentException("domain must be a bare host name: " + domain);
        }
        return trimmed;
    }
}
