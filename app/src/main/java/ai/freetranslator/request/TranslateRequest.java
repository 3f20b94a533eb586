package ai.freetranslator.request;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A fully formed GET request against the translation endpoint.
 */
public record TranslateRequest(URI uri, Map<String, String> headers) {

    public TranslateRequest {
        Objects.requireNonNull(uri, "uri");
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(headers, "headers")));
    }
}
