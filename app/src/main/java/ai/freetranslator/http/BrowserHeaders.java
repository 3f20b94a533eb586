package ai.freetranslator.http;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request headers that make our calls look like a desktop browser visiting the translation site.
 */
public final class BrowserHeaders {

    public static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:61.0) Gecko/20100101 Firefox/61.0";
    public static final String ACCEPT_LANGUAGE = "en-US,en;q=0.5";
    public static final String SERVICE_HOST = "translate.google.com";

    private BrowserHeaders() {
    }

    /**
     * Headers for plain page loads such as the landing page handshake.
     */
    public static Map<String, String> forPageLoad() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", USER_AGENT);
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        headers.put("Accept-Charset", "ISO-8859-1,utf-8;q=0.7,*;q=0.7");
        headers.put("Accept-Language", ACCEPT_LANGUAGE);
        headers.put("Host", SERVICE_HOST);
        return headers;
    }
}
