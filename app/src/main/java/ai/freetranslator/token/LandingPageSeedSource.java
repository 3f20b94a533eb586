package ai.freetranslator.token;

import ai.freetranslator.http.BrowserHeaders;
import ai.freetranslator.http.HttpTransport;
import ai.freetranslator.http.TransportResponse;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes the seed from the translation site's landing page.
 */
public class LandingPageSeedSource implements SeedSource {

    // tkk:'406398.2087938574'
    private static final Pattern LITERAL_SEED = Pattern.compile("tkk\\s*[:=]\\s*['\"](-?\\d+)\\.(-?\\d+)['\"]", Pattern.CASE_INSENSITIVE);
    // TKK=eval('((function(){var a\x3d4264492758;var b\x3d-1857761911;return 406375+\x27.\x27+(a+b)})())');
    private static final Pattern EVAL_SEED = Pattern.compile(
            "var\\s+a\\s*(?:\\\\x3d|=)\\s*(-?\\d+);\\s*var\\s+b\\s*(?:\\\\x3d|=)\\s*(-?\\d+);\\s*return\\s+(-?\\d+)\\s*\\+");

    private final HttpTransport transport;
    private final URI landingPage;

    public LandingPageSeedSource(HttpTransport transport, URI landingPage) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.landingPage = Objects.requireNonNull(landingPage, "landingPage");
    }

    @Override
    public TokenSeed fetch() {
        TransportResponse response = transport.get(landingPage, BrowserHeaders.forPageLoad());
        return extract(response.body())
                .orElseThrow(() -> new SeedFormatException("No token seed found on " + landingPage.getHost()));
    }

    /**
     * @throws SeedFormatException when a seed is present but its numbers do not fit a {@code long}
     */
    static Optional<TokenSeed> extract(String page) {
        if (page == null || page.isEmpty()) {
            return Optional.empty();
        }
        Matcher literal = LITERAL_SEED.matcher(page);
        if (literal.find()) {
            return Optional.of(new TokenSeed(parse(literal.group(1)), parse(literal.group(2))));
        }
        Matcher eval = EVAL_SEED.matcher(page);
        if (eval.find()) {
            long a = parse(eval.group(1));
            long b = parse(eval.group(2));
            return Optional.of(new TokenSeed(parse(eval.group(3)), sum(a, b)));
        }
        return Optional.empty();
    }

    private static long parse(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new SeedFormatException("Token seed component out of range: " + digits, ex);
        }
    }

    private static long sum(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException ex) {
            throw new SeedFormatException("Token seed sum out of range: " + a + "+" + b, ex);
        }
    }
}
