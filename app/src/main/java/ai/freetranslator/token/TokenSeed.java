package ai.freetranslator.token;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opaque integer pair published by the translation site (its {@code TKK} value) and mixed into every signing token.
 */
public record TokenSeed(long first, long second) {

    private static final Pattern DOTTED = Pattern.compile("^\\s*(-?\\d+)\\.(-?\\d+)\\s*$");

    /**
     * Seed that was valid when this client was written. Used only when the landing page cannot be scraped.
     */
    public static final TokenSeed FALLBACK = new TokenSeed(406398L, 2087938574L);

    /**
     * Parses the {@code "first.second"} form found on the landing page.
     */
    public static TokenSeed parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Token seed must not be null");
        }
        Matcher matcher = DOTTED.matcher(raw);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed token seed: " + raw);
        }
        try {
            return new TokenSeed(Long.parseLong(matcher.group(1)), Long.parseLong(matcher.group(2)));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Malformed token seed: " + raw, ex);
        }
    }

    @Override
    public String toString() {
        return first + "." + second;
    }
}
