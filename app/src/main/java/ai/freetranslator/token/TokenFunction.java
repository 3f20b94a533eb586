package ai.freetranslator.token;

/**
 * Derives the {@code tk} request parameter from the text being translated and the current seed.
 */
@FunctionalInterface
public interface TokenFunction {

    String apply(TokenSeed seed, String text);
}
