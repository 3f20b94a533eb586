package ai.freetranslator.token;

/**
 * Supplies a fresh {@link TokenSeed}.
 */
@FunctionalInterface
public interface SeedSource {

    /**
     * @throws ai.freetranslator.http.TransportException when the seed cannot be downloaded
     * @throws SeedFormatException when the downloaded page carries no recognisable seed
     */
    TokenSeed fetch();
}
