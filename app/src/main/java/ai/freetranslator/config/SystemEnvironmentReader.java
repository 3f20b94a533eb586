package ai.freetranslator.config;

import java.util.Optional;

/**
 * Reads configuration from the process environment, falling back to a JVM system property of the same name
 * ({@code -DTRANSLATE_DOMAIN=...}).
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key))
                .or(() -> Optional.ofNullable(System.getProperty(key)));
    }
}
