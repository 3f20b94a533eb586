package ai.freetranslator.config;

import java.util.Optional;

/**
 * Source of configuration values keyed by environment variable name.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * The trimmed value, treating blank values as unset.
     */
    default Optional<String> getNonBlank(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
