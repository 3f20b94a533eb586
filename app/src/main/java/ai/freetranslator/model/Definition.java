package ai.freetranslator.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A dictionary sense with an optional usage example.
 */
public record Definition(String explanation, Optional<String> example) {

    public Definition {
        Objects.requireNonNull(explanation, "explanation");
        example = example == null ? Optional.empty() : example;
    }
}
