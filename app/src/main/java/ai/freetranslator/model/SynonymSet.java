package ai.freetranslator.model;

import java.util.List;
import java.util.Objects;

/**
 * A group of interchangeable words sharing one sense.
 */
public record SynonymSet(List<String> synonyms) {

    public SynonymSet {
        synonyms = List.copyOf(Objects.requireNonNull(synonyms, "synonyms"));
    }
}
