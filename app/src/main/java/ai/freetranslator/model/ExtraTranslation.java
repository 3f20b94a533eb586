package ai.freetranslator.model;

import java.util.List;
import java.util.Objects;

/**
 * An alternative translation of the input, with the source-language words it translates back to.
 */
public record ExtraTranslation(String phrase, List<String> phraseTranslations) {

    public ExtraTranslation {
        Objects.requireNonNull(phrase, "phrase");
        phraseTranslations = List.copyOf(Objects.requireNonNull(phraseTranslations, "phraseTranslations"));
    }
}
