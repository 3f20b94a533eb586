package ai.freetranslator.model;

import ai.freetranslator.language.Language;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What the service corrected in the request: misspelled words and a wrongly selected source language.
 */
public record Corrections(boolean textWasCorrected,
                          Optional<String> correctedText,
                          List<String> correctedWords,
                          boolean languageWasCorrected,
                          Optional<Language> correctedLanguage,
                          double confidence) {

    private static final Corrections NONE = new Corrections(false, Optional.empty(), List.of(), false, Optional.empty(), 0.0);

    public Corrections {
        correctedText = correctedText == null ? Optional.empty() : correctedText;
        correctedWords = List.copyOf(Objects.requireNonNull(correctedWords, "correctedWords"));
        correctedLanguage = correctedLanguage == null ? Optional.empty() : correctedLanguage;
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
    }

    public static Corrections none() {
        return NONE;
    }
}
