package ai.freetranslator.model;

import ai.freetranslator.language.Language;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded answer of the translation endpoint.
 * <p>
 * The dictionary sections (extra translations, synonyms, definitions, see-also) are empty for lite translations
 * and whenever the service omitted them.
 */
public record TranslationResult(String originalText,
                                Language sourceLanguage,
                                Language targetLanguage,
                                List<String> fragmentedTranslation,
                                Optional<String> originalTextTranscription,
                                Optional<String> translatedTextTranscription,
                                Corrections corrections,
                                Optional<PartOfSpeechEntries<ExtraTranslation>> extraTranslations,
                                Optional<PartOfSpeechEntries<SynonymSet>> synonyms,
                                Optional<PartOfSpeechEntries<Definition>> definitions,
                                Optional<List<String>> seeAlso) {

    public TranslationResult {
        Objects.requireNonNull(originalText, "originalText");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage");
        Objects.requireNonNull(targetLanguage, "targetLanguage");
        if (targetLanguage.isAuto()) {
            throw new IllegalArgumentException("targetLanguage must not be auto-detect");
        }
        fragmentedTranslation = List.copyOf(Objects.requireNonNull(fragmentedTranslation, "fragmentedTranslation"));
        originalTextTranscription = originalTextTranscription == null ? Optional.empty() : originalTextTranscription;
        translatedTextTranscription = translatedTextTranscription == null ? Optional.empty() : translatedTextTranscription;
        corrections = corrections == null ? Corrections.none() : corrections;
        extraTranslations = extraTranslations == null ? Optional.empty() : extraTranslations;
        synonyms = synonyms == null ? Optional.empty() : synonyms;
        definitions = definitions == null ? Optional.empty() : definitions;
        seeAlso = seeAlso == null ? Optional.empty() : seeAlso.map(List::copyOf);
    }

    /**
     * Result for blank input: nothing was sent to the service.
     */
    public static TranslationResult empty(String originalText, Language sourceLanguage, Language targetLanguage) {
        return new TranslationResult(originalText, sourceLanguage, targetLanguage, List.of(),
                Optional.empty(), Optional.empty(), Corrections.none(),
                Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    /**
     * The translated fragments joined in order.
     */
    public String mergedTranslation() {
        return String.join("", fragmentedTranslation);
    }
}
