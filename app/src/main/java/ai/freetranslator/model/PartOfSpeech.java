package ai.freetranslator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Part-of-speech tags used to key dictionary sections of a response.
 */
public enum PartOfSpeech {
    NOUN("noun"),
    VERB("verb"),
    PRONOUN("pronoun"),
    ADVERB("adverb"),
    ADJECTIVE("adjective"),
    CONJUNCTION("conjunction"),
    PREPOSITION("preposition"),
    INTERJECTION("interjection"),
    EXCLAMATION("exclamation"),
    PARTICLE("particle"),
    ABBREVIATION("abbreviation"),
    PHRASE("phrase"),
    PREFIX("prefix"),
    SUFFIX("suffix"),
    ARTICLE("article"),
    COMBINING_FORM("combining form"),
    NUMERAL("numeral"),
    AUXILIARY_VERB("auxiliary verb"),
    PLURAL("plural");

    private final String tag;

    PartOfSpeech(String tag) {
        this.tag = tag;
    }

    /**
     * The tag as the service spells it, e.g. {@code "auxiliary verb"}.
     */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a tag while ignoring case and any embedded whitespace, so {@code "auxiliary verb"} and
     * {@code "auxiliaryverb"} map to the same constant.
     */
    public static Optional<PartOfSpeech> fromTag(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String compact = compact(raw);
        if (compact.isEmpty()) {
            return Optional.empty();
        }
        for (PartOfSpeech partOfSpeech : values()) {
            if (compact(partOfSpeech.tag).equals(compact)) {
                return Optional.of(partOfSpeech);
            }
        }
        return Optional.empty();
    }

    private static String compact(String value) {
        return value.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }
}
