package ai.freetranslator.language;

import ai.freetranslator.translate.TranslationException;

/**
 * Raised before any network call when a language is not part of the supported catalog.
 */
public class UnsupportedLanguageException extends TranslationException {

    private final Language language;

    public UnsupportedLanguageException(Language language) {
        super("Language is not supported: " + language);
        this.language = language;
    }

    public Language language() {
        return language;
    }
}
