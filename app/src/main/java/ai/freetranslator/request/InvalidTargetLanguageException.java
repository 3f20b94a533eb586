package ai.freetranslator.request;

import ai.freetranslator.translate.TranslationException;

/**
 * Raised when the auto-detect sentinel is used as the target language.
 */
public class InvalidTargetLanguageException extends TranslationException {

    public InvalidTargetLanguageException() {
        super("Target language must not be auto-detect");
    }
}
