package ai.freetranslator.token;

import ai.freetranslator.translate.TranslationException;

/**
 * Raised when the landing page no longer contains a seed in any known form, or carries one that cannot be read.
 */
public class SeedFormatException extends TranslationException {

    public SeedFormatException(String message) {
        super(message);
    }

    public SeedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
