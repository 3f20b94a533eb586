package ai.freetranslator.decode;

import ai.freetranslator.translate.TranslationException;

/**
 * Raised when the response body cannot be read as the expected top-level array at all.
 */
public class ResponseFormatException extends TranslationException {

    public ResponseFormatException(String message) {
        super(message);
    }

    public ResponseFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
