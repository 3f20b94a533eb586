package ai.freetranslator.decode;

/**
 * A single optional entry had an unexpected shape. Caught and logged by the decoder; never reaches callers.
 */
class DecodeAnomalyException extends RuntimeException {

    DecodeAnomalyException(String message) {
        super(message);
    }
}
