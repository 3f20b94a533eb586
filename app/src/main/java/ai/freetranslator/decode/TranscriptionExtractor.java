package ai.freetranslator.decode;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Reads the trailing transcription tuple of the main translation section.
 * <p>
 * A tuple of exactly three elements carries only the translated-text transcription, in its last element. Longer
 * tuples carry the translated-text transcription second to last and the original-text one last; when the second to
 * last element is null the last element is the translated-text transcription and there is no original one.
 */
public final class TranscriptionExtractor {

    private TranscriptionExtractor() {
    }

    public static Transcriptions extract(JsonNode tuple) {
        if (tuple == null || !tuple.isArray() || tuple.size() == 0) {
            return Transcriptions.NONE;
        }
        int size = tuple.size();
        JsonNode last = tuple.get(size - 1);
        if (size == 3) {
            return new Transcriptions(Optional.empty(), JsonNodes.text(last));
        }
        JsonNode secondToLast = size >= 2 ? tuple.get(size - 2) : null;
        if (!JsonNodes.isAbsent(secondToLast)) {
            return new Transcriptions(JsonNodes.text(last), JsonNodes.text(secondToLast));
        }
        return new Transcriptions(Optional.empty(), JsonNodes.text(last));
    }
}
