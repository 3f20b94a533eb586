package ai.freetranslator.decode;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Translated fragments and transcriptions from {@link ResponseSlot#MAIN_TRANSLATION}.
 */
record MainTranslation(List<String> fragments, Transcriptions transcriptions) {

    MainTranslation {
        fragments = List.copyOf(Objects.requireNonNull(fragments, "fragments"));
        Objects.requireNonNull(transcriptions, "transcriptions");
    }

    static MainTranslation decode(JsonNode block) {
        if (block == null || !block.isArray() || block.size() == 0) {
            return new MainTranslation(List.of(), Transcriptions.NONE);
        }
        int fragmentCount = block.size();
        Transcriptions transcriptions = Transcriptions.NONE;
        JsonNode trailing = block.get(block.size() - 1);
        if (isTranscriptionTuple(trailing)) {
            fragmentCount--;
            transcriptions = TranscriptionExtractor.extract(trailing);
        }
        List<String> fragments = new ArrayList<>(fragmentCount);
        for (int i = 0; i < fragmentCount; i++) {
            JsonNode tuple = block.get(i);
            JsonNodes.text(JsonNodes.element(tuple, 0)).ifPresent(fragments::add);
        }
        return new MainTranslation(fragments, transcriptions);
    }

    // fragment tuples start with the translated text; the transcription tuple starts with null
    private static boolean isTranscriptionTuple(JsonNode tuple) {
        if (tuple == null || !tuple.isArray()) {
            return false;
        }
        JsonNode first = JsonNodes.element(tuple, 0);
        return first == null || !first.isTextual();
    }
}
