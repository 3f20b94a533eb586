package ai.freetranslator.decode;

import ai.freetranslator.model.PartOfSpeech;
import ai.freetranslator.model.PartOfSpeechEntries;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes any part-of-speech keyed section according to its {@link PartOfSpeechSchema}.
 */
final class PartOfSpeechBlockDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PartOfSpeechBlockDecoder.class);

    private PartOfSpeechBlockDecoder() {
    }

    /**
     * @return empty when the section is absent or has no items
     */
    static <E> Optional<PartOfSpeechEntries<E>> decode(JsonNode block, PartOfSpeechSchema<E> schema) {
        if (block == null || !block.isArray() || block.size() == 0) {
            return Optional.empty();
        }
        PartOfSpeechEntries.Builder<E> builder = new PartOfSpeechEntries.Builder<>();
        for (JsonNode item : block) {
            Optional<String> tag = JsonNodes.text(JsonNodes.element(item, 0));
            if (tag.isEmpty()) {
                LOGGER.warn("Skipping {} item without a part-of-speech tag: {}", schema.name(), JsonNodes.describe(item));
                continue;
            }
            Optional<PartOfSpeech> partOfSpeech = PartOfSpeech.fromTag(tag.get()).filter(schema::recognizes);
            if (partOfSpeech.isEmpty()) {
                // the service sometimes sends untagged groups; only named ones are worth a note
                if (!tag.get().isBlank()) {
                    LOGGER.debug("Ignoring {} for unrecognised part of speech '{}'", schema.name(), tag.get());
                }
                continue;
            }
            JsonNode entries = JsonNodes.element(item, schema.entryListIndex());
            if (entries == null || !entries.isArray()) {
                LOGGER.warn("Skipping {} '{}': entry list missing", schema.name(), tag.get());
                continue;
            }
            for (JsonNode element : entries) {
                try {
                    builder.add(partOfSpeech.get(), schema.read(element));
                } catch (DecodeAnomalyException ex) {
                    LOGGER.warn("Skipping malformed {} entry for '{}': {}", schema.name(), tag.get(), ex.getMessage());
                }
            }
        }
        return Optional.of(builder.build());
    }
}
