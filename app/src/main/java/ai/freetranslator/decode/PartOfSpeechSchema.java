package ai.freetranslator.decode;

import ai.freetranslator.model.Definition;
import ai.freetranslator.model.ExtraTranslation;
import ai.freetranslator.model.PartOfSpeech;
import ai.freetranslator.model.SynonymSet;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Shape of one part-of-speech keyed response section.
 * <p>
 * Every item of such a section is {@code [tag, ...]}; the item's entries sit in a nested array at
 * {@code entryListIndex}. Tags outside {@code recognized} are ignored.
 */
final class PartOfSpeechSchema<E> {

    // [tag, [words...], [[word, [back translations...], null, score], ...], ...]
    static final PartOfSpeechSchema<ExtraTranslation> EXTRA_TRANSLATIONS = new PartOfSpeechSchema<>(
            "extra translations",
            EnumSet.allOf(PartOfSpeech.class),
            2,
            element -> new ExtraTranslation(
                    JsonNodes.requireText(JsonNodes.element(element, 0), "extra translation phrase"),
                    JsonNodes.texts(JsonNodes.element(element, 1), "extra translation back translations")));

    // [tag, [[[synonym, synonym...], senseId], ...], lemma]
    static final PartOfSpeechSchema<SynonymSet> SYNONYMS = new PartOfSpeechSchema<>(
            "synonyms",
            EnumSet.complementOf(EnumSet.of(PartOfSpeech.PARTICLE, PartOfSpeech.PLURAL)),
            1,
            element -> new SynonymSet(JsonNodes.texts(JsonNodes.element(element, 0), "synonym set")));

    // [tag, [[explanation, senseId, example], ...], lemma]
    static final PartOfSpeechSchema<Definition> DEFINITIONS = new PartOfSpeechSchema<>(
            "definitions",
            EnumSet.complementOf(EnumSet.of(PartOfSpeech.PARTICLE, PartOfSpeech.PLURAL)),
            1,
            element -> new Definition(
                    JsonNodes.requireText(JsonNodes.element(element, 0), "definition explanation"),
                    JsonNodes.text(JsonNodes.element(element, 2))));

    private final String name;
    private final Set<PartOfSpeech> recognized;
    private final int entryListIndex;
    private final EntryReader<E> reader;

    PartOfSpeechSchema(String name, Set<PartOfSpeech> recognized, int entryListIndex, EntryReader<E> reader) {
        this.name = Objects.requireNonNull(name, "name");
        this.recognized = Set.copyOf(recognized);
        this.entryListIndex = entryListIndex;
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    String name() {
        return name;
    }

    boolean recognizes(PartOfSpeech partOfSpeech) {
        return recognized.contains(partOfSpeech);
    }

    int entryListIndex() {
        return entryListIndex;
    }

    E read(JsonNode element) {
        return reader.read(element);
    }
}
