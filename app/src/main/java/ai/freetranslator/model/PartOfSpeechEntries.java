package ai.freetranslator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered entries grouped by part of speech. Used for extra translations, synonyms and definitions alike.
 *
 * @param <E> entry type
 */
public record PartOfSpeechEntries<E>(Map<PartOfSpeech, List<E>> byPartOfSpeech) {

    public PartOfSpeechEntries {
        Objects.requireNonNull(byPartOfSpeech, "byPartOfSpeech");
        Map<PartOfSpeech, List<E>> copy = new EnumMap<>(PartOfSpeech.class);
        byPartOfSpeech.forEach((partOfSpeech, entries) -> copy.put(partOfSpeech, List.copyOf(entries)));
        byPartOfSpeech = Collections.unmodifiableMap(copy);
    }

    public static <E> PartOfSpeechEntries<E> empty() {
        return new PartOfSpeechEntries<>(Map.of());
    }

    public List<E> get(PartOfSpeech partOfSpeech) {
        return byPartOfSpeech.getOrDefault(partOfSpeech, List.of());
    }

    public Set<PartOfSpeech> partsOfSpeech() {
        return byPartOfSpeech.keySet();
    }

    public boolean isEmpty() {
        return byPartOfSpeech.isEmpty();
    }

    /**
     * Mutable accumulator; entries for a repeated part of speech are appended in arrival order.
     */
    public static final class Builder<E> {

        private final Map<PartOfSpeech, List<E>> entries = new EnumMap<>(PartOfSpeech.class);

        public Builder<E> add(PartOfSpeech partOfSpeech, E entry) {
            entries.computeIfAbsent(partOfSpeech, ignored -> new ArrayList<>()).add(entry);
            return this;
        }

        public PartOfSpeechEntries<E> build() {
            return new PartOfSpeechEntries<>(entries);
        }
    }
}
