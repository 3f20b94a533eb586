package ai.freetranslator.decode;

import java.util.Optional;

/**
 * Romanised forms of the original and the translated text.
 */
public record Transcriptions(Optional<String> original, Optional<String> translated) {

    public static final Transcriptions NONE = new Transcriptions(Optional.empty(), Optional.empty());

    public Transcriptions {
        original = original == null ? Optional.empty() : original;
        translated = translated == null ? Optional.empty() : translated;
    }
}
