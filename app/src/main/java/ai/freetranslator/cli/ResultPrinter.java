package ai.freetranslator.cli;

import ai.freetranslator.model.Corrections;
import ai.freetranslator.model.PartOfSpeech;
import ai.freetranslator.model.PartOfSpeechEntries;
import ai.freetranslator.model.TranslationResult;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Renders a {@link TranslationResult} as plain text for the terminal.
 */
public class ResultPrinter {

    private final PrintWriter out;

    public ResultPrinter(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void print(TranslationResult result) {
        out.println(result.mergedTranslation());
        result.translatedTextTranscription().ifPresent(value -> out.println("  [" + value + "]"));
        out.println("  " + result.sourceLanguage().fullName() + " -> " + result.targetLanguage().fullName());

        Corrections corrections = result.corrections();
        if (corrections.textWasCorrected()) {
            out.println("  Did you mean: " + corrections.correctedText().orElse(String.join(" ", corrections.correctedWords())));
        }
        if (corrections.languageWasCorrected()) {
            corrections.correctedLanguage().ifPresent(language -> out.println("  Detected language: " + language.fullName()));
        }

        result.extraTranslations().ifPresent(entries -> printSection("Translations", entries,
                entry -> entry.phrase() + " (" + String.join(", ", entry.phraseTranslations()) + ")"));
        result.synonyms().ifPresent(entries -> printSection("Synonyms", entries,
                entry -> String.join(", ", entry.synonyms())));
        result.definitions().ifPresent(entries -> printSection("Definitions", entries,
                entry -> entry.explanation() + entry.example().map(example -> " \"" + example + "\"").orElse("")));
        result.seeAlso().filter(terms -> !terms.isEmpty())
                .ifPresent(terms -> out.println("See also: " + String.join(", ", terms)));
        out.flush();
    }

    private <E> void printSection(String title, PartOfSpeechEntries<E> entries, Function<E, String> render) {
        if (entries.isEmpty()) {
            return;
        }
        out.println(title + ":");
        for (PartOfSpeech partOfSpeech : entries.partsOfSpeech()) {
            List<E> values = entries.get(partOfSpeech);
            out.println("  " + partOfSpeech.tag().toUpperCase(Locale.ROOT));
            for (E value : values) {
                out.println("    - " + render.apply(value));
            }
        }
    }
}
