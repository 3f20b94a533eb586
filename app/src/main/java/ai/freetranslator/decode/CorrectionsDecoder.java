package ai.freetranslator.decode;

import ai.freetranslator.language.Language;
import ai.freetranslator.language.LanguageCatalog;
import ai.freetranslator.model.Corrections;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link Corrections} from the spelling, language and confidence slots.
 */
final class CorrectionsDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorrectionsDecoder.class);
    private static final Pattern CORRECTED_WORD = Pattern.compile("<b><i>(.*?)</i></b>");

    private final LanguageCatalog catalog;

    CorrectionsDecoder(LanguageCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    Corrections decode(JsonNode root) {
        if (root == null || !root.isArray() || root.size() == 0) {
            return Corrections.none();
        }

        boolean textWasCorrected = false;
        Optional<String> correctedText = Optional.empty();
        List<String> correctedWords = List.of();
        if (ResponseSlot.SPELLING_CORRECTION.hasValues(root)) {
            JsonNode spelling = ResponseSlot.SPELLING_CORRECTION.read(root);
            Optional<String> markup = JsonNodes.text(JsonNodes.element(spelling, 0));
            if (markup.isPresent()) {
                textWasCorrected = true;
                correctedWords = correctedWords(markup.get());
                correctedText = JsonNodes.text(JsonNodes.element(spelling, 1));
            } else {
                LOGGER.warn("Ignoring spelling correction without markup: {}", JsonNodes.describe(spelling));
            }
        }

        boolean languageWasCorrected = false;
        Optional<Language> correctedLanguage = Optional.empty();
        Optional<String> selected = JsonNodes.text(ResponseSlot.SELECTED_LANGUAGE.read(root));
        Optional<String> detected = detectedLanguageCode(root);
        if (selected.isPresent() && detected.isPresent() && !selected.get().equalsIgnoreCase(detected.get())) {
            languageWasCorrected = true;
            correctedLanguage = catalog.byIsoCode(detected.get());
            if (correctedLanguage.isEmpty()) {
                LOGGER.debug("Detected language '{}' is not in the catalog", detected.get());
            }
        }

        return new Corrections(textWasCorrected, correctedText, correctedWords,
                languageWasCorrected, correctedLanguage, confidence(root));
    }

    static Optional<String> detectedLanguageCode(JsonNode root) {
        JsonNode detected = ResponseSlot.DETECTED_LANGUAGE.read(root);
        return JsonNodes.text(JsonNodes.element(JsonNodes.element(detected, 0), 0));
    }

    private static List<String> correctedWords(String markup) {
        List<String> words = new ArrayList<>();
        Matcher matcher = CORRECTED_WORD.matcher(markup);
        while (matcher.find()) {
            words.add(matcher.group(1));
        }
        return words;
    }

    private static double confidence(JsonNode root) {
        JsonNode node = ResponseSlot.CONFIDENCE.read(root);
        if (!node.isNumber()) {
            return 0.0;
        }
        double value = node.asDouble();
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
