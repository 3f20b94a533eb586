package ai.freetranslator.decode;

import ai.freetranslator.language.Language;
import ai.freetranslator.language.LanguageCatalog;
import ai.freetranslator.model.Corrections;
import ai.freetranslator.model.Definition;
import ai.freetranslator.model.ExtraTranslation;
import ai.freetranslator.model.PartOfSpeechEntries;
import ai.freetranslator.model.SynonymSet;
import ai.freetranslator.model.TranslationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the positional JSON array returned by {@code translate_a/single} into a {@link TranslationResult}.
 * <p>
 * Every section is optional. Missing or empty sections decode to empty values and malformed dictionary entries
 * are skipped with a warning; only a body that is not a JSON array fails the decode.
 */
public class ResponseDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseDecoder.class);

    private final ObjectMapper objectMapper;
    private final LanguageCatalog catalog;
    private final CorrectionsDecoder correctionsDecoder;

    public ResponseDecoder(LanguageCatalog catalog) {
        this(new ObjectMapper(), catalog);
    }

    public ResponseDecoder(ObjectMapper objectMapper, LanguageCatalog catalog) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.correctionsDecoder = new CorrectionsDecoder(catalog);
    }

    /**
     * @param includeExtras whether to read the dictionary sections (extra translations, synonyms, definitions,
     *                      see-also)
     * @throws ResponseFormatException when {@code rawJson} is not a JSON array
     */
    public TranslationResult decode(String rawJson, String originalText, Language source, Language target,
                                    boolean includeExtras) {
        Objects.requireNonNull(originalText, "originalText");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        JsonNode root = parse(rawJson);

        MainTranslation main = MainTranslation.decode(ResponseSlot.MAIN_TRANSLATION.read(root));
        Corrections corrections = correctionsDecoder.decode(root);
        Language resolvedSource = source.isAuto() ? detectedSource(root, source) : source;

        Optional<PartOfSpeechEntries<ExtraTranslation>> extraTranslations = Optional.empty();
        Optional<PartOfSpeechEntries<SynonymSet>> synonyms = Optional.empty();
        Optional<PartOfSpeechEntries<Definition>> definitions = Optional.empty();
        Optional<List<String>> seeAlso = Optional.empty();
        if (includeExtras) {
            extraTranslations = PartOfSpeechBlockDecoder.decode(
                    ResponseSlot.EXTRA_TRANSLATIONS.read(root), PartOfSpeechSchema.EXTRA_TRANSLATIONS);
            synonyms = PartOfSpeechBlockDecoder.decode(
                    ResponseSlot.SYNONYMS.read(root), PartOfSpeechSchema.SYNONYMS);
            definitions = PartOfSpeechBlockDecoder.decode(
                    ResponseSlot.DEFINITIONS.read(root), PartOfSpeechSchema.DEFINITIONS);
            seeAlso = seeAlso(ResponseSlot.SEE_ALSO.read(root));
        }

        return new TranslationResult(originalText, resolvedSource, target, main.fragments(),
                main.transcriptions().original(), main.transcriptions().translated(), corrections,
                extraTranslations, synonyms, definitions, seeAlso);
    }

    private JsonNode parse(String rawJson) {
        if (rawJson == null || rawJson.isBlank()) {
            throw new ResponseFormatException("Empty translation response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(rawJson);
        } catch (JsonProcessingException ex) {
            throw new ResponseFormatException("Translation response is not valid JSON", ex);
        }
        if (root == null || !root.isArray()) {
            throw new ResponseFormatException("Translation response is not a JSON array: " + JsonNodes.describe(root));
        }
        return root;
    }

    private Language detectedSource(JsonNode root, Language requested) {
        Optional<String> detected = CorrectionsDecoder.detectedLanguageCode(root);
        Optional<Language> language = detected.flatMap(catalog::byIsoCode);
        if (language.isEmpty()) {
            LOGGER.warn("Could not resolve detected source language '{}'", detected.orElse("<none>"));
            return requested;
        }
        return language.get();
    }

    private static Optional<List<String>> seeAlso(JsonNode block) {
        if (!block.isArray()) {
            return Optional.empty();
        }
        JsonNode terms = JsonNodes.element(block, 0);
        if (terms == null || !terms.isArray()) {
            return Optional.of(List.of());
        }
        try {
            return Optional.of(JsonNodes.texts(terms, "see-also term"));
        } catch (DecodeAnomalyException ex) {
            LOGGER.warn("Skipping malformed see-also block: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
