package ai.freetranslator.language;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed set of languages supported by the translation endpoint, loaded from a bundled JSON resource.
 */
public final class LanguageCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(LanguageCatalog.class);

    public static final String DEFAULT_RESOURCE = "/languages.json";

    private final Map<String, Language> byIsoCode;
    private final List<Language> ordered;

    public LanguageCatalog(Collection<Language> languages) {
        Objects.requireNonNull(languages, "languages");
        Map<String, Language> index = new LinkedHashMap<>();
        for (Language language : languages) {
            if (language.isAuto()) {
                continue;
            }
            index.putIfAbsent(key(language.iso639()), language);
        }
        this.byIsoCode = Map.copyOf(index);
        this.ordered = List.copyOf(index.values());
    }

    /**
     * Catalog backed by the bundled {@value #DEFAULT_RESOURCE}, loaded once per class loader.
     */
    public static LanguageCatalog defaultCatalog() {
        return DefaultHolder.INSTANCE;
    }

    public static LanguageCatalog fromResource(String resource) {
        Objects.requireNonNull(resource, "resource");
        try (InputStream stream = LanguageCatalog.class.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new IllegalStateException("Language resource not found: " + resource);
            }
            List<Language> languages = new ObjectMapper().readValue(stream, new TypeReference<List<Language>>() { });
            LOGGER.debug("Loaded {} languages from {}", languages.size(), resource);
            return new LanguageCatalog(languages);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read language resource " + resource, ex);
        }
    }

    /**
     * Supported languages in resource order, without the auto-detect sentinel.
     */
    public List<Language> languages() {
        return ordered;
    }

    public Optional<Language> byIsoCode(String iso639) {
        if (iso639 == null || iso639.isBlank()) {
            return Optional.empty();
        }
        if (Language.AUTO.iso639().equalsIgnoreCase(iso639.trim())) {
            return Optional.of(Language.AUTO);
        }
        return Optional.ofNullable(byIsoCode.get(key(iso639)));
    }

    public Optional<Language> byName(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            return Optional.empty();
        }
        String trimmed = fullName.trim();
        if (Language.AUTO.fullName().equalsIgnoreCase(trimmed)) {
            return Optional.of(Language.AUTO);
        }
        return ordered.stream()
                .filter(language -> language.fullName().equalsIgnoreCase(trimmed))
                .findFirst();
    }

    /**
     * Looks a language up by ISO code first and by full name second.
     */
    public Optional<Language> find(String codeOrName) {
        return byIsoCode(codeOrName).or(() -> byName(codeOrName));
    }

    public boolean isSupported(Language language) {
        if (language == null) {
            return false;
        }
        return language.isAuto() || byIsoCode.containsKey(key(language.iso639()));
    }

    public Language requireSupported(Language language) {
        if (!isSupported(language)) {
            throw new UnsupportedLanguageException(language);
        }
        return language;
    }

    private static String key(String iso639) {
        return iso639.trim().toLowerCase(Locale.ROOT);
    }

    private static final class DefaultHolder {
        private static final LanguageCatalog INSTANCE = fromResource(DEFAULT_RESOURCE);
    }
}
