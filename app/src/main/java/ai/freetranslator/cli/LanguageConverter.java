package ai.freetranslator.cli;

import ai.freetranslator.language.Language;
import ai.freetranslator.language.LanguageCatalog;
import picocli.CommandLine;

/**
 * Accepts a language by ISO code ({@code de}) or by full name ({@code German}).
 */
public class LanguageConverter implements CommandLine.ITypeConverter<Language> {

    @Override
    public Language convert(String value) {
        return LanguageCatalog.defaultCatalog().find(value)
                .orElseThrow(() -> new CommandLine.TypeConversionException("Unsupported language: " + value));
    }
}
