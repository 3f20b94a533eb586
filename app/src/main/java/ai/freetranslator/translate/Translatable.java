package ai.freetranslator.translate;

import ai.freetranslator.language.Language;

/**
 * Anything that knows its own text and language pair.
 */
public interface Translatable {

    String originalText();

    Language fromLanguage();

    Language toLanguage();
}
