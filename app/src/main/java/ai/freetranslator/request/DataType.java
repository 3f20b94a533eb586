package ai.freetranslator.request;

/**
 * Sections requested from the service through repeated {@code dt} parameters, in the order they are sent.
 */
public enum DataType {
    ALTERNATE_TRANSLATIONS("at"),
    WORD_BY_WORD("bd"),
    EXAMPLES("ex"),
    DETECTED_LANGUAGE("ld"),
    DICTIONARY_METADATA("md"),
    SPELLING_CORRECTION("qca"),
    WORD_CLASS("rw"),
    SENTENCE_SEGMENTATION("rm"),
    SYNONYMS("ss"),
    TRANSLATION("t");

    private final String flag;

    DataType(String flag) {
        this.flag = flag;
    }

    public String flag() {
        return flag;
    }
}
