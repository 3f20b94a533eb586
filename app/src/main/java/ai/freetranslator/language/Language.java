package ai.freetranslator.language;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;
import java.util.Objects;

/**
 * A language understood by the translation endpoint. Two languages are equal when their ISO codes match,
 * regardless of case or display name.
 */
public record Language(String fullName, String iso639) {

    /**
     * Sentinel asking the service to detect the source language. Never valid as a target.
     */
    public static final Language AUTO = new Language("Automatic", "auto");

    @JsonCreator
    public Language(@JsonProperty("fullName") String fullName, @JsonProperty("iso639") String iso639) {
        this.fullName = requireNonBlank(fullName, "fullName");
        this.iso639 = requireNonBlank(iso639, "iso639").trim();
    }

    public boolean isAuto() {
        return AUTO.iso639.equalsIgnoreCase(iso639);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Language language)) {
            return false;
        }
        return iso639.equalsIgnoreCase(language.iso639);
    }

    @Override
    public int hashCode() {
        return iso639.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return fullName + " (" + iso639 + ")";
    }

    private static String requireNonBlank(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
