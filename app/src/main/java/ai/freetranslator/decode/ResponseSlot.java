package ai.freetranslator.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Named positions of the top-level response array. The service never labels its sections, so every index the
 * decoder relies on is listed here.
 */
public enum ResponseSlot {
    MAIN_TRANSLATION(0),
    EXTRA_TRANSLATIONS(1),
    SELECTED_LANGUAGE(2),
    CONFIDENCE(6),
    SPELLING_CORRECTION(7),
    DETECTED_LANGUAGE(8),
    SYNONYMS(11),
    DEFINITIONS(12),
    SEE_ALSO(14);

    private final int index;

    ResponseSlot(int index) {
        this.index = index;
    }

    /**
     * The slot's node, or a missing node when the response is too short. JSON {@code null} is returned as is.
     */
    public JsonNode read(JsonNode root) {
        if (root == null || !root.isArray() || root.size() <= index) {
            return MissingNode.getInstance();
        }
        return root.get(index);
    }

    /**
     * Whether the slot holds a non-empty array.
     */
    public boolean hasValues(JsonNode root) {
        JsonNode node = read(root);
        return node.isArray() && node.size() > 0;
    }
}
