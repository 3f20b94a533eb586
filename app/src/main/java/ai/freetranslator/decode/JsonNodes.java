package ai.freetranslator.decode;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

final class JsonNodes {

    private JsonNodes() {
    }

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    static Optional<String> text(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    static String requireText(JsonNode node, String what) {
        return text(node).orElseThrow(() -> new DecodeAnomalyException(what + " is not a string: " + describe(node)));
    }

    static JsonNode requireArray(JsonNode node, String what) {
        if (node == null || !node.isArray()) {
            throw new DecodeAnomalyException(what + " is not an array: " + describe(node));
        }
        return node;
    }

    static JsonNode element(JsonNode array, int index) {
        if (array == null || !array.isArray() || index < 0 || index >= array.size()) {
            return null;
        }
        return array.get(index);
    }

    static List<String> texts(JsonNode array, String what) {
        requireArray(array, what);
        List<String> values = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            values.add(requireText(item, what + " item"));
        }
        return values;
    }

    static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "<missing>";
        }
        String raw = node.toString();
        return raw.length() > 80 ? raw.substring(0, 77) + "..." : raw;
    }
}
