package ai.freetranslator.decode;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ResponseSlotTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void shortResponseReadsAsMissing() throws JsonProcessingException {
        JsonNode root = MAPPER.readTree("[[],null,\"en\"]");

        assertThat(ResponseSlot.SEE_ALSO.read(root).isMissingNode()).isTrue();
        assertThat(ResponseSlot.EXTRA_TRANSLATIONS.read(root).isNull()).isTrue();
        assertThat(ResponseSlot.SELECTED_LANGUAGE.read(root).asText()).isEqualTo("en");
    }

    @Test
    void onlyNonEmptyArraysHaveValues() throws JsonProcessingException {
        JsonNode root = MAPPER.readTree("[[[\"x\"]],[],\"en\",null,null,null,0.5,[\"<b><i>x</i></b>\"]]");

        assertThat(ResponseSlot.MAIN_TRANSLATION.hasValues(root)).isTrue();
        assertThat(ResponseSlot.SPELLING_CORRECTION.hasValues(root)).isTrue();
        assertThat(ResponseSlot.EXTRA_TRANSLATIONS.hasValues(root)).isFalse();
        assertThat(ResponseSlot.SELECTED_LANGUAGE.hasValues(root)).isFalse();
        assertThat(ResponseSlot.CONFIDENCE.hasValues(root)).isFalse();
        assertThat(ResponseSlot.DEFINITIONS.hasValues(root)).isFalse();
    }
}
