package ai.freetranslator.decode;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts one element of a part-of-speech entry list into a model value.
 */
@FunctionalInterface
interface EntryReader<E> {

    /**
     * @throws DecodeAnomalyException when the element does not have the expected shape
     */
    E read(JsonNode element);
}
