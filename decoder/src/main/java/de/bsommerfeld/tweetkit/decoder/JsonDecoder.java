package de.bsommerfeld.tweetkit.decoder;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Capability of turning an API JSON object into a typed entity.
 *
 * @param <T> the entity type
 */
public interface JsonDecoder<T> {

    /**
     * Decodes a single JSON object.
     *
     * @throws MalformedEntityException if required fields are missing or of
     *                                  the wrong shape
     */
    T decode(JsonNode json);

    /**
     * Decodes every element of a JSON array, preserving order. {@code null},
     * non-object and malformed elements are dropped so that one bad record
     * cannot break a whole page. Anything but an array yields an empty list.
     */
    default List<T> decodeAll(JsonNode array) {
        return JsonFields.decodeEach(array, this);
    }
}
