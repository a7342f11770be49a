package de.bsommerfeld.tweetkit.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Field access helpers shared by the decoders.
 */
final class JsonFields {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFields.class);

    private JsonFields() {
    }

    /**
     * Returns the textual value of {@code field}.
     *
     * @throws MalformedEntityException if the field is missing, {@code null},
     *                                  not a string, or empty
     */
    static String requireText(JsonNode node, String field, String entity) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedEntityException(entity + " is missing required field '" + field + "'");
        }
        if (!value.isTextual() || value.asText().isEmpty()) {
            throw new MalformedEntityException(entity + " field '" + field + "' must be a non-empty string, got "
                    + value.getNodeType());
        }
        return value.asText();
    }

    /**
     * Like {@link #requireText} but accepts an empty string.
     */
    static String requireString(JsonNode node, String field, String entity) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new MalformedEntityException(entity + " field '" + field + "' must be a string");
        }
        return value.asText();
    }

    /**
     * Returns the textual value of {@code field}, or {@code null} when it is
     * missing, {@code null} or empty. Numbers are rendered as text.
     */
    static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    /** Element {@code index} of the {@code indices} array, {@code 0} if absent. */
    static int index(JsonNode entity, int index) {
        return entity.path("indices").path(index).asInt(0);
    }

    /**
     * Maps every object element of {@code array}, dropping elements the
     * mapper rejects with a {@link MalformedEntityException}.
     */
    static <T> List<T> mapEach(JsonNode array, Function<JsonNode, T> mapper) {
        if (array == null || !array.isArray() || array.isEmpty()) {
            return Collections.emptyList();
        }
        List<T> result = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (element == null || !element.isObject()) {
                continue;
            }
            try {
                result.add(mapper.apply(element));
            } catch (MalformedEntityException e) {
                LOG.debug("Skipping malformed element: {}", e.getMessage());
            }
        }
        return result;
    }

    static <T> List<T> decodeEach(JsonNode array, JsonDecoder<T> decoder) {
        if (array == null || !array.isArray()) {
            if (array != null && !array.isNull() && !array.isMissingNode()) {
                LOG.debug("Batch decode expected an array but got {}", array.getNodeType());
            }
            return Collections.emptyList();
        }
        List<T> result = mapEach(array, decoder::decode);
        if (result.size() < array.size()) {
            LOG.debug("Dropped {} of {} elements during batch decode", array.size() - result.size(), array.size());
        }
        return result;
    }
}
