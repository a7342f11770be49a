package de.bsommerfeld.tweetkit.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Singleton;
import de.bsommerfeld.tweetkit.core.domain.CardEntity;
import de.bsommerfeld.tweetkit.core.domain.CashtagEntity;
import de.bsommerfeld.tweetkit.core.domain.HashtagEntity;
import de.bsommerfeld.tweetkit.core.domain.MediaEntity;
import de.bsommerfeld.tweetkit.core.domain.TweetEntities;
import de.bsommerfeld.tweetkit.core.domain.UrlEntity;
import de.bsommerfeld.tweetkit.core.domain.UserMentionEntity;
import de.bsommerfeld.tweetkit.core.domain.VideoMetaData;
import de.bsommerfeld.tweetkit.core.domain.VideoVariant;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static de.bsommerfeld.tweetkit.decoder.JsonFields.index;
import static de.bsommerfeld.tweetkit.decoder.JsonFields.mapEach;
import static de.bsommerfeld.tweetkit.decoder.JsonFields.requireText;
import static de.bsommerfeld.tweetkit.decoder.JsonFields.textOrNull;

/**
 * Decodes the nested entity blocks of a Tweet payload: {@code entities},
 * {@code extended_entities} and {@code card}.
 *
 * <p>
 * Individual entities that lack their identifying field are dropped rather
 * than failing the Tweet; entities are decorations, not identity.
 */
@Singleton
public class EntityDecoder {

    /**
     * Reads all entity lists from a Tweet object. Media are taken from
     * {@code extended_entities} when present since {@code entities.media}
     * only ever lists the first attachment.
     */
    public TweetEntities decodeEntities(JsonNode tweet) {
        JsonNode entities = tweet.path("entities");

        JsonNode media = tweet.path("extended_entities").path("media");
        if (!media.isArray() || media.isEmpty()) {
            media = entities.path("media");
        }

        return new TweetEntities(
                mapEach(entities.path("hashtags"), this::hashtag),
                mapEach(entities.path("symbols"), this::cashtag),
                mapEach(media, this::media),
                mapEach(entities.path("urls"), this::url),
                mapEach(entities.path("user_mentions"), this::userMention));
    }

    /**
     * Decodes a {@code card} object, or returns {@code null} if the node is
     * missing or carries no name.
     */
    public CardEntity decodeCard(JsonNode card) {
        if (card == null || !card.isObject()) {
            return null;
        }
        String name = textOrNull(card, "name");
        if (name == null) {
            return null;
        }
        return new CardEntity(name, textOrNull(card, "url"), bindingValues(card.path("binding_values")));
    }

    // -- Text spans --

    private HashtagEntity hashtag(JsonNode node) {
        return new HashtagEntity(requireText(node, "text", "Hashtag"), index(node, 0), index(node, 1));
    }

    private CashtagEntity cashtag(JsonNode node) {
        return new CashtagEntity(requireText(node, "text", "Cashtag"), index(node, 0), index(node, 1));
    }

    private UrlEntity url(JsonNode node) {
        return new UrlEntity(
                requireText(node, "url", "URL entity"),
                textOrNull(node, "display_url"),
                textOrNull(node, "expanded_url"),
                index(node, 0),
                index(node, 1));
    }

    private UserMentionEntity userMention(JsonNode node) {
        return new UserMentionEntity(
                requireText(node, "id_str", "User mention"),
                textOrNull(node, "name"),
                textOrNull(node, "screen_name"),
                index(node, 0),
                index(node, 1));
    }

    // -- Media --

    private MediaEntity media(JsonNode node) {
        String id = requireText(node, "id_str", "Media entity");
        String mediaUrl = textOrNull(node, "media_url_https");
        if (mediaUrl == null) {
            mediaUrl = textOrNull(node, "media_url");
        }
        JsonNode large = node.path("sizes").path("large");

        return new MediaEntity(
                id,
                textOrNull(node, "type"),
                mediaUrl,
                textOrNull(node, "url"),
                textOrNull(node, "display_url"),
                textOrNull(node, "expanded_url"),
                large.path("w").asInt(0),
                large.path("h").asInt(0),
                videoInfo(node.get("video_info")),
                index(node, 0),
                index(node, 1));
    }

    /**
     * {@code video_info.aspect_ratio} is a two-element {@code [w, h]} array;
     * it is collapsed into a single ratio.
     */
    private VideoMetaData videoInfo(JsonNode info) {
        if (info == null || !info.isObject()) {
            return null;
        }
        double w = info.path("aspect_ratio").path(0).asDouble(0);
        double h = info.path("aspect_ratio").path(1).asDouble(0);
        List<VideoVariant> variants = mapEach(info.path("variants"), this::variant);
        return new VideoMetaData(h > 0 ? w / h : 0, info.path("duration_millis").asLong(0), variants);
    }

    private VideoVariant variant(JsonNode node) {
        return new VideoVariant(
                textOrNull(node, "content_type"),
                requireText(node, "url", "Video variant"),
                node.path("bitrate").asLong(0));
    }

    // -- Cards --

    /**
     * Flattens {@code binding_values}. Each value is an object tagged by
     * {@code type}; only the payload relevant to the type is kept.
     */
    private Map<String, String> bindingValues(JsonNode values) {
        Map<String, String> result = new LinkedHashMap<>();
        if (!values.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = values.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String value = bindingValue(field.getValue());
            if (value != null) {
                result.put(field.getKey(), value);
            }
        }
        return result;
    }

    private String bindingValue(JsonNode value) {
        String type = value.path("type").asText("");
        switch (type) {
            case "STRING":
                return textOrNull(value, "string_value");
            case "BOOLEAN":
                return value.has("boolean_value") ? String.valueOf(value.get("boolean_value").asBoolean()) : null;
            case "IMAGE":
                return textOrNull(value.path("image_value"), "url");
            case "USER":
                return textOrNull(value.path("user_value"), "id_str");
            default:
                return null;
        }
    }
}
