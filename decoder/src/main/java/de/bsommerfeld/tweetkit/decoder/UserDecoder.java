package de.bsommerfeld.tweetkit.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Singleton;
import de.bsommerfeld.tweetkit.core.domain.TweetUser;

import static de.bsommerfeld.tweetkit.decoder.JsonFields.requireText;
import static de.bsommerfeld.tweetkit.decoder.JsonFields.textOrNull;

/**
 * Decodes the API's {@code user} object. {@code id_str} and
 * {@code screen_name} are required; everything else is optional.
 */
@Singleton
public class UserDecoder implements JsonDecoder<TweetUser> {

    @Override
    public TweetUser decode(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new MalformedEntityException("User JSON must be an object");
        }
        String id = requireText(json, "id_str", "User");
        String screenName = requireText(json, "screen_name", "User " + id);

        String profileImageUrl = textOrNull(json, "profile_image_url_https");
        if (profileImageUrl == null) {
            profileImageUrl = textOrNull(json, "profile_image_url");
        }

        return new TweetUser(
                id,
                textOrNull(json, "name"),
                screenName,
                profileImageUrl,
                json.path("verified").asBoolean(false),
                json.path("protected").asBoolean(false));
    }
}
