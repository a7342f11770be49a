package de.bsommerfeld.tweetkit.core.domain;

import java.util.List;
import java.util.Map;

/**
 * Rich card attached to a Tweet. Binding values are flattened to strings:
 * string and boolean values verbatim, images as their URL, users as their
 * {@code id_str}.
 *
 * @param name          card type, e.g. {@code player} or {@code summary}
 * @param url           URL the card was generated for
 * @param bindingValues flattened binding values, never {@code null}
 */
public record CardEntity(String name, String url, Map<String, String> bindingValues) {

    /** Account that published Vine player cards. */
    static final String VINE_USER_ID = "586671909";

    static final String PLAYER_STREAM_URL = "player_stream_url";
    static final String PLAYER_STREAM_CONTENT_TYPE = "player_stream_content_type";

    public CardEntity {
        bindingValues = bindingValues != null ? Map.copyOf(bindingValues) : Map.of();
    }

    public String bindingValue(String key) {
        return bindingValues.get(key);
    }

    public boolean isVineCard() {
        return VINE_USER_ID.equals(bindingValue("site"));
    }

    /**
     * Video playback info for player cards that expose a stream, otherwise
     * {@code null}.
     */
    public VideoMetaData videoMetaData() {
        String streamUrl = bindingValue(PLAYER_STREAM_URL);
        if (streamUrl == null || streamUrl.isEmpty()) {
            return null;
        }
        String contentType = bindingValues.getOrDefault(PLAYER_STREAM_CONTENT_TYPE, VideoMetaData.MP4);
        return new VideoMetaData(aspectRatio(), 0,
                List.of(new VideoVariant(contentType, streamUrl, 0)));
    }

    private double aspectRatio() {
        try {
            double width = Double.parseDouble(bindingValues.getOrDefault("player_width", "0"));
            double height = Double.parseDouble(bindingValues.getOrDefault("player_height", "0"));
            return height > 0 ? width / height : 0;
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
