package de.bsommerfeld.tweetkit.core.domain;

/**
 * A photo, GIF or video attached to a Tweet.
 *
 * @param mediaId       the media's {@code id_str}
 * @param mediaType     {@code photo}, {@code animated_gif} or {@code video}
 * @param mediaUrl      HTTPS URL of the still image
 * @param url           shortened URL as it appears in the text
 * @param displayUrl    truncated form meant for display
 * @param expandedUrl   the fully expanded target
 * @param width         width of the large size in pixels
 * @param height        height of the large size in pixels
 * @param videoMetaData playback info, {@code null} for photos
 * @param startIndex    inclusive start offset in the Tweet text
 * @param endIndex      exclusive end offset in the Tweet text
 */
public record MediaEntity(
        String mediaId,
        String mediaType,
        String mediaUrl,
        String url,
        String displayUrl,
        String expandedUrl,
        int width,
        int height,
        VideoMetaData videoMetaData,
        int startIndex,
        int endIndex) {

    public boolean hasVideo() {
        return videoMetaData != null;
    }
}
