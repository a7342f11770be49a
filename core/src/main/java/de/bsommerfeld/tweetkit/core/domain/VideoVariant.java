package de.bsommerfeld.tweetkit.core.domain;

/**
 * One encoding of a video.
 *
 * @param contentType MIME type, e.g. {@code video/mp4}
 * @param url         playable URL
 * @param bitrate     bits per second, {@code 0} for adaptive playlists
 */
public record VideoVariant(String contentType, String url, long bitrate) {
}
