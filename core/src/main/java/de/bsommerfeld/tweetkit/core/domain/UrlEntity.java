package de.bsommerfeld.tweetkit.core.domain;

/**
 * A link inside the Tweet text.
 *
 * @param url         shortened URL as it appears in the text
 * @param displayUrl  truncated form meant for display
 * @param expandedUrl the fully expanded target
 * @param startIndex  inclusive start offset in the Tweet text
 * @param endIndex    exclusive end offset in the Tweet text
 */
public record UrlEntity(String url, String displayUrl, String expandedUrl, int startIndex, int endIndex) {
}
