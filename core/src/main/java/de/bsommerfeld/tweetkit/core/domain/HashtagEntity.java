package de.bsommerfeld.tweetkit.core.domain;

/**
 * A {@code #hashtag} span inside the Tweet text.
 *
 * @param text       hashtag text without the {@code #}
 * @param startIndex inclusive start offset in the Tweet text
 * @param endIndex   exclusive end offset in the Tweet text
 */
public record HashtagEntity(String text, int startIndex, int endIndex) {
}
