package de.bsommerfeld.tweetkit.core.domain;

/**
 * A {@code $CASHTAG} span inside the Tweet text. The API calls these
 * {@code symbols}.
 *
 * @param text       symbol without the {@code $}
 * @param startIndex inclusive start offset in the Tweet text
 * @param endIndex   exclusive end offset in the Tweet text
 */
public record CashtagEntity(String text, int startIndex, int endIndex) {
}
