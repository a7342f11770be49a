package de.bsommerfeld.tweetkit.core.domain;

/**
 * An {@code @mention} span inside the Tweet text.
 */
public record UserMentionEntity(String userId, String name, String screenName, int startIndex, int endIndex) {
}
