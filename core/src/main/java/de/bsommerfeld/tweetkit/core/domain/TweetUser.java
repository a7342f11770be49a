package de.bsommerfeld.tweetkit.core.domain;

/**
 * Immutable snapshot of a Tweet author. Every hydrated Tweet owns its own
 * copy, so two Tweets by the same account never share mutable state.
 *
 * @param id               the user's {@code id_str}
 * @param name             display name
 * @param screenName       handle without the leading {@code @}
 * @param profileImageUrl  HTTPS avatar URL, {@code null} if absent
 * @param verified         verified badge
 * @param protectedAccount whether the account's Tweets are protected
 */
public record TweetUser(
        String id,
        String name,
        String screenName,
        String profileImageUrl,
        boolean verified,
        boolean protectedAccount) implements VersionedCacheable {

    private static final String PROFILE_URL_BASE = "https://twitter.com/";

    public TweetUser {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("User id must not be empty");
        }
        if (screenName == null || screenName.isEmpty()) {
            throw new IllegalArgumentException("User " + id + " has no screen name");
        }
        name = name != null ? name : screenName;
    }

    /** The screen name prefixed with {@code @}. */
    public String formattedScreenName() {
        return "@" + screenName;
    }

    public String profileUrl() {
        return PROFILE_URL_BASE + screenName;
    }

    @Override
    public EntityKind entityKind() {
        return EntityKind.USER;
    }

    @Override
    public String cacheId() {
        return id;
    }

    @Override
    public String cachePerspective() {
        return SHARED_PERSPECTIVE;
    }
}
