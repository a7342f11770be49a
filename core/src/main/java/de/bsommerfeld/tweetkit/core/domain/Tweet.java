package de.bsommerfeld.tweetkit.core.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable representation of a Tweet as hydrated from the API.
 *
 * <p>
 * A Tweet is never modified after construction. Cached instances are shared
 * between readers, so every "update" ({@link #withPerspective(String)},
 * {@link #withLikeToggled()}) returns a new value carrying the same
 * {@link #id()}.
 *
 * <h3>Perspective</h3>
 * {@code liked}, {@code retweeted} and {@code retweetId} depend on the viewing
 * user and live in {@link TweetPerspective}. Nested Tweets always share their
 * parent's viewer; the constructor rejects a mix.
 *
 * <h3>Retweets and quotes</h3>
 * {@link #isRetweet()} and {@link #isQuoteTweet()} are derived from the
 * presence of {@link #retweetedTweet()} and {@link #quotedTweet()} and cannot
 * be set independently.
 *
 * @param id                  the {@code id_str} of the Tweet; numeric IDs lose
 *                            precision in this ID space
 * @param createdAt           creation time
 * @param text                visible text
 * @param author              owned copy of the author
 * @param languageCode        BCP 47 code, {@link #UNDEFINED_LANGUAGE} if unknown
 * @param likeCount           number of likes
 * @param retweetCount        number of retweets
 * @param inReplyToTweetId    ID of the Tweet this one replies to
 * @param inReplyToUserId     ID of the user this one replies to
 * @param inReplyToScreenName screen name of that user, without {@code @}
 * @param perspective         viewer-dependent state, never {@code null}
 * @param entities            parsed text spans and media, never {@code null}
 * @param card                rich card, {@code null} if absent
 * @param retweetedTweet      the fully hydrated original of a retweet
 * @param quotedTweet         the fully hydrated Tweet being quoted
 */
public record Tweet(
        String id,
        Instant createdAt,
        String text,
        TweetUser author,
        String languageCode,
        long likeCount,
        long retweetCount,
        String inReplyToTweetId,
        String inReplyToUserId,
        String inReplyToScreenName,
        TweetPerspective perspective,
        TweetEntities entities,
        CardEntity card,
        Tweet retweetedTweet,
        Tweet quotedTweet) implements VersionedCacheable {

    /** Language code the API reports when it could not detect one. */
    public static final String UNDEFINED_LANGUAGE = "und";

    private static final String PERMALINK_FORMAT = "https://twitter.com/%s/status/%s";

    public Tweet {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Tweet id must not be empty");
        }
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(author, "author");
        languageCode = languageCode != null && !languageCode.isEmpty() ? languageCode : UNDEFINED_LANGUAGE;
        perspective = perspective != null ? perspective : TweetPerspective.LOGGED_OUT;
        entities = entities != null ? entities : TweetEntities.EMPTY;

        if (likeCount < 0 || retweetCount < 0) {
            throw new IllegalArgumentException("Tweet " + id + " has a negative count");
        }
        requireSameViewer(id, perspective, retweetedTweet);
        requireSameViewer(id, perspective, quotedTweet);
    }

    // -- Derived attributes --

    public String permalink() {
        return String.format(PERMALINK_FORMAT, author.screenName(), id);
    }

    public boolean isRetweet() {
        return retweetedTweet != null;
    }

    public boolean isQuoteTweet() {
        return quotedTweet != null;
    }

    public String perspectivalUserId() {
        return perspective.userId();
    }

    public boolean isLiked() {
        return perspective.liked();
    }

    public boolean isRetweeted() {
        return perspective.retweeted();
    }

    public String retweetId() {
        return perspective.retweetId();
    }

    public List<HashtagEntity> hashtags() {
        return entities.hashtags();
    }

    public List<CashtagEntity> cashtags() {
        return entities.cashtags();
    }

    public List<MediaEntity> media() {
        return entities.media();
    }

    public List<UrlEntity> urls() {
        return entities.urls();
    }

    public List<UserMentionEntity> userMentions() {
        return entities.userMentions();
    }

    public boolean hasMedia() {
        return !entities.media().isEmpty();
    }

    /**
     * Video info of the first media entity that carries one, else of the card.
     */
    public VideoMetaData videoMetaData() {
        for (MediaEntity m : entities.media()) {
            if (m.hasVideo()) {
                return m.videoMetaData();
            }
        }
        return card != null ? card.videoMetaData() : null;
    }

    public boolean hasPlayableVideo() {
        return videoMetaData() != null;
    }

    public boolean hasVineCard() {
        return card != null && card.isVineCard();
    }

    // -- Perspective overlay --

    /**
     * Returns this Tweet, and every nested Tweet, scoped to {@code userId}.
     * {@code null} means a logged-out viewer and clears all viewer-dependent
     * state. See {@link TweetPerspective#scopedTo(String)} for how existing
     * flags are carried.
     */
    public Tweet withPerspective(String userId) {
        return new Tweet(id, createdAt, text, author, languageCode, likeCount, retweetCount,
                inReplyToTweetId, inReplyToUserId, inReplyToScreenName,
                perspective.scopedTo(userId), entities, card,
                retweetedTweet != null ? retweetedTweet.withPerspective(userId) : null,
                quotedTweet != null ? quotedTweet.withPerspective(userId) : null);
    }

    /**
     * Returns a copy with the like state flipped and {@code likeCount}
     * adjusted by one. Represents the optimistic local state until the server
     * confirms.
     *
     * <p>
     * The API may report a liked Tweet with a count of {@code 0} (retweet
     * wrappers do). Unliking such a Tweet leaves the count at {@code 0}, so in
     * that one case a double toggle ends at {@code 1} instead of the start.
     *
     * @throws MissingPerspectiveException if no viewer is bound
     */
    public Tweet withLikeToggled() {
        if (!perspective.isBound()) {
            throw new MissingPerspectiveException("Cannot toggle like on Tweet " + id + " without a viewer");
        }
        long toggledCount = perspective.liked() ? Math.max(0, likeCount - 1) : likeCount + 1;
        return new Tweet(id, createdAt, text, author, languageCode, toggledCount, retweetCount,
                inReplyToTweetId, inReplyToUserId, inReplyToScreenName,
                perspective.withLikeToggled(), entities, card, retweetedTweet, quotedTweet);
    }

    // -- VersionedCacheable --

    @Override
    public EntityKind entityKind() {
        return EntityKind.TWEET;
    }

    @Override
    public String cacheId() {
        return id;
    }

    @Override
    public String cachePerspective() {
        return perspective.isBound() ? perspective.userId() : SHARED_PERSPECTIVE;
    }

    private static void requireSameViewer(String id, TweetPerspective perspective, Tweet nested) {
        if (nested != null && !Objects.equals(perspective.userId(), nested.perspectivalUserId())) {
            throw new IllegalArgumentException("Nested Tweet " + nested.id()
                    + " is scoped to a different viewer than Tweet " + id);
        }
    }
}
