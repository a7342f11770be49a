package de.bsommerfeld.tweetkit.core.domain;

/**
 * Viewer-dependent state of a Tweet.
 *
 * <p>
 * Three shapes exist:
 * <ul>
 * <li><strong>bound</strong>: {@code userId} is set and the flags describe
 * that user's relation to the Tweet</li>
 * <li><strong>logged out</strong>: {@link #LOGGED_OUT}, no user and all flags
 * cleared</li>
 * <li><strong>unscoped</strong>: no user, but flags carried over verbatim from
 * an API payload whose viewer was not known at decode time. Binding it via
 * {@link #scopedTo(String)} either attaches a viewer or strips the flags.</li>
 * </ul>
 *
 * @param userId    ID of the viewing user, {@code null} if unknown or logged out
 * @param liked     whether the viewer liked the Tweet
 * @param retweeted whether the viewer retweeted the Tweet
 * @param retweetId ID of the viewer's retweet, {@code null} if none
 */
public record TweetPerspective(String userId, boolean liked, boolean retweeted, String retweetId) {

    public static final TweetPerspective LOGGED_OUT = new TweetPerspective(null, false, false, null);

    public TweetPerspective {
        if (userId != null && userId.isEmpty()) {
            userId = null;
        }
        if (retweetId != null && retweetId.isEmpty()) {
            retweetId = null;
        }
    }

    /**
     * Flags taken from a payload without a known viewer.
     */
    public static TweetPerspective unscoped(boolean liked, boolean retweeted, String retweetId) {
        return new TweetPerspective(null, liked, retweeted, retweetId);
    }

    public boolean isBound() {
        return userId != null;
    }

    /**
     * Returns this perspective scoped to {@code viewerId}.
     *
     * <p>
     * A {@code null} viewer yields {@link #LOGGED_OUT}. Flags survive only when
     * they were unscoped or already belonged to the same viewer; flags of a
     * different viewer are reset rather than handed over.
     */
    public TweetPerspective scopedTo(String viewerId) {
        if (viewerId == null || viewerId.isEmpty()) {
            return LOGGED_OUT;
        }
        if (userId == null || userId.equals(viewerId)) {
            return new TweetPerspective(viewerId, liked, retweeted, retweetId);
        }
        return new TweetPerspective(viewerId, false, false, null);
    }

    TweetPerspective withLikeToggled() {
        return new TweetPerspective(userId, !liked, retweeted, retweetId);
    }
}
