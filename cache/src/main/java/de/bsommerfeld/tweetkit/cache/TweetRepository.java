package de.bsommerfeld.tweetkit.cache;

import com.google.inject.Singleton;
import de.bsommerfeld.tweetkit.core.domain.EntityKind;
import de.bsommerfeld.tweetkit.core.domain.Tweet;
import de.bsommerfeld.tweetkit.core.domain.TweetUser;
import de.bsommerfeld.tweetkit.core.domain.VersionedCacheable;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Stores and loads Tweets and users through a {@link CacheStore}.
 *
 * <p>
 * Every entry lives under a key from {@link VersionedCacheKeyBuilder}: one
 * entry per Tweet and viewer, plus a shared entry for logged-out reads. Users
 * are always shared.
 *
 * <h3>Unscoped Tweets</h3>
 * A Tweet decoded without a viewer still carries the raw payload flags. Those
 * flags belong to some unknown user and must not be served to anyone, so
 * such Tweets are normalized to the logged-out view before they are stored.
 *
 * <h3>Corrupt entries</h3>
 * Bytes that no longer decode (e.g. written by a build that forgot a version
 * bump) are treated as a miss: the entry is logged and evicted, and the caller
 * refetches.
 */
@Singleton
public class TweetRepository {

    private static final Logger LOG = LoggerFactory.getLogger(TweetRepository.class);

    private final CacheStore store;
    private final VersionedCacheKeyBuilder keys;

    @Inject
    public TweetRepository(CacheStore store, VersionedCacheKeyBuilder keys) {
        this.store = store;
        this.keys = keys;
    }

    // -- Tweets --

    /**
     * Stores {@code tweet} under its own perspective and returns the value
     * actually stored.
     */
    public Tweet saveTweet(Tweet tweet) {
        Tweet stored = tweet.perspective().isBound() ? tweet : tweet.withPerspective(null);
        store.put(keys.key(stored), EntityCodec.TWEET.encode(stored));
        return stored;
    }

    public void saveTweets(List<Tweet> tweets) {
        if (tweets == null || tweets.isEmpty())
            return;
        for (Tweet t : tweets)
            saveTweet(t);
        LOG.debug("Stored {} Tweets", tweets.size());
    }

    /**
     * Loads the Tweet {@code id} as seen by {@code viewerId}, or the shared
     * logged-out entry when {@code viewerId} is {@code null} or empty. Returns
     * {@code null} on a miss.
     */
    public Tweet getTweet(String id, String viewerId) {
        String perspective = perspectiveOf(viewerId);
        return load(keys.key(EntityKind.TWEET, id, perspective), EntityCodec.TWEET);
    }

    public void removeTweet(String id, String viewerId) {
        String perspective = perspectiveOf(viewerId);
        store.remove(keys.key(EntityKind.TWEET, id, perspective));
    }

    // -- Users --

    public void saveUser(TweetUser user) {
        store.put(keys.key(user), EntityCodec.USER.encode(user));
    }

    public TweetUser getUser(String id) {
        return load(keys.sharedKey(EntityKind.USER, id), EntityCodec.USER);
    }

    /** A {@code null} or empty viewer reads the logged-out entry. */
    private static String perspectiveOf(String viewerId) {
        return viewerId != null && !viewerId.isEmpty() ? viewerId : VersionedCacheable.SHARED_PERSPECTIVE;
    }

    private <T> T load(String key, EntityCodec<T> codec) {
        byte[] bytes = store.get(key);
        if (bytes == null) {
            return null;
        }
        try {
            return codec.decode(bytes);
        } catch (EntityCodecException e) {
            LOG.warn("Evicting undecodable cache entry {}", key, e);
            store.remove(key);
            return null;
        }
    }
}
