package de.bsommerfeld.tweetkit.cache;

import de.bsommerfeld.tweetkit.core.config.SchemaVersions;
import de.bsommerfeld.tweetkit.core.domain.EntityKind;
import de.bsommerfeld.tweetkit.core.domain.Tweet;
import de.bsommerfeld.tweetkit.core.domain.TweetPerspective;
import de.bsommerfeld.tweetkit.core.domain.TweetUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests TweetRepository's key scoping and its handling of undecodable
 * entries. The store boundary is mocked where only the interaction matters.
 */
class TweetRepositoryTest {

    private static final SchemaVersions VERSIONS = SchemaVersions.of(Map.of(EntityKind.TWEET, 3));

    // =====================================================================
    // Against the in-memory store
    // =====================================================================

    @Nested
    class WithInMemoryStore {

        private InMemoryCacheStore store;
        private TweetRepository repository;

        @BeforeEach
        void setUp() {
            store = new InMemoryCacheStore();
            repository = new TweetRepository(store, new VersionedCacheKeyBuilder(VERSIONS));
        }

        @Test
        void saveTweet_shouldBeReadableByTheSameViewer() {
            Tweet tweet = TestTweets.richRetweet();
            repository.saveTweet(tweet);

            assertEquals(tweet, repository.getTweet("100", "42"));
        }

        @Test
        void getTweet_shouldNotServeOneViewersEntryToAnother() {
            repository.saveTweet(TestTweets.tweet("100", new TweetPerspective("42", true, false, null)));

            assertNull(repository.getTweet("100", "7"));
            assertNull(repository.getTweet("100", null));
        }

        @Test
        void saveTweet_shouldKeepViewersApart() {
            Tweet liked = TestTweets.tweet("100", new TweetPerspective("42", true, false, null));
            Tweet plain = TestTweets.tweet("100", new TweetPerspective("7", false, false, null));
            repository.saveTweet(liked);
            repository.saveTweet(plain);

            assertTrue(repository.getTweet("100", "42").isLiked());
            assertFalse(repository.getTweet("100", "7").isLiked());
            assertEquals(2, store.size());
        }

        @Test
        void saveTweet_shouldStoreUnscopedTweetAsLoggedOut() {
            Tweet unscoped = TestTweets.tweet("100", TweetPerspective.unscoped(true, true, "900"));

            Tweet stored = repository.saveTweet(unscoped);

            assertEquals(TweetPerspective.LOGGED_OUT, stored.perspective());
            Tweet loaded = repository.getTweet("100", null);
            assertNotNull(loaded);
            assertFalse(loaded.isLiked());
            assertFalse(loaded.isRetweeted());
        }

        @Test
        void emptyViewer_shouldUseLoggedOutEntry() {
            repository.saveTweet(TestTweets.tweet("100"));

            assertNotNull(repository.getTweet("100", ""));

            repository.removeTweet("100", "");

            assertNull(repository.getTweet("100", null));
        }

        @Test
        void saveTweets_shouldStoreEveryTweet() {
            repository.saveTweets(List.of(TestTweets.tweet("1"), TestTweets.tweet("2"), TestTweets.tweet("3")));

            assertEquals(3, store.size());
            assertEquals("2", repository.getTweet("2", null).id());
        }

        @Test
        void saveTweets_shouldHandleNullAndEmptyGracefully() {
            repository.saveTweets(null);
            repository.saveTweets(List.of());

            assertEquals(0, store.size());
        }

        @Test
        void removeTweet_shouldOnlyDropThatViewersEntry() {
            repository.saveTweet(TestTweets.tweet("100", new TweetPerspective("42", false, false, null)));
            repository.saveTweet(TestTweets.tweet("100"));

            repository.removeTweet("100", "42");

            assertNull(repository.getTweet("100", "42"));
            assertNotNull(repository.getTweet("100", null));
        }

        @Test
        void schemaVersionBump_shouldMakeOldEntriesUnreachable() {
            repository.saveTweet(TestTweets.tweet("100"));
            TweetRepository bumped = new TweetRepository(store,
                    new VersionedCacheKeyBuilder(VERSIONS.withVersion(EntityKind.TWEET, 4)));

            assertNull(bumped.getTweet("100", null));
            assertNotNull(repository.getTweet("100", null));
        }

        @Test
        void saveUser_shouldBeReadableById() {
            TweetUser user = TestTweets.user("12");
            repository.saveUser(user);

            assertEquals(user, repository.getUser("12"));
            assertNull(repository.getUser("13"));
        }

        @Test
        void userAndTweet_shouldNotCollideOnSameId() {
            repository.saveUser(TestTweets.user("12"));
            repository.saveTweet(TestTweets.tweet("12"));

            assertEquals("user12", repository.getUser("12").screenName());
            assertEquals("Tweet 12", repository.getTweet("12", null).text());
        }
    }

    // =====================================================================
    // Against a mocked store
    // =====================================================================

    @Nested
    @ExtendWith(MockitoExtension.class)
    class WithMockedStore {

        @Mock
        private CacheStore store;

        private TweetRepository repository;

        @BeforeEach
        void setUp() {
            repository = new TweetRepository(store, new VersionedCacheKeyBuilder(VERSIONS));
        }

        @Test
        void saveTweet_shouldWriteUnderVersionedKey() {
            repository.saveTweet(TestTweets.tweet("100", new TweetPerspective("42", false, false, null)));

            verify(store).put(eq("Tweet:v3:42:100"), any(byte[].class));
        }

        @Test
        void getTweet_shouldReadSharedKeyForLoggedOutViewer() {
            when(store.get("Tweet:v3:*:100")).thenReturn(null);

            assertNull(repository.getTweet("100", null));
            verify(store).get("Tweet:v3:*:100");
        }

        @Test
        void getTweet_shouldEvictUndecodableEntry() {
            when(store.get("Tweet:v3:42:100")).thenReturn("{broken".getBytes(StandardCharsets.UTF_8));

            assertNull(repository.getTweet("100", "42"));
            verify(store).remove("Tweet:v3:42:100");
        }

        @Test
        void getUser_shouldNotEvictOnMiss() {
            when(store.get(anyString())).thenReturn(null);

            assertNull(repository.getUser("12"));
            verify(store, never()).remove(anyString());
        }
    }
}
