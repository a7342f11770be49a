package de.bsommerfeld.tweetkit.cache;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.tweetkit.core.config.SchemaVersions;
import de.bsommerfeld.tweetkit.core.domain.Tweet;
import de.bsommerfeld.tweetkit.decoder.TweetDecoder;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TweetKitModuleTest {

    private static final String TWEET_JSON = """
            {
              "id_str": "100",
              "created_at": "Wed Mar 01 12:00:00 +0000 2017",
              "full_text": "hello",
              "favorited": true,
              "favorite_count": 3,
              "user": { "id_str": "12", "screen_name": "jack" }
            }
            """;

    @Test
    void injector_shouldWireRepositoryAsSingleton() {
        Injector injector = Guice.createInjector(new TweetKitModule());

        assertSame(injector.getInstance(TweetRepository.class), injector.getInstance(TweetRepository.class));
        assertInstanceOf(InMemoryCacheStore.class, injector.getInstance(CacheStore.class));
        assertNotNull(injector.getInstance(SchemaVersions.class));
    }

    @Test
    void injector_shouldUseProvidedStore() {
        InMemoryCacheStore store = new InMemoryCacheStore();
        Injector injector = Guice.createInjector(new TweetKitModule(store));

        assertSame(store, injector.getInstance(CacheStore.class));
    }

    @Test
    void decodedTweet_shouldRoundTripThroughRepository() {
        InMemoryCacheStore store = new InMemoryCacheStore();
        Injector injector = Guice.createInjector(new TweetKitModule(store));
        TweetDecoder decoder = injector.getInstance(TweetDecoder.class);
        TweetRepository repository = injector.getInstance(TweetRepository.class);

        Tweet tweet = decoder.decode(TWEET_JSON, "42");
        repository.saveTweet(tweet);

        assertEquals(tweet, repository.getTweet("100", "42"));
        assertTrue(repository.getTweet("100", "42").isLiked());
        assertEquals(1, store.size());
    }
}
