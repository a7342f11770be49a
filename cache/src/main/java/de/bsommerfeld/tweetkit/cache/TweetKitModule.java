package de.bsommerfeld.tweetkit.cache;

import com.google.inject.AbstractModule;
import de.bsommerfeld.tweetkit.core.config.SchemaVersions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice module wiring the decoders, key builder and repository.
 *
 * <p>
 * Without an explicit store, {@link CacheStore} is bound to
 * {@link InMemoryCacheStore}. Decoders bind themselves just in time.
 */
public class TweetKitModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(TweetKitModule.class);

    private final CacheStore store;

    public TweetKitModule() {
        this(null);
    }

    /**
     * @param store cache store to use, {@code null} for an in-memory store
     */
    public TweetKitModule(CacheStore store) {
        this.store = store;
    }

    @Override
    protected void configure() {
        SchemaVersions versions = SchemaVersions.load();
        LOG.info("Schema versions initialized: {}", versions);
        bind(SchemaVersions.class).toInstance(versions);

        if (store != null) {
            bind(CacheStore.class).toInstance(store);
        } else {
            bind(CacheStore.class).to(InMemoryCacheStore.class);
        }
    }
}
