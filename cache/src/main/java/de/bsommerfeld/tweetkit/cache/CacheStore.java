package de.bsommerfeld.tweetkit.cache;

/**
 * Key/value boundary of the shared cache. Eviction and expiry are up to the
 * implementation.
 */
public interface CacheStore {

    /** Returns the stored bytes, or {@code null} on a miss. */
    byte[] get(String key);

    void put(String key, byte[] value);

    void remove(String key);
}
