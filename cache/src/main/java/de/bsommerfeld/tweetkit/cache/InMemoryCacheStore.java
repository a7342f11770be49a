package de.bsommerfeld.tweetkit.cache;

import com.google.inject.Singleton;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unbounded, thread-safe {@link CacheStore} backed by a
 * {@link ConcurrentHashMap}. Values are copied on the way in and out so
 * callers can never mutate a stored entry.
 */
@Singleton
public class InMemoryCacheStore implements CacheStore {

    private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

    @Override
    public byte[] get(String key) {
        byte[] value = entries.get(key);
        return value != null ? value.clone() : null;
    }

    @Override
    public void put(String key, byte[] value) {
        entries.put(key, value.clone());
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }

    public int size() {
        return entries.size();
    }
}
