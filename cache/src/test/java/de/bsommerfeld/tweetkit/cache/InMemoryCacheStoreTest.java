package de.bsommerfeld.tweetkit.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCacheStoreTest {

    private final InMemoryCacheStore store = new InMemoryCacheStore();

    @Test
    void get_shouldReturnNullOnMiss() {
        assertNull(store.get("Tweet:v1:*:1"));
    }

    @Test
    void put_shouldOverwriteExistingEntry() {
        store.put("k", new byte[] { 1 });
        store.put("k", new byte[] { 2 });

        assertArrayEquals(new byte[] { 2 }, store.get("k"));
        assertEquals(1, store.size());
    }

    @Test
    void remove_shouldDropEntry() {
        store.put("k", new byte[] { 1 });
        store.remove("k");

        assertNull(store.get("k"));
        assertEquals(0, store.size());
    }

    @Test
    void storedValues_shouldBeIsolatedFromCallers() {
        byte[] value = { 1, 2, 3 };
        store.put("k", value);
        value[0] = 9;
        store.get("k")[1] = 9;

        assertArrayEquals(new byte[] { 1, 2, 3 }, store.get("k"));
    }
}
