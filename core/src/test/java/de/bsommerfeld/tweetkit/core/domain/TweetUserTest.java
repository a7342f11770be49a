package de.bsommerfeld.tweetkit.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TweetUserTest {

    @Test
    void formattedScreenName_shouldPrefixAtSign() {
        var user = new TweetUser("42", "Jack", "jack", null, false, false);
        assertEquals("@jack", user.formattedScreenName());
        assertEquals("https://twitter.com/jack", user.profileUrl());
    }

    @Test
    void canonicalConstructor_shouldFallBackToScreenNameForMissingName() {
        var user = new TweetUser("42", null, "jack", null, false, false);
        assertEquals("jack", user.name());
    }

    @Test
    void canonicalConstructor_shouldRejectMissingIdentity() {
        assertThrows(IllegalArgumentException.class, () -> new TweetUser("", "n", "s", null, false, false));
        assertThrows(IllegalArgumentException.class, () -> new TweetUser("1", "n", null, null, false, false));
    }

    @Test
    void cacheIdentity_shouldBeSharedAcrossViewers() {
        var user = new TweetUser("42", "Jack", "jack", null, false, false);
        assertEquals(EntityKind.USER, user.entityKind());
        assertEquals("42", user.cacheId());
        assertEquals(VersionedCacheable.SHARED_PERSPECTIVE, user.cachePerspective());
    }
}
