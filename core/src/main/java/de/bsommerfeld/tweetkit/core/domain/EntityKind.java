package de.bsommerfeld.tweetkit.core.domain;

/**
 * Category discriminator for cacheable entities. The {@link #keyPrefix()}
 * namespaces cache keys so that a Tweet and a User sharing the same numeric
 * ID never resolve to the same entry.
 *
 * <p>
 * {@link #defaultSchemaVersion()} is owned by the code: bump it whenever a
 * persisted field of the corresponding type is added, removed, or
 * reinterpreted. Entries written under the old version simply stop being
 * addressable.
 */
public enum EntityKind {

    TWEET("Tweet", 1),
    USER("User", 1);

    private final String keyPrefix;
    private final int defaultSchemaVersion;

    EntityKind(String keyPrefix, int defaultSchemaVersion) {
        this.keyPrefix = keyPrefix;
        this.defaultSchemaVersion = defaultSchemaVersion;
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    public int defaultSchemaVersion() {
        return defaultSchemaVersion;
    }
}
