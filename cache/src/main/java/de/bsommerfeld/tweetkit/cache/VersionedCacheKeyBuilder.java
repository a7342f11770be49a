package de.bsommerfeld.tweetkit.cache;

import com.google.inject.Singleton;
import de.bsommerfeld.tweetkit.core.config.SchemaVersions;
import de.bsommerfeld.tweetkit.core.domain.EntityKind;
import de.bsommerfeld.tweetkit.core.domain.VersionedCacheable;
import jakarta.inject.Inject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds cache keys of the form {@code <Kind>:v<version>:<perspective>:<id>},
 * e.g. {@code Tweet:v3:42:100}.
 *
 * <p>
 * The schema version comes from {@link SchemaVersions}, so bumping the
 * version of a kind makes every entry written under the previous version
 * unreachable without touching the store. Perspective and id are
 * URL-encoded; a {@code :} inside either can therefore never shift the
 * segment boundaries and two distinct inputs never share a key.
 */
@Singleton
public class VersionedCacheKeyBuilder {

    private static final char SEPARATOR = ':';

    private final SchemaVersions schemaVersions;

    @Inject
    public VersionedCacheKeyBuilder(SchemaVersions schemaVersions) {
        this.schemaVersions = schemaVersions;
    }

    /**
     * @throws IllegalArgumentException if {@code id} or {@code perspective}
     *                                  is {@code null} or empty
     */
    public String key(EntityKind kind, String id, String perspective) {
        if (kind == null) {
            throw new IllegalArgumentException("Entity kind must not be null");
        }
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Cache id of " + kind + " must not be empty");
        }
        if (perspective == null || perspective.isEmpty()) {
            throw new IllegalArgumentException("Cache perspective of " + kind + " " + id
                    + " must not be empty, use " + VersionedCacheable.SHARED_PERSPECTIVE + " for shared entries");
        }
        return kind.keyPrefix()
                + SEPARATOR + 'v' + schemaVersions.versionOf(kind)
                + SEPARATOR + encode(perspective)
                + SEPARATOR + encode(id);
    }

    public String key(VersionedCacheable entity) {
        return key(entity.entityKind(), entity.cacheId(), entity.cachePerspective());
    }

    /**
     * Key of the viewer-agnostic entry of {@code id}.
     */
    public String sharedKey(EntityKind kind, String id) {
        return key(kind, id, VersionedCacheable.SHARED_PERSPECTIVE);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
