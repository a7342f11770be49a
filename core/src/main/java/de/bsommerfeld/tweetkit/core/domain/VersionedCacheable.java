package de.bsommerfeld.tweetkit.core.domain;

/**
 * Capability of an entity that can be stored in the shared cache store
 * under a versioned, perspective-scoped key.
 *
 * <p>
 * The perspective is always present. Entities without a viewer-dependent
 * view report {@link #SHARED_PERSPECTIVE} explicitly, so a viewer-scoped
 * entry and a viewer-agnostic entry can never collide.
 */
public interface VersionedCacheable {

    /**
     * Perspective used for views that do not depend on the viewing user
     * (logged-out reads, user profiles). Numeric user IDs can never equal it.
     */
    String SHARED_PERSPECTIVE = "*";

    EntityKind entityKind();

    /** Stable identifier of the entity, independent of perspective. */
    String cacheId();

    /** Viewer scoping of this instance, never {@code null}. */
    String cachePerspective();
}
