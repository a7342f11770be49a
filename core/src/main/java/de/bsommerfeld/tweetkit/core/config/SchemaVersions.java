package de.bsommerfeld.tweetkit.core.config;

import de.bsommerfeld.tweetkit.core.domain.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Immutable table of the current schema version per {@link EntityKind}.
 *
 * <p>
 * Defaults come from {@link EntityKind#defaultSchemaVersion()}. {@link #load()}
 * overlays two optional sources, later ones winning:
 * <ol>
 * <li>{@value #RESOURCE} on the classpath</li>
 * <li>system properties</li>
 * </ol>
 * Both use keys of the form {@code tweetkit.schema.<kind>}, e.g.
 * {@code tweetkit.schema.tweet=2}. Unparseable or negative values are logged
 * and ignored.
 */
public final class SchemaVersions {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaVersions.class);

    public static final String RESOURCE = "tweetkit-schema.properties";
    public static final String PROPERTY_PREFIX = "tweetkit.schema.";

    private final Map<EntityKind, Integer> versions;

    private SchemaVersions(Map<EntityKind, Integer> versions) {
        this.versions = Collections.unmodifiableMap(versions);
    }

    public static SchemaVersions defaults() {
        Map<EntityKind, Integer> map = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            map.put(kind, kind.defaultSchemaVersion());
        }
        return new SchemaVersions(map);
    }

    /**
     * Defaults overridden by the given entries.
     *
     * @throws IllegalArgumentException if a version is negative
     */
    public static SchemaVersions of(Map<EntityKind, Integer> overrides) {
        SchemaVersions result = defaults();
        for (Map.Entry<EntityKind, Integer> e : overrides.entrySet()) {
            result = result.withVersion(e.getKey(), e.getValue());
        }
        return result;
    }

    /**
     * Defaults, then the classpath resource, then system properties.
     */
    public static SchemaVersions load() {
        return load(readResource(), System.getProperties());
    }

    static SchemaVersions load(Properties resource, Properties system) {
        Map<EntityKind, Integer> map = new EnumMap<>(defaults().versions);
        applyOverrides(map, resource, RESOURCE);
        applyOverrides(map, system, "system properties");
        return new SchemaVersions(map);
    }

    public int versionOf(EntityKind kind) {
        return versions.get(kind);
    }

    /**
     * Returns a copy with {@code kind} set to {@code version}.
     */
    public SchemaVersions withVersion(EntityKind kind, int version) {
        if (version < 0) {
            throw new IllegalArgumentException("Schema version of " + kind + " must not be negative: " + version);
        }
        Map<EntityKind, Integer> map = new EnumMap<>(versions);
        map.put(kind, version);
        return new SchemaVersions(map);
    }

    private static void applyOverrides(Map<EntityKind, Integer> map, Properties props, String source) {
        for (EntityKind kind : EntityKind.values()) {
            String key = PROPERTY_PREFIX + kind.name().toLowerCase(Locale.ROOT);
            String raw = props.getProperty(key);
            if (raw == null || raw.isBlank()) {
                continue;
            }
            try {
                int version = Integer.parseInt(raw.trim());
                if (version < 0) {
                    LOG.warn("Ignoring negative schema version '{}' for {} from {}", raw, kind, source);
                    continue;
                }
                map.put(kind, version);
                LOG.debug("Schema version of {} set to {} from {}", kind, version, source);
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring invalid schema version '{}' for {} from {}", raw, kind, source);
            }
        }
    }

    private static Properties readResource() {
        Properties props = new Properties();
        try (InputStream in = SchemaVersions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            LOG.warn("Failed to read {}, using built-in schema versions", RESOURCE, e);
        }
        return props;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SchemaVersions other && versions.equals(other.versions);
    }

    @Override
    public int hashCode() {
        return versions.hashCode();
    }

    @Override
    public String toString() {
        return "SchemaVersions" + versions;
    }
}
