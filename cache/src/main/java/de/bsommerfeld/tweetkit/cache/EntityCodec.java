package de.bsommerfeld.tweetkit.cache;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.bsommerfeld.tweetkit.core.domain.Tweet;
import de.bsommerfeld.tweetkit.core.domain.TweetUser;

import java.io.IOException;

/**
 * Lossless byte form of a cached entity.
 *
 * <p>
 * Values are written as JSON of their record components. Derived accessors
 * such as {@code isRetweet()} are not persisted since they are recomputed
 * from the components on read. The byte layout belongs to the schema
 * version of the entity's kind: change it only together with a version bump.
 *
 * @param <T> the entity type
 */
public final class EntityCodec<T> {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(MapperFeature.AUTO_DETECT_IS_GETTERS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public static final EntityCodec<Tweet> TWEET = new EntityCodec<>(Tweet.class);
    public static final EntityCodec<TweetUser> USER = new EntityCodec<>(TweetUser.class);

    private final Class<T> type;

    private EntityCodec(Class<T> type) {
        this.type = type;
    }

    public byte[] encode(T entity) {
        try {
            return MAPPER.writeValueAsBytes(entity);
        } catch (IOException e) {
            throw new EntityCodecException("Failed to encode " + type.getSimpleName(), e);
        }
    }

    public T decode(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, type);
        } catch (IOException | IllegalArgumentException e) {
            throw new EntityCodecException("Failed to decode " + type.getSimpleName(), e);
        }
    }
}
