package de.bsommerfeld.tweetkit.decoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.tweetkit.core.domain.CardEntity;
import de.bsommerfeld.tweetkit.core.domain.Tweet;
import de.bsommerfeld.tweetkit.core.domain.TweetEntities;
import de.bsommerfeld.tweetkit.core.domain.TweetPerspective;
import de.bsommerfeld.tweetkit.core.domain.TweetUser;
import de.bsommerfeld.tweetkit.core.domain.UrlEntity;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static de.bsommerfeld.tweetkit.decoder.JsonFields.requireString;
import static de.bsommerfeld.tweetkit.decoder.JsonFields.requireText;
import static de.bsommerfeld.tweetkit.decoder.JsonFields.textOrNull;

/**
 * Hydrates {@link Tweet} values from the API's status JSON.
 *
 * <h3>Required fields</h3>
 * {@code id_str}, {@code created_at}, {@code full_text} or {@code text}, and
 * a {@code user} object. Anything missing or of the wrong shape raises
 * {@link MalformedEntityException}; unknown fields are ignored.
 *
 * <h3>Viewer</h3>
 * The {@code favorited}/{@code retweeted} flags are scoped to the
 * {@value #PERSPECTIVAL_USER_ID_FIELD} field an API client may inject. Without
 * it they are kept unscoped and must be bound with
 * {@link Tweet#withPerspective(String)} before use. An explicit viewer passed
 * to {@link #decode(JsonNode, String)} is bound the same way, so flags fetched
 * for another user never reach it.
 *
 * <h3>Nesting</h3>
 * {@code retweeted_status} and {@code quoted_status} are decoded recursively
 * with the parent's viewer. The platform flattens retweets of retweets, so
 * real payloads nest at most two levels (a retweet of a quote); anything
 * deeper than {@value #MAX_NESTING_DEPTH} is dropped.
 *
 * <h3>Quote permalinks</h3>
 * The text of a quote tweet ends with the short link to the quoted Tweet.
 * That link is trimmed from {@code text} and its URL entity removed, since
 * the quoted Tweet is carried as {@link Tweet#quotedTweet()}. The link is
 * identified by {@code quoted_status_permalink} when present, otherwise by the
 * quoted Tweet's synthesized permalink ({@code /status/<id>}).
 */
@Singleton
public class TweetDecoder implements JsonDecoder<Tweet> {

    private static final Logger LOG = LoggerFactory.getLogger(TweetDecoder.class);

    /** Field an API client injects to record which user the payload was fetched for. */
    public static final String PERSPECTIVAL_USER_ID_FIELD = "perspectival_user_id";

    static final int MAX_NESTING_DEPTH = 3;

    /** e.g. {@code Wed Mar 01 12:00:00 +0000 2017} */
    private static final DateTimeFormatter CREATED_AT_FORMAT = DateTimeFormatter
            .ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ENGLISH);

    private final UserDecoder userDecoder;
    private final EntityDecoder entityDecoder;

    /**
     * Jackson's {@link ObjectMapper} is thread-safe for reading, so one
     * instance serves every {@link #decode(String)} call.
     */
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public TweetDecoder(UserDecoder userDecoder, EntityDecoder entityDecoder) {
        this.userDecoder = userDecoder;
        this.entityDecoder = entityDecoder;
    }

    public TweetDecoder() {
        this(new UserDecoder(), new EntityDecoder());
    }

    @Override
    public Tweet decode(JsonNode json) {
        return decode(json, null);
    }

    /**
     * Decodes a Tweet on behalf of {@code viewerId}.
     *
     * <p>
     * The payload's flags belong to the user named by the injected
     * {@value #PERSPECTIVAL_USER_ID_FIELD} field, or to nobody known when it is
     * absent. An explicit viewer is then applied like
     * {@link Tweet#withPerspective(String)}: flags of a different user are
     * reset. A {@code null} or empty viewer keeps the payload's own scoping.
     */
    public Tweet decode(JsonNode json, String viewerId) {
        requireObject(json, "Tweet JSON must be an object");
        Tweet tweet = decodeTweet(json, textOrNull(json, PERSPECTIVAL_USER_ID_FIELD), 0);
        if (viewerId == null || viewerId.isEmpty()) {
            return tweet;
        }
        return tweet.withPerspective(viewerId);
    }

    /**
     * Parses and decodes a single Tweet from raw JSON text.
     */
    public Tweet decode(String json) {
        return decode(parse(json));
    }

    public Tweet decode(String json, String viewerId) {
        return decode(parse(json), viewerId);
    }

    /**
     * Parses raw JSON text holding an array of Tweets and decodes it with
     * {@link #decodeAll(JsonNode)} semantics. Unparseable text yields an
     * empty list.
     */
    public List<Tweet> decodeAll(String json) {
        try {
            return decodeAll(parse(json));
        } catch (MalformedEntityException e) {
            LOG.debug("Batch decode of unparseable payload: {}", e.getMessage());
            return List.of();
        }
    }

    // =====================================================================
    // Tweet
    // =====================================================================

    private Tweet decodeTweet(JsonNode json, String viewer, int depth) {
        requireObject(json, "Tweet JSON must be an object");
        String id = requireText(json, "id_str", "Tweet");
        String entity = "Tweet " + id;

        Instant createdAt = parseCreatedAt(requireText(json, "created_at", entity), id);
        String text = json.hasNonNull("full_text")
                ? requireString(json, "full_text", entity)
                : requireString(json, "text", entity);
        TweetUser author = decodeAuthor(json, entity);

        TweetPerspective perspective = decodePerspective(json, viewer);
        long likeCount = Math.max(0, json.path("favorite_count").asLong(0));
        long retweetCount = Math.max(0, json.path("retweet_count").asLong(0));

        TweetEntities entities = entityDecoder.decodeEntities(json);
        CardEntity card = entityDecoder.decodeCard(json.get("card"));

        Tweet retweeted = decodeNested(json, "retweeted_status", viewer, depth);
        Tweet quoted = decodeNested(json, "quoted_status", viewer, depth);

        if (quoted != null) {
            QuoteText reconciled = trimQuotePermalink(json, text, entities, quoted);
            text = reconciled.text();
            entities = reconciled.entities();
        }

        try {
            return new Tweet(id, createdAt, text, author, textOrNull(json, "lang"),
                    likeCount, retweetCount,
                    textOrNull(json, "in_reply_to_status_id_str"),
                    textOrNull(json, "in_reply_to_user_id_str"),
                    textOrNull(json, "in_reply_to_screen_name"),
                    perspective, entities, card, retweeted, quoted);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new MalformedEntityException(entity + " violates a model invariant: " + e.getMessage(), e);
        }
    }

    private TweetUser decodeAuthor(JsonNode json, String entity) {
        JsonNode user = json.get("user");
        if (user == null || !user.isObject()) {
            throw new MalformedEntityException(entity + " is missing required object 'user'");
        }
        return userDecoder.decode(user);
    }

    /**
     * {@code current_user_retweet} only appears when the viewer retweeted the
     * Tweet, so its presence implies {@code retweeted}.
     */
    private TweetPerspective decodePerspective(JsonNode json, String viewer) {
        boolean liked = json.path("favorited").asBoolean(false);
        String retweetId = textOrNull(json.path("current_user_retweet"), "id_str");
        boolean retweeted = json.path("retweeted").asBoolean(false) || retweetId != null;

        return viewer == null
                ? TweetPerspective.unscoped(liked, retweeted, retweetId)
                : new TweetPerspective(viewer, liked, retweeted, retweetId);
    }

    private Tweet decodeNested(JsonNode json, String field, String viewer, int depth) {
        JsonNode nested = json.get(field);
        if (nested == null || nested.isNull()) {
            return null;
        }
        if (depth + 1 > MAX_NESTING_DEPTH) {
            LOG.debug("Dropping {} nested deeper than {} levels", field, MAX_NESTING_DEPTH);
            return null;
        }
        return decodeTweet(nested, viewer, depth + 1);
    }

    private Instant parseCreatedAt(String raw, String id) {
        try {
            return OffsetDateTime.parse(raw, CREATED_AT_FORMAT).toInstant();
        } catch (DateTimeParseException e) {
            throw new MalformedEntityException("Tweet " + id + " has unparseable created_at '" + raw + "'", e);
        }
    }

    // =====================================================================
    // Quote permalink
    // =====================================================================

    private QuoteText trimQuotePermalink(JsonNode json, String text, TweetEntities entities, Tweet quoted) {
        JsonNode permalink = json.path("quoted_status_permalink");
        String permalinkShort = textOrNull(permalink, "url");
        String permalinkExpanded = textOrNull(permalink, "expanded");
        Pattern statusPath = Pattern.compile("/status(?:es)?/" + Pattern.quote(quoted.id()) + "(?:[/?#].*)?$");

        String trimmed = text.stripTrailing();
        List<UrlEntity> urls = new ArrayList<>(entities.urls());
        for (int i = urls.size() - 1; i >= 0; i--) {
            UrlEntity url = urls.get(i);
            if (!pointsAtQuoted(url, permalinkExpanded, statusPath) || !trimmed.endsWith(url.url())) {
                continue;
            }
            urls.remove(i);
            return new QuoteText(cutSuffix(trimmed, url.url()), entities.withUrls(urls));
        }

        if (permalinkShort != null && trimmed.endsWith(permalinkShort)) {
            return new QuoteText(cutSuffix(trimmed, permalinkShort), entities);
        }
        return new QuoteText(text, entities);
    }

    private static boolean pointsAtQuoted(UrlEntity url, String permalinkExpanded, Pattern statusPath) {
        String expanded = url.expandedUrl();
        if (expanded == null) {
            return false;
        }
        if (permalinkExpanded != null && permalinkExpanded.equalsIgnoreCase(expanded)) {
            return true;
        }
        return statusPath.matcher(expanded).find();
    }

    private static String cutSuffix(String text, String suffix) {
        return text.substring(0, text.length() - suffix.length()).stripTrailing();
    }

    private record QuoteText(String text, TweetEntities entities) {
    }

    // =====================================================================
    // Parsing
    // =====================================================================

    private JsonNode parse(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedEntityException("Empty JSON payload");
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedEntityException("Unparseable JSON payload", e);
        }
    }

    private static void requireObject(JsonNode json, String message) {
        if (json == null || !json.isObject()) {
            throw new MalformedEntityException(message);
        }
    }
}
