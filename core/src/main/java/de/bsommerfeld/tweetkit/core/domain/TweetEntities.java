package de.bsommerfeld.tweetkit.core.domain;

import java.util.List;

/**
 * Parsed text spans and attachments of a Tweet. An empty list means the
 * source payload had none of that kind.
 */
public record TweetEntities(
        List<HashtagEntity> hashtags,
        List<CashtagEntity> cashtags,
        List<MediaEntity> media,
        List<UrlEntity> urls,
        List<UserMentionEntity> userMentions) {

    public static final TweetEntities EMPTY = new TweetEntities(null, null, null, null, null);

    public TweetEntities {
        hashtags = copyOf(hashtags);
        cashtags = copyOf(cashtags);
        media = copyOf(media);
        urls = copyOf(urls);
        userMentions = copyOf(userMentions);
    }

    public TweetEntities withUrls(List<UrlEntity> replacement) {
        return new TweetEntities(hashtags, cashtags, media, replacement, userMentions);
    }

    private static <T> List<T> copyOf(List<T> list) {
        return list != null ? List.copyOf(list) : List.of();
    }
}
