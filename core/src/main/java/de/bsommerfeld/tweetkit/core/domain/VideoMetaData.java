package de.bsommerfeld.tweetkit.core.domain;

import java.util.Comparator;
import java.util.List;

/**
 * Playback information for a video attached to a Tweet, either through a
 * media entity or a player card.
 *
 * @param aspectRatio    width divided by height, {@code 0} if unknown
 * @param durationMillis duration in milliseconds, {@code 0} if unknown
 * @param variants       available encodings, never {@code null}
 */
public record VideoMetaData(double aspectRatio, long durationMillis, List<VideoVariant> variants) {

    static final String MP4 = "video/mp4";

    public VideoMetaData {
        variants = variants != null ? List.copyOf(variants) : List.of();
    }

    /**
     * The highest-bitrate MP4 variant, falling back to the first variant of
     * any type. {@code null} when there are no variants.
     */
    public VideoVariant bestVariant() {
        return variants.stream()
                .filter(v -> MP4.equals(v.contentType()))
                .max(Comparator.comparingLong(VideoVariant::bitrate))
                .orElse(variants.isEmpty() ? null : variants.get(0));
    }
}
