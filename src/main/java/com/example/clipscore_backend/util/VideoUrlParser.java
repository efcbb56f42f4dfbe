package com.example.clipscore_backend.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for YouTube URLs and durations.
 */
public final class VideoUrlParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(VideoUrlParser.class);

    private static final Pattern URL_PATTERN = Pattern.compile(
            "(?i)(?:youtube\\.com/(?:watch\\?(?:[^#]*&)?v=|embed/|shorts/)|youtu\\.be/)([A-Za-z0-9_-]{11})");
    private static final Pattern BARE_ID = Pattern.compile("[A-Za-z0-9_-]{11}");

    private VideoUrlParser() {
    }

    /**
     * Extracts the video id from a watch, short-link, embed or shorts URL, or accepts a bare id.
     *
     * @param url user supplied URL or id.
     * @return the 11 character video id, empty when none can be found.
     */
    public static Optional<String> extractVideoId(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String trimmed = url.trim();
        if (BARE_ID.matcher(trimmed).matches()) {
            return Optional.of(trimmed);
        }
        Matcher matcher = URL_PATTERN.matcher(trimmed);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Parses an ISO-8601 duration such as {@code PT4M13S}; unparseable values count as zero.
     */
    public static long parseIsoDurationSeconds(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Duration.parse(value.trim()).getSeconds());
        } catch (DateTimeParseException ex) {
            LOGGER.debug("duration not parseable value={} reason={}", value, ex.getMessage());
            return 0;
        }
    }

    /**
     * Formats seconds as {@code m:ss}, or {@code h:mm:ss} from one hour on.
     */
    public static String formatDuration(long seconds) {
        long safe = Math.max(0, seconds);
        long hours = safe / 3600;
        long minutes = (safe % 3600) / 60;
        long secs = safe % 60;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%d:%02d:%02d", hours, minutes, secs);
        }
        return String.format(Locale.ROOT, "%d:%02d", minutes, secs);
    }
}
