package com.example.clipscore_backend.scoring.moment;

/**
 * A clock value found by {@link TimestampScanner}.
 *
 * @param text          the clock text, e.g. {@code 2:15}.
 * @param offsetSeconds the clock value in seconds.
 * @param start         index of the first clock character in the scanned text.
 * @param atPrefix      whether the clock was introduced by "at".
 */
public record TimestampMatch(String text, long offsetSeconds, int start, boolean atPrefix) {
}
