package com.example.clipscore_backend.scoring.moment;

import com.example.clipscore_backend.scoring.exception.MalformedTimestampException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds clock-style timestamps in free text.
 * <pre>
 * timestamp := [ "at" WS+ ] clock
 * clock     := digits ( ":" digits )+      maximal run, a trailing ':' is not consumed
 * valid     := M:SS or H:MM:SS, first field 1-2 digits, later fields 2 digits below 60
 * </pre>
 * Runs are consumed whole (longest match wins), so {@code 1:02:15} is one timestamp and never
 * {@code 1:02} plus {@code 02:15}. Invalid runs are skipped.
 */
public class TimestampScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(TimestampScanner.class);
    private static final int SECONDS_PER_MINUTE = 60;

    public List<TimestampMatch> scan(String text) {
        List<TimestampMatch> found = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return found;
        }
        int i = 0;
        int n = text.length();
        while (i < n) {
            if (!isDigit(text.charAt(i))) {
                i++;
                continue;
            }
            if (i > 0 && Character.isLetterOrDigit(text.charAt(i - 1))) {
                // glued to a word: the whole run is rejected, not just its first field
                i = runEnd(text, i);
                continue;
            }
            int end = runEnd(text, i);
            String candidate = text.substring(i, end);
            if (candidate.indexOf(':') >= 0) {
                try {
                    found.add(new TimestampMatch(candidate, parseSeconds(candidate), i, hasAtPrefix(text, i)));
                } catch (MalformedTimestampException ex) {
                    LOGGER.debug("timestamp skipped candidate={} reason={}", ex.getCandidate(), ex.getMessage());
                }
            }
            i = end;
        }
        return found;
    }

    /**
     * Parses a clock text to seconds.
     *
     * @param candidate clock text such as {@code 2:15} or {@code 1:02:15}.
     * @return offset in seconds.
     * @throws MalformedTimestampException if the text does not follow the grammar.
     */
    public static long parseSeconds(String candidate) {
        String[] fields = candidate.split(":", -1);
        if (fields.length < 2 || fields.length > 3) {
            throw new MalformedTimestampException(candidate, "expected M:SS or H:MM:SS");
        }
        if (fields[0].isEmpty() || fields[0].length() > 2 || !allDigits(fields[0])) {
            throw new MalformedTimestampException(candidate, "leading field must have one or two digits");
        }
        long total = Long.parseLong(fields[0]);
        for (int f = 1; f < fields.length; f++) {
            String field = fields[f];
            if (field.length() != 2 || !allDigits(field)) {
                throw new MalformedTimestampException(candidate, "minute and second fields need two digits");
            }
            int value = Integer.parseInt(field);
            if (value >= SECONDS_PER_MINUTE) {
                throw new MalformedTimestampException(candidate, "field " + field + " is not below 60");
            }
            total = total * SECONDS_PER_MINUTE + value;
        }
        return total;
    }

    private static int runEnd(String text, int from) {
        int j = skipDigits(text, from);
        while (j + 1 < text.length() && text.charAt(j) == ':' && isDigit(text.charAt(j + 1))) {
            j = skipDigits(text, j + 1);
        }
        return j;
    }

    private static int skipDigits(String text, int from) {
        int j = from;
        while (j < text.length() && isDigit(text.charAt(j))) {
            j++;
        }
        return j;
    }

    private static boolean hasAtPrefix(String text, int clockStart) {
        int j = clockStart - 1;
        if (j < 0 || !Character.isWhitespace(text.charAt(j))) {
            return false;
        }
        while (j >= 0 && Character.isWhitespace(text.charAt(j))) {
            j--;
        }
        if (j < 1) {
            return false;
        }
        boolean at = Character.toLowerCase(text.charAt(j - 1)) == 'a' && Character.toLowerCase(text.charAt(j)) == 't';
        return at && (j < 2 || !Character.isLetterOrDigit(text.charAt(j - 2)));
    }

    private static boolean allDigits(String value) {
        for (int k = 0; k < value.length(); k++) {
            if (!isDigit(value.charAt(k))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
