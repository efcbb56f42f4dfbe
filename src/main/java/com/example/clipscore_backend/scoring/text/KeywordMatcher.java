package com.example.clipscore_backend.scoring.text;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring lookups. "cry" matches inside "crying"; callers rely on this literal
 * containment behavior rather than word boundaries.
 */
public final class KeywordMatcher {

    private KeywordMatcher() {
    }

    /**
     * Counts how many distinct keywords occur in {@code text}; each keyword counts at most once.
     */
    public static int countHits(String text, Collection<String> keywords) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int hits = 0;
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                hits++;
            }
        }
        return hits;
    }

    /**
     * Counts distinct keywords that occur in any of the given texts.
     */
    public static int countHitsInAny(Collection<String> keywords, String... texts) {
        int hits = 0;
        for (String keyword : keywords) {
            for (String text : texts) {
                if (text != null && text.contains(keyword)) {
                    hits++;
                    break;
                }
            }
        }
        return hits;
    }

    public static boolean containsAny(String text, Collection<String> keywords) {
        return countHits(text, keywords) > 0;
    }

    public static List<String> matches(String text, Collection<String> keywords) {
        List<String> found = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return found;
        }
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                found.add(keyword);
            }
        }
        return found;
    }

    public static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
