package com.example.clipscore_backend.scoring.sentiment;

import com.example.clipscore_backend.scoring.text.KeywordMatcher;

import java.util.List;

/**
 * Keyword-count sentiment for a single comment. Strong keywords weigh twice as much as ordinary ones;
 * equal totals resolve to {@link Sentiment#NEUTRAL}.
 */
public class SentimentClassifier {

    private static final List<String> STRONG_POSITIVE = List.of(
            "love", "amazing", "incredible", "beautiful", "perfect", "best"
    );
    private static final List<String> POSITIVE = List.of(
            "great", "awesome", "good", "nice", "happy", "sweet", "wholesome", "inspiring",
            "crying", "tears", "emotional", "respect", "proud"
    );
    private static final List<String> STRONG_NEGATIVE = List.of(
            "hate", "terrible", "awful", "disgusting", "worst"
    );
    private static final List<String> NEGATIVE = List.of(
            "bad", "fake", "staged", "boring", "cringe", "clickbait", "sad", "annoying"
    );

    private static final int STRONG_WEIGHT = 2;
    private static final int ORDINARY_WEIGHT = 1;

    public Sentiment classify(String commentText) {
        String text = KeywordMatcher.lower(commentText);
        int positive = STRONG_WEIGHT * KeywordMatcher.countHits(text, STRONG_POSITIVE)
                + ORDINARY_WEIGHT * KeywordMatcher.countHits(text, POSITIVE);
        int negative = STRONG_WEIGHT * KeywordMatcher.countHits(text, STRONG_NEGATIVE)
                + ORDINARY_WEIGHT * KeywordMatcher.countHits(text, NEGATIVE);
        if (positive > negative) {
            return Sentiment.POSITIVE;
        }
        if (negative > positive) {
            return Sentiment.NEGATIVE;
        }
        return Sentiment.NEUTRAL;
    }

    public List<Sentiment> classifyAll(List<String> comments) {
        return comments.stream().map(this::classify).toList();
    }

    /**
     * Share of {@code sentiments} equal to {@code target}; {@code 0} when there is nothing to count.
     */
    public static double ratio(List<Sentiment> sentiments, Sentiment target) {
        if (sentiments.isEmpty()) {
            return 0.0;
        }
        long count = sentiments.stream().filter(s -> s == target).count();
        return (double) count / sentiments.size();
    }
}
