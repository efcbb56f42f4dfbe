package com.example.clipscore_backend.scoring.moment;

import com.example.clipscore_backend.scoring.profile.CategoryProfile;
import com.example.clipscore_backend.scoring.profile.EmotionTier;
import com.example.clipscore_backend.scoring.sentiment.Sentiment;
import com.example.clipscore_backend.scoring.sentiment.SentimentClassifier;
import com.example.clipscore_backend.scoring.text.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns timestamp-bearing comments into scored {@link Moment}s.
 */
public class MomentExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(MomentExtractor.class);

    /** Moments at or above this relevance count as strong. */
    public static final double STRONG_RELEVANCE = 5.0;

    private static final double CONTENT_WEIGHT = 2.0;
    private static final double CONTEXT_PHRASE_WEIGHT = 1.5;
    private static final int MAX_EMOTION_WORDS = 3;

    private final TimestampScanner scanner;
    private final SentimentClassifier sentimentClassifier;

    public MomentExtractor(TimestampScanner scanner, SentimentClassifier sentimentClassifier) {
        this.scanner = scanner;
        this.sentimentClassifier = sentimentClassifier;
    }

    /**
     * Extracts moments from {@code comments}, sorted by relevance (highest first). Moments with equal
     * relevance keep the order in which their comments were given.
     *
     * @param comments comment texts in retrieval order.
     * @param profile  category to score relevance against.
     * @return moments, never {@code null}.
     */
    public List<Moment> extract(List<String> comments, CategoryProfile profile) {
        List<Moment> moments = new ArrayList<>();
        for (String comment : comments) {
            String text = KeywordMatcher.lower(comment);
            List<TimestampMatch> timestamps = scanner.scan(text);
            if (timestamps.isEmpty()) {
                continue;
            }
            double relevance = relevance(text, profile);
            if (relevance <= 0) {
                continue;
            }
            Sentiment sentiment = sentimentClassifier.classify(comment);
            CategoryIndicators indicators = indicators(text, profile);
            for (TimestampMatch timestamp : timestamps) {
                moments.add(new Moment(timestamp.text(), timestamp.offsetSeconds(), comment, relevance, sentiment, indicators));
            }
        }
        moments.sort(Comparator.comparingDouble(Moment::relevanceScore).reversed());
        LOGGER.trace("moments extracted category={} comments={} moments={}", profile.id(), comments.size(), moments.size());
        return moments;
    }

    public static long countStrong(List<Moment> moments) {
        return moments.stream().filter(m -> m.relevanceScore() >= STRONG_RELEVANCE).count();
    }

    static double relevance(String text, CategoryProfile profile) {
        double score = CONTENT_WEIGHT * KeywordMatcher.countHits(text, profile.contentKeywords());
        for (Map.Entry<EmotionTier, List<String>> tier : profile.viewerEmotionTiers().entrySet()) {
            score += tier.getKey().relevanceWeight() * KeywordMatcher.countHits(text, tier.getValue());
        }
        score += CONTEXT_PHRASE_WEIGHT * KeywordMatcher.countHits(text, profile.speechPhrases());
        return score;
    }

    private static CategoryIndicators indicators(String text, CategoryProfile profile) {
        List<String> contentTypes = new ArrayList<>();
        for (Map.Entry<String, List<String>> type : profile.contentTypes().entrySet()) {
            if (KeywordMatcher.containsAny(text, type.getValue())) {
                contentTypes.add(type.getKey());
            }
        }
        List<String> emotionWords = KeywordMatcher.matches(text, profile.emotionKeywords());
        if (emotionWords.size() > MAX_EMOTION_WORDS) {
            emotionWords = emotionWords.subList(0, MAX_EMOTION_WORDS);
        }
        AuthenticitySignal signal;
        if (KeywordMatcher.containsAny(text, profile.authenticitySignals().genuine())) {
            signal = AuthenticitySignal.GENUINE;
        } else if (KeywordMatcher.containsAny(text, profile.authenticitySignals().staged())) {
            signal = AuthenticitySignal.QUESTIONABLE;
        } else {
            signal = AuthenticitySignal.UNKNOWN;
        }
        return new CategoryIndicators(contentTypes, emotionWords, signal);
    }
}
