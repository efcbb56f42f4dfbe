package com.example.clipscore_backend.scoring.assess;

import com.example.clipscore_backend.scoring.sentiment.Sentiment;
import com.example.clipscore_backend.scoring.sentiment.SentimentClassifier;

import static com.example.clipscore_backend.scoring.Scores.clamp01;
import static com.example.clipscore_backend.scoring.text.KeywordMatcher.countHits;

/**
 * Viewer impact from comment sentiment and emotion-keyword density. The resonant sentiment is the
 * reaction that fits the category: positive for uplifting content, negative for tragic events.
 */
public class EmotionalImpactAssessor implements ComponentAssessor {
    private static final double BASE = 0.3;
    private static final double RATIO_WEIGHT = 0.4;

    private final String name;
    private final Sentiment resonant;

    public EmotionalImpactAssessor(String name, Sentiment resonant) {
        this.name = name;
        this.resonant = resonant;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double assess(AssessmentContext context) {
        double ratio = SentimentClassifier.ratio(context.sentiments(), resonant);
        int emotionHits = countHits(context.corpus().comments(), context.profile().emotionKeywords());
        double density;
        if (emotionHits > 5) {
            density = 0.3;
        } else if (emotionHits > 2) {
            density = 0.2;
        } else {
            density = 0.0;
        }
        return clamp01(BASE + ratio * RATIO_WEIGHT + density);
    }
}
