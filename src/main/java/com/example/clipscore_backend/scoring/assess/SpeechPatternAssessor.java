package com.example.clipscore_backend.scoring.assess;

import java.util.List;
import java.util.Map;

import static com.example.clipscore_backend.scoring.Scores.clamp01;
import static com.example.clipscore_backend.scoring.text.KeywordMatcher.containsAny;
import static com.example.clipscore_backend.scoring.text.KeywordMatcher.countHits;

/**
 * Matches the category's speech patterns against the transcript.
 */
public class SpeechPatternAssessor implements ComponentAssessor {
    static final double NO_TRANSCRIPT_DEFAULT = 0.4;
    private static final double BASE = 0.3;
    private static final double DIVERSITY_BONUS = 0.2;

    private final String name;

    public SpeechPatternAssessor(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double assess(AssessmentContext context) {
        if (!context.video().hasTranscript()) {
            return NO_TRANSCRIPT_DEFAULT;
        }
        String transcript = context.corpus().transcript();
        int hits = 0;
        int patterns = 0;
        for (Map.Entry<String, List<String>> pattern : context.profile().speechPatterns().entrySet()) {
            hits += countHits(transcript, pattern.getValue());
            if (containsAny(transcript, pattern.getValue())) {
                patterns++;
            }
        }
        double score = BASE;
        if (hits > 4) {
            score += 0.4;
        } else if (hits > 1) {
            score += 0.25;
        } else if (hits > 0) {
            score += 0.1;
        }
        if (patterns >= 2) {
            score += DIVERSITY_BONUS;
        }
        return clamp01(score);
    }
}
