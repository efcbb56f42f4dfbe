package com.example.clipscore_backend.scoring.assess;

import com.example.clipscore_backend.scoring.text.TextCorpus;

import java.util.List;

import static com.example.clipscore_backend.scoring.Scores.clamp01;
import static com.example.clipscore_backend.scoring.text.KeywordMatcher.countHitsInAny;

/**
 * Detects a struggle-then-resolution arc in what the creator and viewers say.
 */
public class StruggleNarrativeAssessor implements ComponentAssessor {
    private static final List<String> STRUGGLE = List.of(
            "struggle", "failed", "rock bottom", "doubted", "injury", "obstacle", "hardship", "setback", "rejected"
    );
    private static final List<String> RESOLUTION = List.of(
            "finally", "made it", "achieved", "overcame", "proved them wrong", "turned my life around"
    );
    private static final double BASE = 0.2;
    private static final double ARC_BONUS = 0.1;

    @Override
    public String name() {
        return ComponentNames.STRUGGLE_NARRATIVE;
    }

    @Override
    public double assess(AssessmentContext context) {
        TextCorpus corpus = context.corpus();
        int struggle = countHitsInAny(STRUGGLE, corpus.description(), corpus.transcript(), corpus.comments());
        int resolution = countHitsInAny(RESOLUTION, corpus.description(), corpus.transcript(), corpus.comments());
        double score = BASE;
        if (struggle > 3) {
            score += 0.4;
        } else if (struggle > 0) {
            score += 0.2;
        }
        if (resolution > 0) {
            score += 0.2;
        }
        if (struggle > 0 && resolution > 0) {
            score += ARC_BONUS;
        }
        return clamp01(score);
    }
}
