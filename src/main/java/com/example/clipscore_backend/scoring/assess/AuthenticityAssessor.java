package com.example.clipscore_backend.scoring.assess;

import com.example.clipscore_backend.scoring.profile.AuthenticitySignals;
import com.example.clipscore_backend.scoring.text.TextCorpus;

import static com.example.clipscore_backend.scoring.Scores.clamp01;
import static com.example.clipscore_backend.scoring.text.KeywordMatcher.countHitsInAny;

/**
 * Balances genuine against staged phrases. Genuine evidence is looked for in what viewers and the
 * creator say; staged phrases also count when they appear in the title.
 */
public class AuthenticityAssessor implements ComponentAssessor {
    private static final double BASE = 0.5;
    private static final double GENUINE_STEP = 0.15;
    private static final double GENUINE_CAP = 0.4;
    private static final double STAGED_STEP = 0.2;

    private final String name;

    public AuthenticityAssessor(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double assess(AssessmentContext context) {
        AuthenticitySignals signals = context.profile().authenticitySignals();
        TextCorpus corpus = context.corpus();
        int genuine = countHitsInAny(signals.genuine(), corpus.comments(), corpus.description(), corpus.transcript());
        int staged = countHitsInAny(signals.staged(), corpus.title(), corpus.description(), corpus.comments());
        double score = BASE
                + Math.min(GENUINE_STEP * genuine, GENUINE_CAP)
                - Math.min(STAGED_STEP * staged, context.profile().stagedPenaltyCap());
        return clamp01(score);
    }
}
