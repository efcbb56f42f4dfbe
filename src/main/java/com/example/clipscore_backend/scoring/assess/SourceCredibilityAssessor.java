package com.example.clipscore_backend.scoring.assess;

import com.example.clipscore_backend.scoring.profile.AuthenticitySignals;
import com.example.clipscore_backend.scoring.text.TextCorpus;

import static com.example.clipscore_backend.scoring.Scores.clamp01;
import static com.example.clipscore_backend.scoring.text.KeywordMatcher.countHitsInAny;

/**
 * Credibility of the publishing channel, from its audience size and sourcing language.
 */
public class SourceCredibilityAssessor implements ComponentAssessor {
    static final double NO_CHANNEL_DEFAULT = 0.4;
    private static final double BASE = 0.3;
    private static final double GENUINE_STEP = 0.1;
    private static final double GENUINE_CAP = 0.3;
    private static final double STAGED_STEP = 0.15;
    private static final double STAGED_CAP = 0.3;

    @Override
    public String name() {
        return ComponentNames.SOURCE_CREDIBILITY;
    }

    @Override
    public double assess(AssessmentContext context) {
        if (!context.video().hasChannelInfo()) {
            return NO_CHANNEL_DEFAULT;
        }
        long subscribers = context.video().channelInfo().subscriberCount();
        double score = BASE;
        if (subscribers > 1_000_000) {
            score += 0.3;
        } else if (subscribers > 100_000) {
            score += 0.2;
        } else if (subscribers > 10_000) {
            score += 0.1;
        }
        AuthenticitySignals signals = context.profile().authenticitySignals();
        TextCorpus corpus = context.corpus();
        int genuine = countHitsInAny(signals.genuine(), corpus.metadata(), corpus.comments(), corpus.channelDescription());
        int staged = countHitsInAny(signals.staged(), corpus.title(), corpus.description());
        score += Math.min(GENUINE_STEP * genuine, GENUINE_CAP);
        score -= Math.min(STAGED_STEP * staged, STAGED_CAP);
        return clamp01(score);
    }
}
