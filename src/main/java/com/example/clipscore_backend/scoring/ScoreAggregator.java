package com.example.clipscore_backend.scoring;

import com.example.clipscore_backend.scoring.moment.Moment;
import com.example.clipscore_backend.scoring.moment.MomentExtractor;
import com.example.clipscore_backend.scoring.profile.CategoryProfile;
import com.example.clipscore_backend.scoring.profile.GatingRule;

import java.util.List;
import java.util.Map;

/**
 * Combines component values into the final score, driven entirely by the profile:
 * weighted sum, then gating penalty, then strong-moment bonus, then clamp.
 */
public class ScoreAggregator {
    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 10.0;
    static final int BONUS_MIN_STRONG_MOMENTS = 2;

    public ScoreBreakdown aggregate(CategoryProfile profile, Map<String, Double> componentScores, List<Moment> moments) {
        double weightedSum = 0.0;
        for (Map.Entry<String, Double> weight : profile.componentWeights().entrySet()) {
            double value = componentScores.getOrDefault(weight.getKey(), 0.0);
            weightedSum += weight.getValue() * Scores.clamp01(value);
        }
        double raw = profile.baseScore() + profile.scaleFactor() * weightedSum;

        GatingRule gating = profile.gating();
        double gatingValue = Scores.clamp01(componentScores.getOrDefault(gating.component(), 0.0));
        boolean penalized = gatingValue < gating.threshold();
        double penalizedScore = penalized ? raw * gating.penalty() : raw;

        boolean bonus = MomentExtractor.countStrong(moments) >= BONUS_MIN_STRONG_MOMENTS;
        double score = bonus ? penalizedScore + profile.strongMomentBonus() : penalizedScore;

        return new ScoreBreakdown(weightedSum, raw, penalized, penalizedScore, bonus,
                Scores.clamp(score, MIN_SCORE, MAX_SCORE));
    }
}
