package com.example.clipscore_backend.scoring;

/**
 * Intermediate values of one aggregation, kept for explanations.
 *
 * @param weightedSum          sum of weight times clamped component value.
 * @param rawScore             base score plus the scaled weighted sum.
 * @param gatingPenaltyApplied whether the gating component was below its threshold.
 * @param penalizedScore       raw score after the gating penalty.
 * @param momentBonusApplied   whether enough strong moments were found for the bonus.
 * @param finalScore           score in {@code [0, 10]}.
 */
public record ScoreBreakdown(double weightedSum,
                             double rawScore,
                             boolean gatingPenaltyApplied,
                             double penalizedScore,
                             boolean momentBonusApplied,
                             double finalScore) {
}
