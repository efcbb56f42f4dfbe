package com.example.clipscore_backend.scoring.profile;

/**
 * Multiplicative penalty applied when {@code component} scores below {@code threshold}.
 *
 * @param component component whose value gates the score.
 * @param threshold values strictly below this trigger the penalty.
 * @param penalty   factor in {@code (0, 1]} applied to the score.
 */
public record GatingRule(String component, double threshold, double penalty) {
}
