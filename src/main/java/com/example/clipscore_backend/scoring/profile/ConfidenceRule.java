package com.example.clipscore_backend.scoring.profile;

/**
 * Category-specific confidence parameters.
 *
 * @param floor            confidence before any evidence is counted.
 * @param commentThreshold comment count that must be exceeded to add the comment increment.
 */
public record ConfidenceRule(double floor, int commentThreshold) {
}
