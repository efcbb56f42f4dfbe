package com.example.clipscore_backend.scoring.assess;

/**
 * A single heuristic signal. Implementations are pure functions of the context and must return a
 * value in {@code [0, 1]}, falling back to a fixed default when optional input is missing.
 */
public interface ComponentAssessor {

    /**
     * @return name used in profile weights and score breakdowns.
     */
    String name();

    /**
     * @param context inputs for the current scoring call.
     * @return component value in {@code [0, 1]}.
     */
    double assess(AssessmentContext context);
}
