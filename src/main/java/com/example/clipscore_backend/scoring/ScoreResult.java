package com.example.clipscore_backend.scoring;

import com.example.clipscore_backend.scoring.moment.Moment;
import com.example.clipscore_backend.scoring.profile.AuthenticityLabel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of scoring one video against one category.
 *
 * @param category          category identifier.
 * @param finalScore        score in {@code [0, 10]}.
 * @param componentScores   component values in {@code [0, 1]}, in weight declaration order.
 * @param confidence        evidence estimate in {@code [0, 1]}.
 * @param authenticityLabel label derived from the gating component.
 * @param moments           moments, highest relevance first.
 * @param keyIndicators     at most six human-readable observations.
 */
public record ScoreResult(String category,
                          double finalScore,
                          Map<String, Double> componentScores,
                          double confidence,
                          AuthenticityLabel authenticityLabel,
                          List<Moment> moments,
                          List<String> keyIndicators) {
    public static final int MAX_KEY_INDICATORS = 6;

    public ScoreResult {
        componentScores = Collections.unmodifiableMap(new LinkedHashMap<>(componentScores));
        moments = List.copyOf(moments);
        keyIndicators = List.copyOf(keyIndicators);
    }
}
