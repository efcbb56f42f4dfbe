package com.example.clipscore_backend.scoring.profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of one content category: keywords, weights and thresholds.
 * Keyword collections are ordered so that every derived output is deterministic.
 */
public record CategoryProfile(String id,
                              String displayName,
                              Map<String, List<String>> contentTypes,
                              Map<EmotionTier, List<String>> viewerEmotionTiers,
                              AuthenticitySignals authenticitySignals,
                              Map<String, List<String>> speechPatterns,
                              Map<String, Double> componentWeights,
                              double baseScore,
                              double scaleFactor,
                              GatingRule gating,
                              double stagedPenaltyCap,
                              double strongMomentBonus,
                              ConfidenceRule confidence,
                              AuthenticityLabels labels) {

    public CategoryProfile {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(authenticitySignals, "authenticitySignals");
        Objects.requireNonNull(gating, "gating");
        Objects.requireNonNull(confidence, "confidence");
        Objects.requireNonNull(labels, "labels");
        contentTypes = copyOrdered(contentTypes);
        speechPatterns = copyOrdered(speechPatterns);
        EnumMap<EmotionTier, List<String>> tiers = new EnumMap<>(EmotionTier.class);
        viewerEmotionTiers.forEach((tier, words) -> tiers.put(tier, List.copyOf(words)));
        viewerEmotionTiers = Collections.unmodifiableMap(tiers);
        componentWeights = Collections.unmodifiableMap(new LinkedHashMap<>(componentWeights));
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public List<String> contentKeywords() {
        return flatten(contentTypes.values());
    }

    public List<String> emotionKeywords() {
        return flatten(viewerEmotionTiers.values());
    }

    public List<String> speechPhrases() {
        return flatten(speechPatterns.values());
    }

    public String gatingComponent() {
        return gating.component();
    }

    private static List<String> flatten(Iterable<List<String>> groups) {
        LinkedHashSet<String> all = new LinkedHashSet<>();
        for (List<String> group : groups) {
            all.addAll(group);
        }
        return List.copyOf(all);
    }

    private static Map<String, List<String>> copyOrdered(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((name, words) -> copy.put(name, List.copyOf(words)));
        return Collections.unmodifiableMap(copy);
    }

    public static final class Builder {
        private final String id;
        private String displayName;
        private final Map<String, List<String>> contentTypes = new LinkedHashMap<>();
        private final Map<EmotionTier, List<String>> emotionTiers = new EnumMap<>(EmotionTier.class);
        private List<String> genuine = new ArrayList<>();
        private List<String> staged = new ArrayList<>();
        private final Map<String, List<String>> speechPatterns = new LinkedHashMap<>();
        private final Map<String, Double> weights = new LinkedHashMap<>();
        private double baseScore;
        private double scaleFactor;
        private GatingRule gating;
        private double stagedPenaltyCap = 0.4;
        private double strongMomentBonus;
        private ConfidenceRule confidence;
        private AuthenticityLabels labels;

        private Builder(String id) {
            this.id = id;
            this.displayName = id;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder contentType(String name, String... keywords) {
            contentTypes.put(name, List.of(keywords));
            return this;
        }

        public Builder emotions(EmotionTier tier, String... keywords) {
            emotionTiers.put(tier, List.of(keywords));
            return this;
        }

        public Builder genuine(String... phrases) {
            this.genuine = List.of(phrases);
            return this;
        }

        public Builder staged(String... phrases) {
            this.staged = List.of(phrases);
            return this;
        }

        public Builder speechPattern(String name, String... phrases) {
            speechPatterns.put(name, List.of(phrases));
            return this;
        }

        public Builder weight(String component, double weight) {
            weights.put(component, weight);
            return this;
        }

        public Builder score(double baseScore, double scaleFactor) {
            this.baseScore = baseScore;
            this.scaleFactor = scaleFactor;
            return this;
        }

        public Builder gating(String component, double threshold, double penalty) {
            this.gating = new GatingRule(component, threshold, penalty);
            return this;
        }

        public Builder stagedPenaltyCap(double cap) {
            this.stagedPenaltyCap = cap;
            return this;
        }

        public Builder strongMomentBonus(double bonus) {
            this.strongMomentBonus = bonus;
            return this;
        }

        public Builder confidence(double floor, int commentThreshold) {
            this.confidence = new ConfidenceRule(floor, commentThreshold);
            return this;
        }

        public Builder labels(AuthenticityLabel high, AuthenticityLabel mid, AuthenticityLabel low) {
            this.labels = new AuthenticityLabels(high, mid, low);
            return this;
        }

        public CategoryProfile build() {
            return new CategoryProfile(id, displayName, contentTypes, emotionTiers,
                    new AuthenticitySignals(genuine, staged), speechPatterns, weights,
                    baseScore, scaleFactor, gating, stagedPenaltyCap, strongMomentBonus, confidence, labels);
        }
    }
}
