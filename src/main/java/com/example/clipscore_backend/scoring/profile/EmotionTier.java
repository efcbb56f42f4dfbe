package com.example.clipscore_backend.scoring.profile;

/**
 * Intensity tiers for viewer-emotion keywords. The weight is used when scoring moment relevance.
 */
public enum EmotionTier {
    STRONG("strong", 3.0),
    MODERATE("moderate", 2.0),
    MILD("mild", 1.0);

    private final String id;
    private final double relevanceWeight;

    EmotionTier(String id, double relevanceWeight) {
        this.id = id;
        this.relevanceWeight = relevanceWeight;
    }

    public String id() {
        return id;
    }

    public double relevanceWeight() {
        return relevanceWeight;
    }
}
