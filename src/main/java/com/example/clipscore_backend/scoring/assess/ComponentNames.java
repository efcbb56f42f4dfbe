package com.example.clipscore_backend.scoring.assess;

/**
 * Names under which component assessors are registered and weighted.
 */
public final class ComponentNames {
    public static final String AUTHENTICITY = "authenticity";
    public static final String ACHIEVEMENT_AUTHENTICITY = "achievementAuthenticity";
    public static final String CONTENT_MATCH = "contentMatch";
    public static final String EMOTIONAL_IMPACT = "emotionalImpact";
    public static final String INSPIRATIONAL_IMPACT = "inspirationalImpact";
    public static final String VIEWER_IMPACT = "viewerImpact";
    public static final String VIEWER_RESPONSE = "viewerResponse";
    public static final String ENGAGEMENT = "engagement";
    public static final String VISUAL_WARMTH = "visualWarmth";
    public static final String SPEECH_PATTERNS = "speechPatterns";
    public static final String FACTUAL_TONE = "factualTone";
    public static final String STRUGGLE_NARRATIVE = "struggleNarrative";
    public static final String RESPONSIBLE_HANDLING = "responsibleHandling";
    public static final String SOURCE_CREDIBILITY = "sourceCredibility";

    private ComponentNames() {
    }
}
