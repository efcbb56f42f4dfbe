package com.example.clipscore_backend.scoring.profile;

import java.util.List;

import static com.example.clipscore_backend.scoring.assess.ComponentNames.ACHIEVEMENT_AUTHENTICITY;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.AUTHENTICITY;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.CONTENT_MATCH;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.EMOTIONAL_IMPACT;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.ENGAGEMENT;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.FACTUAL_TONE;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.INSPIRATIONAL_IMPACT;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.RESPONSIBLE_HANDLING;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.SOURCE_CREDIBILITY;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.SPEECH_PATTERNS;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.STRUGGLE_NARRATIVE;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.VIEWER_IMPACT;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.VIEWER_RESPONSE;
import static com.example.clipscore_backend.scoring.assess.ComponentNames.VISUAL_WARMTH;

/**
 * Built-in category definitions.
 */
public final class CategoryProfiles {
    public static final String HEARTWARMING = "heartwarming";
    public static final String MOTIVATIONAL = "motivational";
    public static final String TRAUMATIC = "traumatic";

    private CategoryProfiles() {
    }

    public static List<CategoryProfile> all() {
        return List.of(heartwarming(), motivational(), traumatic());
    }

    public static CategoryProfile heartwarming() {
        return CategoryProfile.builder(HEARTWARMING)
                .displayName("Heartwarming Content")
                .contentType("reunions", "reunion", "reunited", "homecoming", "coming home", "welcome home")
                .contentType("surprises", "surprise", "surprised", "proposal", "unexpected visit")
                .contentType("acts_of_kindness", "kindness", "good deed", "stranger", "donated", "paid it forward", "helping")
                .contentType("family_moments", "family", "grandma", "grandpa", "newborn", "first steps", "mother", "father")
                .contentType("animal_rescue", "rescued", "adopted", "shelter", "puppy", "kitten")
                .emotions(EmotionTier.STRONG, "crying", "sobbing", "tears", "bawling", "ugly cry")
                .emotions(EmotionTier.MODERATE, "made me cry", "touching", "emotional", "moving", "goosebumps", "chills")
                .emotions(EmotionTier.MILD, "sweet", "beautiful", "precious", "wholesome", "adorable", "heartwarming")
                .genuine("genuine", "real", "spontaneous", "unexpected", "candid", "raw emotion")
                .staged("fake", "staged", "acting", "scripted", "set up", "for the camera")
                .speechPattern("gratitude", "thank you", "grateful", "thankful")
                .speechPattern("affection", "i love you", "missed you", "so proud of you")
                .speechPattern("disbelief", "oh my god", "i can't believe", "no way")
                .weight(AUTHENTICITY, 0.30)
                .weight(EMOTIONAL_IMPACT, 0.22)
                .weight(CONTENT_MATCH, 0.15)
                .weight(VIEWER_RESPONSE, 0.13)
                .weight(VISUAL_WARMTH, 0.10)
                .weight(ENGAGEMENT, 0.10)
                .score(3.0, 7.0)
                .gating(AUTHENTICITY, 0.4, 0.6)
                .stagedPenaltyCap(0.4)
                .strongMomentBonus(0.8)
                .confidence(0.3, 20)
                .labels(AuthenticityLabel.AUTHENTIC, AuthenticityLabel.QUESTIONABLE, AuthenticityLabel.LIKELY_STAGED)
                .build();
    }

    public static CategoryProfile motivational() {
        return CategoryProfile.builder(MOTIVATIONAL)
                .displayName("Motivational Content")
                .contentType("transformations", "transformation", "before and after", "weight loss", "glow up", "changed my life")
                .contentType("achievements", "achievement", "graduated", "graduation", "champion", "world record", "milestone", "success")
                .contentType("comebacks", "comeback", "overcome", "overcame", "never gave up", "came back")
                .contentType("speeches", "motivation", "inspiring", "speech", "mindset")
                .contentType("discipline", "discipline", "training", "workout", "grind", "consistency")
                .emotions(EmotionTier.STRONG, "life changing", "needed this", "goosebumps", "chills")
                .emotions(EmotionTier.MODERATE, "inspired", "motivated", "powerful", "determined", "pumped")
                .emotions(EmotionTier.MILD, "respect", "proud", "legend", "amazing", "love this")
                .genuine("struggle", "journey", "earned", "dedication", "hard work", "sacrifice", "years of")
                .staged("overnight success", "easy money", "secret", "hack", "get rich", "guaranteed", "link in bio")
                .speechPattern("call_to_action", "never give up", "keep going", "you can do", "believe in yourself", "don't quit")
                .speechPattern("personal_story", "when i started", "i used to", "years ago", "i was")
                .speechPattern("adversity", "i failed", "rock bottom", "everyone doubted", "nobody believed")
                .weight(ACHIEVEMENT_AUTHENTICITY, 0.25)
                .weight(INSPIRATIONAL_IMPACT, 0.20)
                .weight(CONTENT_MATCH, 0.15)
                .weight(STRUGGLE_NARRATIVE, 0.15)
                .weight(VIEWER_RESPONSE, 0.15)
                .weight(SPEECH_PATTERNS, 0.10)
                .score(2.0, 8.0)
                .gating(ACHIEVEMENT_AUTHENTICITY, 0.3, 0.5)
                .stagedPenaltyCap(0.5)
                .strongMomentBonus(1.0)
                .confidence(0.3, 15)
                .labels(AuthenticityLabel.AUTHENTIC, AuthenticityLabel.QUESTIONABLE, AuthenticityLabel.LIKELY_FAKE)
                .build();
    }

    public static CategoryProfile traumatic() {
        return CategoryProfile.builder(TRAUMATIC)
                .displayName("Traumatic Events")
                .contentType("accidents", "accident", "crash", "collision", "derail")
                .contentType("natural_disasters", "earthquake", "flood", "hurricane", "wildfire", "tornado", "tsunami", "disaster")
                .contentType("emergencies", "emergency", "evacuation", "first responders", "rescue")
                .contentType("crises", "tragedy", "crisis", "attack", "explosion")
                .contentType("news_coverage", "breaking news", "footage", "eyewitness", "report")
                .emotions(EmotionTier.STRONG, "devastating", "heartbreaking", "horrifying", "heart goes out")
                .emotions(EmotionTier.MODERATE, "shocked", "tragic", "terrible", "prayers", "so sad")
                .emotions(EmotionTier.MILD, "stay safe", "hope everyone", "thoughts", "condolences")
                .genuine("official", "witness", "survivor", "confirmed", "verified", "breaking news")
                .staged("clickbait", "sensational", "dramatic music", "for views", "you won't believe", "gone wrong")
                .speechPattern("factual_reporting", "according to", "officials said", "confirmed", "reported")
                .speechPattern("safety_guidance", "stay safe", "evacuate", "call 911", "emergency services")
                .speechPattern("empathy", "our thoughts", "condolences", "those affected")
                .weight(RESPONSIBLE_HANDLING, 0.30)
                .weight(SOURCE_CREDIBILITY, 0.20)
                .weight(CONTENT_MATCH, 0.15)
                .weight(FACTUAL_TONE, 0.15)
                .weight(VIEWER_IMPACT, 0.10)
                .weight(ENGAGEMENT, 0.10)
                .score(1.0, 9.0)
                .gating(RESPONSIBLE_HANDLING, 0.5, 0.4)
                .stagedPenaltyCap(0.5)
                .strongMomentBonus(0.8)
                .confidence(0.2, 30)
                .labels(AuthenticityLabel.RESPONSIBLE, AuthenticityLabel.QUESTIONABLE, AuthenticityLabel.EXPLOITATIVE)
                .build();
    }
}
