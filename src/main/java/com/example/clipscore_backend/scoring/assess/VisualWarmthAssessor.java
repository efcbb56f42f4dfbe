package com.example.clipscore_backend.scoring.assess;

import com.example.clipscore_backend.model.ColorProfile;
import com.example.clipscore_backend.model.Thumbnail;

import static com.example.clipscore_backend.scoring.Scores.clamp01;

/**
 * Warm, well-lit thumbnails read as heartwarming.
 */
public class VisualWarmthAssessor implements ComponentAssessor {
    static final double NO_THUMBNAIL_DEFAULT = 0.5;
    private static final double BASE = 0.3;
    private static final double MIN_BRIGHTNESS = 0.4;
    private static final double MAX_BRIGHTNESS = 0.85;
    private static final double MIN_CONTRAST = 0.3;

    @Override
    public String name() {
        return ComponentNames.VISUAL_WARMTH;
    }

    @Override
    public double assess(AssessmentContext context) {
        if (!context.video().hasThumbnail()) {
            return NO_THUMBNAIL_DEFAULT;
        }
        Thumbnail thumbnail = context.video().thumbnail();
        ColorProfile colors = thumbnail.colorProfile();
        double score = BASE;
        if (colors.warmTones() > colors.coldTones()) {
            score += 0.3;
        }
        if (thumbnail.brightness() >= MIN_BRIGHTNESS && thumbnail.brightness() <= MAX_BRIGHTNESS) {
            score += 0.2;
        }
        if (thumbnail.contrast() >= MIN_CONTRAST) {
            score += 0.1;
        }
        if (colors.redDominant()) {
            score += 0.1;
        }
        return clamp01(score);
    }
}
