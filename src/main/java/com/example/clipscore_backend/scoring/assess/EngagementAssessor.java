package com.example.clipscore_backend.scoring.assess;

import com.example.clipscore_backend.model.VideoRecord;

/**
 * Like and comment ratios relative to views. Without views there is no ratio and the fallback applies.
 */
public class EngagementAssessor implements ComponentAssessor {
    static final double NO_VIEWS_FALLBACK = 0.3;

    @Override
    public String name() {
        return ComponentNames.ENGAGEMENT;
    }

    @Override
    public double assess(AssessmentContext context) {
        VideoRecord video = context.video();
        if (video.viewCount() <= 0) {
            return NO_VIEWS_FALLBACK;
        }
        double likeRatio = (double) video.likeCount() / video.viewCount();
        double commentRatio = (double) video.commentCount() / video.viewCount();
        if (likeRatio > 0.03 || commentRatio > 0.005) {
            return 0.8;
        }
        if (likeRatio > 0.015 || commentRatio > 0.002) {
            return 0.6;
        }
        return 0.4;
    }
}
