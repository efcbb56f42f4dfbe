package com.example.clipscore_backend.scoring;

import com.example.clipscore_backend.model.VideoRecord;
import com.example.clipscore_backend.scoring.profile.CategoryProfile;
import com.example.clipscore_backend.scoring.profile.ConfidenceRule;

import java.util.Map;

/**
 * Estimates how much evidence backs a score. Every increment is gated on an evidence threshold, so
 * adding comments, transcript, views or channel data never lowers the estimate while component scores
 * stay put. The gating increment reads the gating component score, which itself depends on comment text:
 * comments that push authenticity or responsible handling down can remove that increment.
 */
public class ConfidenceEstimator {
    private static final double COMMENTS_INCREMENT = 0.2;
    private static final double TRANSCRIPT_INCREMENT = 0.15;
    private static final double VIEWS_INCREMENT = 0.15;
    private static final double GATING_INCREMENT = 0.1;
    private static final double CHANNEL_INCREMENT = 0.1;

    private static final long MIN_VIEWS = 1_000;
    private static final double MIN_GATING_VALUE = 0.2;
    private static final long MIN_SUBSCRIBERS = 10_000;

    public double estimate(CategoryProfile profile, VideoRecord video, Map<String, Double> componentScores) {
        ConfidenceRule rule = profile.confidence();
        double confidence = rule.floor();
        if (video.comments().size() > rule.commentThreshold()) {
            confidence += COMMENTS_INCREMENT;
        }
        if (video.hasTranscript()) {
            confidence += TRANSCRIPT_INCREMENT;
        }
        if (video.viewCount() > MIN_VIEWS) {
            confidence += VIEWS_INCREMENT;
        }
        if (componentScores.getOrDefault(profile.gatingComponent(), 0.0) > MIN_GATING_VALUE) {
            confidence += GATING_INCREMENT;
        }
        if (video.hasChannelInfo() && video.channelInfo().subscriberCount() > MIN_SUBSCRIBERS) {
            confidence += CHANNEL_INCREMENT;
        }
        return Scores.clamp01(confidence);
    }
}
