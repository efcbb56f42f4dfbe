package com.example.clipscore_backend.scoring.assess;

import com.example.clipscore_backend.scoring.moment.MomentExtractor;

import static com.example.clipscore_backend.scoring.Scores.clamp01;

/**
 * Rewards videos whose viewers point at specific, relevant moments.
 */
public class ViewerResponseAssessor implements ComponentAssessor {
    private static final double BASE = 0.3;

    @Override
    public String name() {
        return ComponentNames.VIEWER_RESPONSE;
    }

    @Override
    public double assess(AssessmentContext context) {
        long strongMoments = MomentExtractor.countStrong(context.moments());
        double score = BASE;
        if (strongMoments >= 3) {
            score += 0.5;
        } else if (strongMoments >= 1) {
            score += 0.3;
        }
        int comments = context.video().comments().size();
        if (comments >= 50) {
            score += 0.1;
        } else if (comments >= 20) {
            score += 0.05;
        }
        return clamp01(score);
    }
}
