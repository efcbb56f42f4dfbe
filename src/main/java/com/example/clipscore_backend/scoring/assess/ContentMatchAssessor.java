package com.example.clipscore_backend.scoring.assess;

import static com.example.clipscore_backend.scoring.Scores.clamp01;
import static com.example.clipscore_backend.scoring.text.KeywordMatcher.countHitsInAny;

/**
 * How many of the category's content keywords appear in the metadata or the comments.
 */
public class ContentMatchAssessor implements ComponentAssessor {
    private static final double BASE = 0.2;

    @Override
    public String name() {
        return ComponentNames.CONTENT_MATCH;
    }

    @Override
    public double assess(AssessmentContext context) {
        int hits = countHitsInAny(context.profile().contentKeywords(),
                context.corpus().metadata(), context.corpus().comments());
        double bonus;
        if (hits > 5) {
            bonus = 0.6;
        } else if (hits > 2) {
            bonus = 0.4;
        } else if (hits > 0) {
            bonus = 0.2;
        } else {
            bonus = 0.0;
        }
        return clamp01(BASE + bonus);
    }
}
