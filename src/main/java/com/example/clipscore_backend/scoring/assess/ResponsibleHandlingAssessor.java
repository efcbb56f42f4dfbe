package com.example.clipscore_backend.scoring.assess;

import com.example.clipscore_backend.scoring.text.TextCorpus;

import java.util.List;

import static com.example.clipscore_backend.scoring.Scores.clamp01;
import static com.example.clipscore_backend.scoring.text.KeywordMatcher.containsAny;
import static com.example.clipscore_backend.scoring.text.KeywordMatcher.countHitsInAny;

/**
 * Whether the creator frames a distressing event responsibly: educational or supportive framing and
 * content warnings raise the value, sensational packaging lowers it.
 */
public class ResponsibleHandlingAssessor implements ComponentAssessor {
    private static final List<String> RESPONSIBLE = List.of(
            "awareness", "education", "prevention", "safety", "resources", "support", "helpline", "how to help", "donate"
    );
    private static final List<String> EXPLOITATIVE = List.of(
            "shocking", "graphic", "insane", "brutal", "must see", "you won't believe", "gone wrong", "caught on camera"
    );
    private static final List<String> CONTENT_WARNINGS = List.of(
            "warning", "viewer discretion", "sensitive"
    );
    private static final double BASE = 0.4;
    private static final double RESPONSIBLE_STEP = 0.15;
    private static final double RESPONSIBLE_CAP = 0.5;
    private static final double EXPLOITATIVE_STEP = 0.15;
    private static final double EXPLOITATIVE_CAP = 0.4;
    private static final double WARNING_BONUS = 0.1;

    @Override
    public String name() {
        return ComponentNames.RESPONSIBLE_HANDLING;
    }

    @Override
    public double assess(AssessmentContext context) {
        TextCorpus corpus = context.corpus();
        int responsible = countHitsInAny(RESPONSIBLE, corpus.title(), corpus.description());
        int exploitative = countHitsInAny(EXPLOITATIVE, corpus.title(), corpus.description());
        double score = BASE
                + Math.min(RESPONSIBLE_STEP * responsible, RESPONSIBLE_CAP)
                - Math.min(EXPLOITATIVE_STEP * exploitative, EXPLOITATIVE_CAP);
        if (containsAny(corpus.description(), CONTENT_WARNINGS)) {
            score += WARNING_BONUS;
        }
        return clamp01(score);
    }
}
