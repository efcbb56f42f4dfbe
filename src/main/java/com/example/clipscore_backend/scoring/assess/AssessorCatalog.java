package com.example.clipscore_backend.scoring.assess;

import com.example.clipscore_backend.scoring.exception.ProfileConfigurationException;
import com.example.clipscore_backend.scoring.sentiment.Sentiment;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The set of implemented component assessors, keyed by name.
 */
public class AssessorCatalog {
    private final Map<String, ComponentAssessor> assessors;

    public AssessorCatalog(Collection<? extends ComponentAssessor> assessors) {
        Map<String, ComponentAssessor> byName = new LinkedHashMap<>();
        for (ComponentAssessor assessor : assessors) {
            if (byName.putIfAbsent(assessor.name(), assessor) != null) {
                throw new ProfileConfigurationException("Duplicate component assessor: " + assessor.name());
            }
        }
        this.assessors = Collections.unmodifiableMap(byName);
    }

    public static AssessorCatalog defaults() {
        return new AssessorCatalog(List.of(
                new AuthenticityAssessor(ComponentNames.AUTHENTICITY),
                new AuthenticityAssessor(ComponentNames.ACHIEVEMENT_AUTHENTICITY),
                new ContentMatchAssessor(),
                new EmotionalImpactAssessor(ComponentNames.EMOTIONAL_IMPACT, Sentiment.POSITIVE),
                new EmotionalImpactAssessor(ComponentNames.INSPIRATIONAL_IMPACT, Sentiment.POSITIVE),
                new EmotionalImpactAssessor(ComponentNames.VIEWER_IMPACT, Sentiment.NEGATIVE),
                new ViewerResponseAssessor(),
                new EngagementAssessor(),
                new VisualWarmthAssessor(),
                new SpeechPatternAssessor(ComponentNames.SPEECH_PATTERNS),
                new SpeechPatternAssessor(ComponentNames.FACTUAL_TONE),
                new StruggleNarrativeAssessor(),
                new ResponsibleHandlingAssessor(),
                new SourceCredibilityAssessor()
        ));
    }

    /**
     * @throws ProfileConfigurationException if no assessor is registered under {@code name}.
     */
    public ComponentAssessor get(String name) {
        ComponentAssessor assessor = assessors.get(name);
        if (assessor == null) {
            throw new ProfileConfigurationException("No component assessor named " + name);
        }
        return assessor;
    }

    public Set<String> names() {
        return assessors.keySet();
    }
}
