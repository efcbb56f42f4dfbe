package com.example.clipscore_backend.scoring;

import com.example.clipscore_backend.model.VideoRecord;
import com.example.clipscore_backend.scoring.assess.AssessmentContext;
import com.example.clipscore_backend.scoring.assess.AssessorCatalog;
import com.example.clipscore_backend.scoring.exception.InvalidCategoryException;
import com.example.clipscore_backend.scoring.moment.Moment;
import com.example.clipscore_backend.scoring.moment.MomentExtractor;
import com.example.clipscore_backend.scoring.profile.AuthenticityLabel;
import com.example.clipscore_backend.scoring.profile.AuthenticitySignals;
import com.example.clipscore_backend.scoring.profile.CategoryProfile;
import com.example.clipscore_backend.scoring.profile.CategoryProfileRegistry;
import com.example.clipscore_backend.scoring.profile.GatingRule;
import com.example.clipscore_backend.scoring.sentiment.Sentiment;
import com.example.clipscore_backend.scoring.sentiment.SentimentClassifier;
import com.example.clipscore_backend.scoring.text.KeywordMatcher;
import com.example.clipscore_backend.scoring.text.TextCorpus;
import com.example.clipscore_backend.scoring.text.TextCorpusBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Scores a video against a content category. Stateless; safe to call from several threads.
 */
public class ContentScoringEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContentScoringEngine.class);

    private final CategoryProfileRegistry registry;
    private final AssessorCatalog assessors;
    private final TextCorpusBuilder corpusBuilder;
    private final SentimentClassifier sentimentClassifier;
    private final MomentExtractor momentExtractor;
    private final ScoreAggregator aggregator;
    private final ConfidenceEstimator confidenceEstimator;
    private final AuthenticityClassifier authenticityClassifier;

    public ContentScoringEngine(CategoryProfileRegistry registry,
                                AssessorCatalog assessors,
                                TextCorpusBuilder corpusBuilder,
                                SentimentClassifier sentimentClassifier,
                                MomentExtractor momentExtractor,
                                ScoreAggregator aggregator,
                                ConfidenceEstimator confidenceEstimator,
                                AuthenticityClassifier authenticityClassifier) {
        this.registry = registry;
        this.assessors = assessors;
        this.corpusBuilder = corpusBuilder;
        this.sentimentClassifier = sentimentClassifier;
        this.momentExtractor = momentExtractor;
        this.aggregator = aggregator;
        this.confidenceEstimator = confidenceEstimator;
        this.authenticityClassifier = authenticityClassifier;
    }

    /**
     * Scores {@code video} against the category {@code categoryId}.
     *
     * @param video      video to score.
     * @param categoryId category identifier, e.g. {@code heartwarming}.
     * @return score result.
     * @throws InvalidCategoryException when the category is unknown; nothing is computed in that case.
     */
    public ScoreResult score(VideoRecord video, String categoryId) {
        CategoryProfile profile = registry.profile(categoryId);
        Objects.requireNonNull(video, "video");

        TextCorpus corpus = corpusBuilder.build(video);
        List<Sentiment> sentiments = sentimentClassifier.classifyAll(video.comments());
        List<Moment> moments = momentExtractor.extract(video.comments(), profile);
        AssessmentContext context = new AssessmentContext(video, corpus, profile, moments, sentiments);

        Map<String, Double> components = new LinkedHashMap<>();
        for (String name : profile.componentWeights().keySet()) {
            components.put(name, Scores.clamp01(assessors.get(name).assess(context)));
        }

        ScoreBreakdown breakdown = aggregator.aggregate(profile, components, moments);
        double confidence = confidenceEstimator.estimate(profile, video, components);
        double gatingValue = components.getOrDefault(profile.gatingComponent(), 0.0);
        AuthenticityLabel label = authenticityClassifier.classify(profile, gatingValue);
        List<String> indicators = keyIndicators(context, components, breakdown);

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("score video={} category={} final={} raw={} penalty={} bonus={} confidence={} moments={} components={}",
                    video.videoId(), profile.id(),
                    String.format(Locale.ROOT, "%.2f", breakdown.finalScore()),
                    String.format(Locale.ROOT, "%.2f", breakdown.rawScore()),
                    breakdown.gatingPenaltyApplied(), breakdown.momentBonusApplied(),
                    String.format(Locale.ROOT, "%.2f", confidence), moments.size(), components);
        }
        return new ScoreResult(profile.id(), breakdown.finalScore(), components, confidence, label, moments, indicators);
    }

    private static List<String> keyIndicators(AssessmentContext context, Map<String, Double> components, ScoreBreakdown breakdown) {
        CategoryProfile profile = context.profile();
        TextCorpus corpus = context.corpus();
        List<String> indicators = new ArrayList<>();

        List<String> types = new ArrayList<>();
        for (Map.Entry<String, List<String>> type : profile.contentTypes().entrySet()) {
            if (KeywordMatcher.countHitsInAny(type.getValue(), corpus.metadata(), corpus.comments()) > 0) {
                types.add(type.getKey());
            }
        }
        if (!types.isEmpty()) {
            indicators.add("Content types: " + String.join(", ", types));
        }
        long strong = MomentExtractor.countStrong(context.moments());
        if (strong > 0) {
            indicators.add("Strong moments: " + strong);
        }
        AuthenticitySignals signals = profile.authenticitySignals();
        int genuine = KeywordMatcher.countHitsInAny(signals.genuine(), corpus.comments(), corpus.description(), corpus.transcript());
        if (genuine > 0) {
            indicators.add("Genuine signals: " + genuine);
        }
        int staged = KeywordMatcher.countHitsInAny(signals.staged(), corpus.title(), corpus.description(), corpus.comments());
        if (staged > 0) {
            indicators.add("Staged or exploitative signals: " + staged);
        }
        if (breakdown.gatingPenaltyApplied()) {
            GatingRule gating = profile.gating();
            indicators.add(String.format(Locale.ROOT, "Gating penalty: %s %.2f < %.2f",
                    gating.component(), components.getOrDefault(gating.component(), 0.0), gating.threshold()));
        }
        if (context.video().hasTranscript()) {
            indicators.add("Transcript analyzed");
        }
        if (!context.sentiments().isEmpty()) {
            double positive = SentimentClassifier.ratio(context.sentiments(), Sentiment.POSITIVE);
            indicators.add(String.format(Locale.ROOT, "Positive comments: %.0f%%", positive * 100));
        }
        return indicators.size() > ScoreResult.MAX_KEY_INDICATORS
                ? indicators.subList(0, ScoreResult.MAX_KEY_INDICATORS)
                : indicators;
    }
}
