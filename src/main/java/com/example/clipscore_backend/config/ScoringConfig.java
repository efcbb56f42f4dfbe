package com.example.clipscore_backend.config;

import com.example.clipscore_backend.scoring.AuthenticityClassifier;
import com.example.clipscore_backend.scoring.ConfidenceEstimator;
import com.example.clipscore_backend.scoring.ContentScoringEngine;
import com.example.clipscore_backend.scoring.ScoreAggregator;
import com.example.clipscore_backend.scoring.assess.AssessorCatalog;
import com.example.clipscore_backend.scoring.moment.MomentExtractor;
import com.example.clipscore_backend.scoring.moment.TimestampScanner;
import com.example.clipscore_backend.scoring.profile.CategoryProfileRegistry;
import com.example.clipscore_backend.scoring.sentiment.SentimentClassifier;
import com.example.clipscore_backend.scoring.text.TextCorpusBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the scoring core. The registry is validated here, so an inconsistent profile stops start-up.
 */
@Configuration
public class ScoringConfig {

    @Bean
    public AssessorCatalog assessorCatalog() {
        return AssessorCatalog.defaults();
    }

    @Bean
    public CategoryProfileRegistry categoryProfileRegistry(AssessorCatalog assessorCatalog) {
        return CategoryProfileRegistry.defaults(assessorCatalog);
    }

    @Bean
    public SentimentClassifier sentimentClassifier() {
        return new SentimentClassifier();
    }

    @Bean
    public MomentExtractor momentExtractor(SentimentClassifier sentimentClassifier) {
        return new MomentExtractor(new TimestampScanner(), sentimentClassifier);
    }

    @Bean
    public ContentScoringEngine contentScoringEngine(CategoryProfileRegistry registry,
                                                     AssessorCatalog assessorCatalog,
                                                     SentimentClassifier sentimentClassifier,
                                                     MomentExtractor momentExtractor) {
        return new ContentScoringEngine(
                registry,
                assessorCatalog,
                new TextCorpusBuilder(),
                sentimentClassifier,
                momentExtractor,
                new ScoreAggregator(),
                new ConfidenceEstimator(),
                new AuthenticityClassifier()
        );
    }
}
