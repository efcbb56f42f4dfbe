package com.example.clipscore_backend.scoring.sentiment;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SentimentClassifierTest {

    private final SentimentClassifier classifier = new SentimentClassifier();

    @Test
    void strongWordsOutweighOrdinaryOnes() {
        assertThat(classifier.classify("I LOVE this, amazing")).isEqualTo(Sentiment.POSITIVE);
        assertThat(classifier.classify("worst video, nice thumbnail though")).isEqualTo(Sentiment.NEGATIVE);
        assertThat(classifier.classify("so fake and staged")).isEqualTo(Sentiment.NEGATIVE);
    }

    @Test
    void tiesAndEmptyTextAreNeutral() {
        assertThat(classifier.classify("good but bad")).isEqualTo(Sentiment.NEUTRAL);
        assertThat(classifier.classify("")).isEqualTo(Sentiment.NEUTRAL);
        assertThat(classifier.classify(null)).isEqualTo(Sentiment.NEUTRAL);
    }

    @Test
    void ratioCountsTargetShare() {
        List<Sentiment> sentiments = classifier.classifyAll(List.of("great", "awful", "meh", "happy"));

        assertThat(sentiments).containsExactly(Sentiment.POSITIVE, Sentiment.NEGATIVE, Sentiment.NEUTRAL, Sentiment.POSITIVE);
        assertThat(SentimentClassifier.ratio(sentiments, Sentiment.POSITIVE)).isEqualTo(0.5);
        assertThat(SentimentClassifier.ratio(List.of(), Sentiment.POSITIVE)).isZero();
    }
}
