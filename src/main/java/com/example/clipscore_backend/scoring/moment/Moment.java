package com.example.clipscore_backend.scoring.moment;

import com.example.clipscore_backend.scoring.sentiment.Sentiment;

/**
 * A timestamp mentioned in a viewer comment, scored for category relevance.
 *
 * @param timestampText     timestamp as written, without an "at" prefix, e.g. {@code 2:15} or {@code 1:02:15}.
 * @param offsetSeconds     position in the video the timestamp points at.
 * @param sourceComment     the original comment text.
 * @param relevanceScore    weighted keyword score of the comment, never negative.
 * @param sentiment         sentiment of the comment.
 * @param categoryIndicators category evidence found in the comment.
 */
public record Moment(String timestampText,
                     long offsetSeconds,
                     String sourceComment,
                     double relevanceScore,
                     Sentiment sentiment,
                     CategoryIndicators categoryIndicators) {
}
