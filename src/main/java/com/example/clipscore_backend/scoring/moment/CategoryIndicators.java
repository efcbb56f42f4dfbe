package com.example.clipscore_backend.scoring.moment;

import java.util.List;

/**
 * Category evidence found in the comment a moment was taken from.
 *
 * @param matchedContentTypes content-type names with at least one keyword hit, in profile order.
 * @param matchedEmotionWords up to three matched emotion keywords, strongest tier first.
 * @param authenticitySignal  genuine wins over questionable when both kinds of phrase occur.
 */
public record CategoryIndicators(List<String> matchedContentTypes,
                                 List<String> matchedEmotionWords,
                                 AuthenticitySignal authenticitySignal) {

    public CategoryIndicators {
        matchedContentTypes = List.copyOf(matchedContentTypes);
        matchedEmotionWords = List.copyOf(matchedEmotionWords);
    }
}
