package com.example.clipscore_backend.dto;

import com.example.clipscore_backend.scoring.ScoreResult;
import com.example.clipscore_backend.util.ScoreVerdict;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored outcome of analyzing one fetched video.
 */
public record AnalysisReport(
        UUID id,
        String videoId,
        String title,
        String channelTitle,
        String duration,
        long viewCount,
        long likeCount,
        long commentCount,
        String category,
        ScoreVerdict verdict,
        ScoreResult result,
        Instant analyzedAt
) {
}
