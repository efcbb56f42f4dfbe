package com.example.clipscore_backend.dto;

import com.example.clipscore_backend.util.ScoreVerdict;

import java.time.Instant;
import java.util.UUID;

public record AnalysisSummary(
        UUID id,
        String videoId,
        String title,
        String category,
        double finalScore,
        ScoreVerdict verdict,
        Instant analyzedAt
) {
    public static AnalysisSummary of(AnalysisReport report) {
        return new AnalysisSummary(report.id(), report.videoId(), report.title(), report.category(),
                report.result().finalScore(), report.verdict(), report.analyzedAt());
    }
}
