package com.example.clipscore_backend.service;

import com.example.clipscore_backend.dto.AnalysisReport;
import com.example.clipscore_backend.model.VideoRecord;
import com.example.clipscore_backend.scoring.ContentScoringEngine;
import com.example.clipscore_backend.scoring.ScoreResult;
import com.example.clipscore_backend.scoring.exception.InvalidCategoryException;
import com.example.clipscore_backend.scoring.profile.CategoryProfileRegistry;
import com.example.clipscore_backend.service.video.VideoDataAccessException;
import com.example.clipscore_backend.service.video.VideoDataProvider;
import com.example.clipscore_backend.util.ScoreVerdict;
import com.example.clipscore_backend.util.VideoUrlParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Fetches a video, scores it and records the report. Failures surface as {@link ResponseStatusException}
 * with a machine-readable reason.
 */
@Service
public class AnalysisService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisService.class);

    private final VideoDataProvider videoDataProvider;
    private final ContentScoringEngine scoringEngine;
    private final CategoryProfileRegistry registry;
    private final AnalysisHistoryService history;
    private final Clock clock;

    public AnalysisService(VideoDataProvider videoDataProvider,
                           ContentScoringEngine scoringEngine,
                           CategoryProfileRegistry registry,
                           AnalysisHistoryService history,
                           Clock clock) {
        this.videoDataProvider = videoDataProvider;
        this.scoringEngine = scoringEngine;
        this.registry = registry;
        this.history = history;
        this.clock = clock;
    }

    /**
     * Analyzes the video behind {@code url} for {@code category}. The category is checked before any
     * network call.
     *
     * @param url      watch, short-link, embed or shorts URL, or a bare video id.
     * @param category category identifier.
     * @return the recorded report.
     */
    public AnalysisReport analyze(String url, String category) {
        requireCategory(category);
        String videoId = VideoUrlParser.extractVideoId(url)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "URL_INVALID"));

        VideoRecord video = fetch(videoId);
        ScoreResult result = score(video, category);
        AnalysisReport report = new AnalysisReport(
                UUID.randomUUID(),
                videoId,
                video.title(),
                video.channelTitle(),
                VideoUrlParser.formatDuration(video.durationSeconds()),
                video.viewCount(),
                video.likeCount(),
                video.commentCount(),
                result.category(),
                ScoreVerdict.fromScore(result.finalScore()),
                result,
                Instant.now(clock)
        );
        history.record(report);
        LOGGER.info("analysis done id={} video={} category={} score={} verdict={}",
                report.id(), videoId, result.category(),
                String.format(Locale.ROOT, "%.2f", result.finalScore()), report.verdict());
        return report;
    }

    /**
     * Scores a caller-supplied record without fetching or recording anything.
     */
    public ScoreResult score(VideoRecord video, String category) {
        try {
            return scoringEngine.score(video, category);
        } catch (InvalidCategoryException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_CATEGORY", ex);
        }
    }

    void requireCategory(String category) {
        if (!registry.contains(category)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_CATEGORY");
        }
    }

    private VideoRecord fetch(String videoId) {
        try {
            return videoDataProvider.fetch(videoId);
        } catch (VideoDataAccessException ex) {
            LOGGER.warn("video fetch failed video={} reason={} message={}", videoId, ex.getReason(), ex.getMessage());
            throw switch (ex.getReason()) {
                case NOT_FOUND -> new ResponseStatusException(HttpStatus.NOT_FOUND, "VIDEO_NOT_FOUND", ex);
                case AUTH_ERROR -> new ResponseStatusException(HttpStatus.BAD_GATEWAY, "YOUTUBE_AUTH_FAILED", ex);
                case RATE_LIMITED -> new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "YOUTUBE_QUOTA_EXCEEDED", ex);
                case TRANSIENT -> new ResponseStatusException(HttpStatus.BAD_GATEWAY, "YOUTUBE_FETCH_FAILED", ex);
            };
        }
    }
}
