package com.example.clipscore_backend.controller;

import com.example.clipscore_backend.dto.web.ScoreRequest;
import com.example.clipscore_backend.scoring.ScoreResult;
import com.example.clipscore_backend.service.AnalysisService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Scores caller-supplied video records; nothing is fetched or recorded.
 */
@RestController
@RequestMapping("/v1/scores")
public class ScoreController {

    private final AnalysisService analysisService;

    public ScoreController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping
    public ScoreResult score(@Valid @RequestBody ScoreRequest body) {
        return analysisService.score(body.video(), body.category());
    }
}
