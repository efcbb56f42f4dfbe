package com.example.clipscore_backend.controller;

import com.example.clipscore_backend.dto.AnalysisReport;
import com.example.clipscore_backend.dto.AnalysisSummary;
import com.example.clipscore_backend.dto.BatchItemResult;
import com.example.clipscore_backend.dto.ExportedReport;
import com.example.clipscore_backend.dto.web.AnalyzeRequest;
import com.example.clipscore_backend.dto.web.BatchAnalyzeRequest;
import com.example.clipscore_backend.service.AnalysisHistoryService;
import com.example.clipscore_backend.service.AnalysisService;
import com.example.clipscore_backend.service.BatchAnalysisService;
import com.example.clipscore_backend.service.ReportExportService;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for video analyses and their history.
 */
@RestController
@RequestMapping("/v1/analyses")
public class AnalysisController {

    private final AnalysisService analysisService;
    private final BatchAnalysisService batchAnalysisService;
    private final AnalysisHistoryService historyService;
    private final ReportExportService exportService;

    public AnalysisController(AnalysisService analysisService,
                              BatchAnalysisService batchAnalysisService,
                              AnalysisHistoryService historyService,
                              ReportExportService exportService) {
        this.analysisService = analysisService;
        this.batchAnalysisService = batchAnalysisService;
        this.historyService = historyService;
        this.exportService = exportService;
    }

    /**
     * Fetches and scores a single video.
     *
     * @param body URL and category.
     * @return the recorded analysis report.
     */
    @PostMapping
    public AnalysisReport analyze(@Valid @RequestBody AnalyzeRequest body) {
        return analysisService.analyze(body.url(), body.category());
    }

    /**
     * Scores several videos for one category. Individual failures are reported per item.
     */
    @PostMapping("/batch")
    public List<BatchItemResult> analyzeBatch(@Valid @RequestBody BatchAnalyzeRequest body) {
        return batchAnalysisService.analyzeAll(body.urls(), body.category());
    }

    @GetMapping("/history")
    public List<AnalysisSummary> history(@RequestParam(required = false) Integer limit) {
        return historyService.recent(limit).stream().map(AnalysisSummary::of).toList();
    }

    @DeleteMapping("/history")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearHistory() {
        historyService.clear();
    }

    /**
     * Downloads a stored analysis as a JSON file.
     */
    @GetMapping("/{id}/export")
    public ResponseEntity<byte[]> export(@PathVariable UUID id) {
        ExportedReport exported = exportService.export(id);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(exported.filename()).build().toString())
                .body(exported.content());
    }
}
