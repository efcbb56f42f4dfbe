package com.example.clipscore_backend.service;

import com.example.clipscore_backend.dto.AnalysisReport;
import com.example.clipscore_backend.dto.ExportedReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * Serializes a stored analysis to a downloadable JSON document.
 */
@Service
public class ReportExportService {

    private final AnalysisHistoryService history;
    private final ObjectMapper objectMapper;

    public ReportExportService(AnalysisHistoryService history, ObjectMapper objectMapper) {
        this.history = history;
        this.objectMapper = objectMapper;
    }

    public ExportedReport export(UUID id) {
        AnalysisReport report = history.find(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "ANALYSIS_NOT_FOUND"));
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
            return new ExportedReport(filename(report), content);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize analysis " + id, ex);
        }
    }

    static String filename(AnalysisReport report) {
        return "analysis-" + report.videoId() + "-" + report.category() + ".json";
    }
}
