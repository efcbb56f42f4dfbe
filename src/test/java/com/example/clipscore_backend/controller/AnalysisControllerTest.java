package com.example.clipscore_backend.controller;

import com.example.clipscore_backend.dto.AnalysisReport;
import com.example.clipscore_backend.dto.BatchItemResult;
import com.example.clipscore_backend.dto.ExportedReport;
import com.example.clipscore_backend.service.AnalysisHistoryService;
import com.example.clipscore_backend.service.AnalysisService;
import com.example.clipscore_backend.service.BatchAnalysisService;
import com.example.clipscore_backend.service.ReportExportService;
import com.example.clipscore_backend.service.ReportFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AnalysisController.class)
@AutoConfigureMockMvc(addFilters = false)
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private AnalysisService analysisService;
    @MockitoBean
    private BatchAnalysisService batchAnalysisService;
    @MockitoBean
    private AnalysisHistoryService historyService;
    @MockitoBean
    private ReportExportService exportService;

    @Test
    void analyzeReturnsReport() throws Exception {
        AnalysisReport report = ReportFixtures.report("dQw4w9WgXcQ", 7.4);
        when(analysisService.analyze("https://youtu.be/dQw4w9WgXcQ", "heartwarming")).thenReturn(report);

        String body = objectMapper.writeValueAsString(Map.of("url", "https://youtu.be/dQw4w9WgXcQ", "category", "heartwarming"));

        mockMvc.perform(post("/v1/analyses").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.videoId").value("dQw4w9WgXcQ"))
                .andExpect(jsonPath("$.verdict").value("GOOD"))
                .andExpect(jsonPath("$.result.finalScore").value(7.4))
                .andExpect(jsonPath("$.result.authenticityLabel").value("authentic"))
                .andExpect(jsonPath("$.result.moments[0].timestampText").value("2:15"))
                .andExpect(jsonPath("$.analyzedAt").value("2024-06-01T08:00:00Z"));
    }

    @Test
    void analyzeRejectsBlankUrl() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of("url", " ", "category", "heartwarming"));

        mockMvc.perform(post("/v1/analyses").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(analysisService);
    }

    @Test
    void analyzeSurfacesServiceReason() throws Exception {
        when(analysisService.analyze(any(), any()))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "VIDEO_NOT_FOUND"));

        String body = objectMapper.writeValueAsString(Map.of("url", "dQw4w9WgXcQ", "category", "traumatic"));

        mockMvc.perform(post("/v1/analyses").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isNotFound())
                .andExpect(status().reason("VIDEO_NOT_FOUND"));
    }

    @Test
    void batchReturnsPerItemResults() throws Exception {
        AnalysisReport report = ReportFixtures.report("aaaaaaaaaaa", 6.0);
        when(batchAnalysisService.analyzeAll(List.of("u1", "u2"), "motivational")).thenReturn(List.of(
                BatchItemResult.ok("u1", report),
                BatchItemResult.failed("u2", "URL_INVALID")));

        String body = objectMapper.writeValueAsString(Map.of("urls", List.of("u1", "u2"), "category", "motivational"));

        mockMvc.perform(post("/v1/analyses/batch").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("OK"))
                .andExpect(jsonPath("$[0].report.videoId").value("aaaaaaaaaaa"))
                .andExpect(jsonPath("$[1].status").value("FAILED"))
                .andExpect(jsonPath("$[1].error").value("URL_INVALID"))
                .andExpect(jsonPath("$[1].report").doesNotExist());
    }

    @Test
    void batchRequiresUrls() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of("urls", List.of(), "category", "motivational"));

        mockMvc.perform(post("/v1/analyses/batch").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(batchAnalysisService);
    }

    @Test
    void historyListsSummariesAndCanBeCleared() throws Exception {
        AnalysisReport newest = ReportFixtures.report("bbbbbbbbbbb", 9.0);
        AnalysisReport older = ReportFixtures.report("aaaaaaaaaaa", 4.0);
        when(historyService.recent(null)).thenReturn(List.of(newest, older));
        when(historyService.recent(1)).thenReturn(List.of(newest));

        mockMvc.perform(get("/v1/analyses/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].videoId").value("bbbbbbbbbbb"))
                .andExpect(jsonPath("$[0].verdict").value("EXCELLENT"))
                .andExpect(jsonPath("$[1].finalScore").value(4.0));
        mockMvc.perform(get("/v1/analyses/history").param("limit", "1"))
                .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(delete("/v1/analyses/history"))
                .andExpect(status().isNoContent());
        verify(historyService).clear();
    }

    @Test
    void exportDownloadsJsonAttachment() throws Exception {
        UUID id = UUID.randomUUID();
        byte[] json = "{\"videoId\":\"dQw4w9WgXcQ\"}".getBytes(StandardCharsets.UTF_8);
        when(exportService.export(id)).thenReturn(new ExportedReport("analysis-dQw4w9WgXcQ-heartwarming.json", json));

        mockMvc.perform(get("/v1/analyses/{id}/export", id))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"analysis-dQw4w9WgXcQ-heartwarming.json\""))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.videoId").value("dQw4w9WgXcQ"));
    }

    @Test
    void exportOfUnknownIdIsNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(exportService.export(id)).thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "ANALYSIS_NOT_FOUND"));

        mockMvc.perform(get("/v1/analyses/{id}/export", id))
                .andExpect(status().isNotFound())
                .andExpect(status().reason("ANALYSIS_NOT_FOUND"));
    }
}
