package com.example.clipscore_backend.service;

import com.example.clipscore_backend.config.AnalysisProperties;
import com.example.clipscore_backend.dto.BatchItemResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Analyzes several URLs for one category. Items run independently on the analysis executor; a failing
 * item is reported in place and does not affect the others, including items the saturated executor
 * refuses ({@code ANALYSIS_REJECTED}). Results keep request order.
 */
@Service
public class BatchAnalysisService {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchAnalysisService.class);
    static final String REJECTED = "ANALYSIS_REJECTED";

    private final AnalysisService analysisService;
    private final Executor executor;
    private final int maxItems;

    public BatchAnalysisService(AnalysisService analysisService,
                                @Qualifier("analysisTaskExecutor") Executor executor,
                                AnalysisProperties properties) {
        this.analysisService = analysisService;
        this.executor = executor;
        this.maxItems = Math.max(1, properties.getBatchMaxItems());
    }

    public List<BatchItemResult> analyzeAll(List<String> urls, String category) {
        if (urls.size() > maxItems) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "BATCH_TOO_LARGE");
        }
        analysisService.requireCategory(category);

        List<CompletableFuture<BatchItemResult>> futures = new ArrayList<>(urls.size());
        for (String url : urls) {
            futures.add(submit(url, category));
        }
        List<BatchItemResult> results = futures.stream().map(CompletableFuture::join).toList();
        long failed = results.stream().filter(r -> r.status() == BatchItemResult.Status.FAILED).count();
        LOGGER.info("batch done category={} items={} failed={}", category, results.size(), failed);
        return results;
    }

    private CompletableFuture<BatchItemResult> submit(String url, String category) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> BatchItemResult.ok(url, analysisService.analyze(url, category)), executor)
                    .exceptionally(ex -> BatchItemResult.failed(url, reasonOf(ex)));
        } catch (RejectedExecutionException ex) {
            LOGGER.warn("batch item rejected url={} reason={}", url, ex.getMessage());
            return CompletableFuture.completedFuture(BatchItemResult.failed(url, REJECTED));
        }
    }

    private static String reasonOf(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof ResponseStatusException rse && rse.getReason() != null) {
            return rse.getReason();
        }
        LOGGER.warn("batch item failed unexpectedly", cause);
        return "ANALYSIS_FAILED";
    }
}
