package com.example.clipscore_backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one URL in a batch; exactly one of {@code report} or {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchItemResult(String url, Status status, AnalysisReport report, String error) {

    public enum Status {
        OK,
        FAILED
    }

    public static BatchItemResult ok(String url, AnalysisReport report) {
        return new BatchItemResult(url, Status.OK, report, null);
    }

    public static BatchItemResult failed(String url, String error) {
        return new BatchItemResult(url, Status.FAILED, null, error);
    }
}
