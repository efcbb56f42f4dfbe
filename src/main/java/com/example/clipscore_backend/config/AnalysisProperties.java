package com.example.clipscore_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limits for analysis history and batch execution.
 */
@ConfigurationProperties(prefix = "app.analysis")
public class AnalysisProperties {
    private int historyCapacity = 100;
    private int historyDefaultLimit = 5;
    private int batchMaxItems = 20;
    private int executorThreads = 4;
    private int executorQueueCapacity = 50;

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public int getHistoryDefaultLimit() {
        return historyDefaultLimit;
    }

    public void setHistoryDefaultLimit(int historyDefaultLimit) {
        this.historyDefaultLimit = historyDefaultLimit;
    }

    public int getBatchMaxItems() {
        return batchMaxItems;
    }

    public void setBatchMaxItems(int batchMaxItems) {
        this.batchMaxItems = batchMaxItems;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }
}
