package com.example.clipscore_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * YouTube Data API access settings.
 */
@ConfigurationProperties(prefix = "app.youtube")
public class YouTubeProperties {
    private String apiKey;
    private String baseUrl = "https://www.googleapis.com/youtube/v3";
    private int maxComments = 100;
    private boolean fetchChannel = true;
    private int connectTimeoutMs = 5_000;
    private int responseTimeoutMs = 10_000;

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getMaxComments() {
        return maxComments;
    }

    public void setMaxComments(int maxComments) {
        this.maxComments = maxComments;
    }

    public boolean isFetchChannel() {
        return fetchChannel;
    }

    public void setFetchChannel(boolean fetchChannel) {
        this.fetchChannel = fetchChannel;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getResponseTimeoutMs() {
        return responseTimeoutMs;
    }

    public void setResponseTimeoutMs(int responseTimeoutMs) {
        this.responseTimeoutMs = responseTimeoutMs;
    }
}
