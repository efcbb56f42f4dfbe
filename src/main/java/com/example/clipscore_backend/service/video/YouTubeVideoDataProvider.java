package com.example.clipscore_backend.service.video;

import com.example.clipscore_backend.config.YouTubeProperties;
import com.example.clipscore_backend.model.ChannelInfo;
import com.example.clipscore_backend.model.Thumbnail;
import com.example.clipscore_backend.model.Transcript;
import com.example.clipscore_backend.model.VideoRecord;
import com.example.clipscore_backend.util.VideoUrlParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads video details, top-level comments and channel statistics from the YouTube Data API v3.
 * Comments and channel details are best effort; only the video lookup itself can fail the fetch.
 */
@Component
public class YouTubeVideoDataProvider implements VideoDataProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(YouTubeVideoDataProvider.class);
    private static final int MAX_PAGE_SIZE = 100;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final YouTubeProperties properties;

    public YouTubeVideoDataProvider(@Qualifier("youtubeWebClient") WebClient webClient,
                                    ObjectMapper objectMapper,
                                    YouTubeProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public VideoRecord fetch(String videoId) {
        if (!properties.hasApiKey()) {
            throw new VideoDataAccessException(VideoDataAccessException.Reason.AUTH_ERROR, "YouTube API key is not configured");
        }
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("part", "snippet,statistics,contentDetails");
        params.add("id", videoId);
        JsonNode items = getJson("/videos", params).path("items");
        if (!items.isArray() || items.isEmpty()) {
            throw new VideoDataAccessException(VideoDataAccessException.Reason.NOT_FOUND, "Video not found: " + videoId);
        }
        JsonNode video = items.get(0);
        JsonNode snippet = video.path("snippet");
        JsonNode stats = video.path("statistics");

        List<String> tags = new ArrayList<>();
        snippet.path("tags").forEach(tag -> tags.add(tag.asText()));
        List<String> comments = fetchComments(videoId);
        ChannelInfo channel = properties.isFetchChannel() ? fetchChannel(snippet.path("channelId").asText(null)) : null;

        VideoRecord record = new VideoRecord(
                videoId,
                snippet.path("title").asText(""),
                snippet.path("description").asText(""),
                tags,
                stats.path("viewCount").asLong(0),
                stats.path("likeCount").asLong(0),
                stats.path("commentCount").asLong(0),
                VideoUrlParser.parseIsoDurationSeconds(video.path("contentDetails").path("duration").asText(null)),
                parseInstant(snippet.path("publishedAt").asText(null)),
                snippet.path("channelTitle").asText(""),
                comments,
                Transcript.unavailable(),
                Thumbnail.unavailable(),
                channel
        );
        LOGGER.info("YouTube fetch video={} comments={} channel={}", videoId, comments.size(), channel != null);
        return record;
    }

    private List<String> fetchComments(String videoId) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("part", "snippet");
        params.add("videoId", videoId);
        params.add("maxResults", String.valueOf(Math.max(1, Math.min(MAX_PAGE_SIZE, properties.getMaxComments()))));
        params.add("order", "relevance");
        params.add("textFormat", "plainText");
        try {
            List<String> comments = new ArrayList<>();
            for (JsonNode item : getJson("/commentThreads", params).path("items")) {
                JsonNode comment = item.path("snippet").path("topLevelComment").path("snippet");
                String text = comment.hasNonNull("textOriginal")
                        ? comment.get("textOriginal").asText()
                        : comment.path("textDisplay").asText("");
                comments.add(HtmlUtils.htmlUnescape(text));
            }
            return comments;
        } catch (VideoDataAccessException ex) {
            LOGGER.warn("YouTube comments unavailable video={} reason={} message={}", videoId, ex.getReason(), ex.getMessage());
            return List.of();
        }
    }

    private ChannelInfo fetchChannel(String channelId) {
        if (channelId == null || channelId.isBlank()) {
            return null;
        }
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("part", "snippet,statistics");
        params.add("id", channelId);
        try {
            JsonNode items = getJson("/channels", params).path("items");
            if (!items.isArray() || items.isEmpty()) {
                return null;
            }
            JsonNode channel = items.get(0);
            return new ChannelInfo(
                    channel.path("statistics").path("subscriberCount").asLong(0),
                    channel.path("statistics").path("videoCount").asLong(0),
                    channel.path("snippet").path("description").asText("")
            );
        } catch (VideoDataAccessException ex) {
            LOGGER.warn("YouTube channel unavailable channel={} reason={} message={}", channelId, ex.getReason(), ex.getMessage());
            return null;
        }
    }

    private JsonNode getJson(String path, MultiValueMap<String, String> params) {
        try {
            String payload = webClient.get()
                    .uri(builder -> builder.path(path)
                            .queryParams(params)
                            .queryParam("key", properties.getApiKey())
                            .build())
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            if (payload == null || payload.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(payload);
        } catch (WebClientResponseException ex) {
            throw translate(path, ex);
        } catch (WebClientRequestException | IOException ex) {
            throw new VideoDataAccessException(VideoDataAccessException.Reason.TRANSIENT, "YouTube request failed: " + path, ex);
        }
    }

    static VideoDataAccessException translate(String path, WebClientResponseException ex) {
        int status = ex.getStatusCode().value();
        String body = ex.getResponseBodyAsString();
        VideoDataAccessException.Reason reason;
        if (status == 429 || (status == 403 && (body.contains("quotaExceeded") || body.contains("rateLimitExceeded")))) {
            reason = VideoDataAccessException.Reason.RATE_LIMITED;
        } else if (status == 401 || status == 403) {
            reason = VideoDataAccessException.Reason.AUTH_ERROR;
        } else if (status == 404) {
            reason = VideoDataAccessException.Reason.NOT_FOUND;
        } else {
            reason = VideoDataAccessException.Reason.TRANSIENT;
        }
        return new VideoDataAccessException(reason, "YouTube " + path + " returned " + status, ex);
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            LOGGER.debug("publishedAt not parseable value={}", value);
            return null;
        }
    }
}
