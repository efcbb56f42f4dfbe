package com.example.clipscore_backend.service.video;

import com.example.clipscore_backend.config.YouTubeProperties;
import com.example.clipscore_backend.model.VideoRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YouTubeVideoDataProviderTest {

    private static final String VIDEO_JSON = """
            {"items":[{"id":"dQw4w9WgXcQ",
              "snippet":{"title":"Dad comes home","description":"Surprise homecoming","tags":["reunion","family"],
                         "publishedAt":"2024-03-01T12:00:00Z","channelId":"UC123","channelTitle":"Homecomings"},
              "statistics":{"viewCount":"120000","likeCount":"5400","commentCount":"310"},
              "contentDetails":{"duration":"PT4M13S"}}]}
            """;
    private static final String COMMENTS_JSON = """
            {"items":[
              {"snippet":{"topLevelComment":{"snippet":{"textOriginal":"at 1:05 I lost it","textDisplay":"ignored"}}}},
              {"snippet":{"topLevelComment":{"snippet":{"textDisplay":"Tom &amp; Jerry level cute"}}}}
            ]}
            """;
    private static final String CHANNEL_JSON = """
            {"items":[{"snippet":{"description":"Real stories"},"statistics":{"subscriberCount":"250000","videoCount":"120"}}]}
            """;

    private final List<URI> requests = new ArrayList<>();

    @Test
    void fetchCombinesVideoCommentsAndChannel() {
        YouTubeVideoDataProvider provider = provider(Map.of(
                "/videos", ok(VIDEO_JSON),
                "/commentThreads", ok(COMMENTS_JSON),
                "/channels", ok(CHANNEL_JSON)));

        VideoRecord video = provider.fetch("dQw4w9WgXcQ");

        assertThat(video.title()).isEqualTo("Dad comes home");
        assertThat(video.tags()).containsExactly("reunion", "family");
        assertThat(video.viewCount()).isEqualTo(120_000);
        assertThat(video.likeCount()).isEqualTo(5_400);
        assertThat(video.commentCount()).isEqualTo(310);
        assertThat(video.durationSeconds()).isEqualTo(253);
        assertThat(video.publishedAt()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
        assertThat(video.comments()).containsExactly("at 1:05 I lost it", "Tom & Jerry level cute");
        assertThat(video.channelInfo().subscriberCount()).isEqualTo(250_000);
        assertThat(video.hasTranscript()).isFalse();
        assertThat(video.hasThumbnail()).isFalse();

        assertThat(requests).hasSize(3);
        assertThat(requests.get(0).getQuery()).contains("part=snippet,statistics,contentDetails", "id=dQw4w9WgXcQ", "key=test-key");
        assertThat(requests.get(1).getQuery()).contains("maxResults=100", "order=relevance");
    }

    @Test
    void emptyItemsMeanVideoNotFound() {
        YouTubeVideoDataProvider provider = provider(Map.of("/videos", ok("{\"items\":[]}")));

        assertThatThrownBy(() -> provider.fetch("missing0000"))
                .isInstanceOf(VideoDataAccessException.class)
                .extracting(ex -> ((VideoDataAccessException) ex).getReason())
                .isEqualTo(VideoDataAccessException.Reason.NOT_FOUND);
    }

    @Test
    void quotaErrorsAreReportedAsRateLimited() {
        YouTubeVideoDataProvider provider = provider(Map.of("/videos",
                status(HttpStatus.FORBIDDEN, "{\"error\":{\"errors\":[{\"reason\":\"quotaExceeded\"}]}}")));

        assertThatThrownBy(() -> provider.fetch("dQw4w9WgXcQ"))
                .isInstanceOf(VideoDataAccessException.class)
                .extracting(ex -> ((VideoDataAccessException) ex).getReason())
                .isEqualTo(VideoDataAccessException.Reason.RATE_LIMITED);
    }

    @Test
    void forbiddenWithoutQuotaReasonIsAuthError() {
        YouTubeVideoDataProvider provider = provider(Map.of("/videos",
                status(HttpStatus.FORBIDDEN, "{\"error\":{\"errors\":[{\"reason\":\"forbidden\"}]}}")));

        assertThatThrownBy(() -> provider.fetch("dQw4w9WgXcQ"))
                .extracting(ex -> ((VideoDataAccessException) ex).getReason())
                .isEqualTo(VideoDataAccessException.Reason.AUTH_ERROR);
    }

    @Test
    void disabledCommentsAndMissingChannelDoNotFailFetch() {
        YouTubeVideoDataProvider provider = provider(Map.of(
                "/videos", ok(VIDEO_JSON),
                "/commentThreads", status(HttpStatus.FORBIDDEN, "{\"error\":{\"errors\":[{\"reason\":\"commentsDisabled\"}]}}"),
                "/channels", status(HttpStatus.INTERNAL_SERVER_ERROR, "{}")));

        VideoRecord video = provider.fetch("dQw4w9WgXcQ");

        assertThat(video.comments()).isEmpty();
        assertThat(video.hasChannelInfo()).isFalse();
    }

    @Test
    void missingApiKeyFailsWithoutCallingUpstream() {
        YouTubeProperties properties = new YouTubeProperties();
        YouTubeVideoDataProvider provider = new YouTubeVideoDataProvider(client(Map.of()), new ObjectMapper(), properties);

        assertThatThrownBy(() -> provider.fetch("dQw4w9WgXcQ"))
                .extracting(ex -> ((VideoDataAccessException) ex).getReason())
                .isEqualTo(VideoDataAccessException.Reason.AUTH_ERROR);
        assertThat(requests).isEmpty();
    }

    @Test
    void connectionFailureIsTransient() {
        ExchangeFunction refused = request -> Mono.error(new WebClientRequestException(
                new ConnectException("refused"), request.method(), request.url(), request.headers()));
        WebClient client = WebClient.builder().baseUrl("https://yt.test/youtube/v3").exchangeFunction(refused).build();
        YouTubeVideoDataProvider provider = new YouTubeVideoDataProvider(client, new ObjectMapper(), properties());

        assertThatThrownBy(() -> provider.fetch("dQw4w9WgXcQ"))
                .extracting(ex -> ((VideoDataAccessException) ex).getReason())
                .isEqualTo(VideoDataAccessException.Reason.TRANSIENT);
    }

    private YouTubeVideoDataProvider provider(Map<String, ClientResponse> routes) {
        return new YouTubeVideoDataProvider(client(routes), new ObjectMapper(), properties());
    }

    private WebClient client(Map<String, ClientResponse> routes) {
        ExchangeFunction exchangeFunction = request -> {
            requests.add(request.url());
            String path = request.url().getPath().replace("/youtube/v3", "");
            ClientResponse response = routes.get(path);
            return Mono.just(response != null ? response : status(HttpStatus.NOT_FOUND, "{}"));
        };
        return WebClient.builder()
                .baseUrl("https://yt.test/youtube/v3")
                .exchangeFunction(exchangeFunction)
                .build();
    }

    private static YouTubeProperties properties() {
        YouTubeProperties properties = new YouTubeProperties();
        properties.setApiKey("test-key");
        return properties;
    }

    private static ClientResponse ok(String body) {
        return status(HttpStatus.OK, body);
    }

    private static ClientResponse status(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
