package com.example.clipscore_backend.model;

import java.time.Instant;
import java.util.List;

/**
 * Everything the scoring engine knows about one video.
 *
 * @param videoId         platform identifier, {@code null} for caller-supplied records.
 * @param title           video title.
 * @param description     video description, may be empty.
 * @param tags            creator supplied tags.
 * @param viewCount       number of views.
 * @param likeCount       number of likes.
 * @param commentCount    number of comments reported by the platform.
 * @param durationSeconds duration of the video in seconds.
 * @param publishedAt     publication instant, may be {@code null}.
 * @param channelTitle    name of the publishing channel.
 * @param comments        comment texts in retrieval order (not guaranteed chronological).
 * @param transcript      optional transcript.
 * @param thumbnail       optional thumbnail descriptor.
 * @param channelInfo     optional channel statistics.
 */
public record VideoRecord(String videoId,
                          String title,
                          String description,
                          List<String> tags,
                          long viewCount,
                          long likeCount,
                          long commentCount,
                          long durationSeconds,
                          Instant publishedAt,
                          String channelTitle,
                          List<String> comments,
                          Transcript transcript,
                          Thumbnail thumbnail,
                          ChannelInfo channelInfo) {

    public VideoRecord {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        channelTitle = channelTitle == null ? "" : channelTitle;
        tags = tags == null ? List.of() : List.copyOf(tags);
        comments = comments == null ? List.of() : comments.stream().map(c -> c == null ? "" : c).toList();
        viewCount = Math.max(0, viewCount);
        likeCount = Math.max(0, likeCount);
        commentCount = Math.max(0, commentCount);
        durationSeconds = Math.max(0, durationSeconds);
    }

    public boolean hasTranscript() {
        return transcript != null && transcript.available();
    }

    public boolean hasThumbnail() {
        return thumbnail != null && thumbnail.available();
    }

    public boolean hasChannelInfo() {
        return channelInfo != null;
    }

    public VideoRecord withComments(List<String> newComments) {
        return new VideoRecord(videoId, title, description, tags, viewCount, likeCount, commentCount, durationSeconds,
                publishedAt, channelTitle, newComments, transcript, thumbnail, channelInfo);
    }

    public VideoRecord withTranscript(Transcript newTranscript) {
        return new VideoRecord(videoId, title, description, tags, viewCount, likeCount, commentCount, durationSeconds,
                publishedAt, channelTitle, comments, newTranscript, thumbnail, channelInfo);
    }

    public VideoRecord withThumbnail(Thumbnail newThumbnail) {
        return new VideoRecord(videoId, title, description, tags, viewCount, likeCount, commentCount, durationSeconds,
                publishedAt, channelTitle, comments, transcript, newThumbnail, channelInfo);
    }

    public VideoRecord withChannelInfo(ChannelInfo newChannelInfo) {
        return new VideoRecord(videoId, title, description, tags, viewCount, likeCount, commentCount, durationSeconds,
                publishedAt, channelTitle, comments, transcript, thumbnail, newChannelInfo);
    }

    public VideoRecord withViewCount(long newViewCount) {
        return new VideoRecord(videoId, title, description, tags, newViewCount, likeCount, commentCount, durationSeconds,
                publishedAt, channelTitle, comments, transcript, thumbnail, channelInfo);
    }
}
