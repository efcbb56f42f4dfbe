package com.example.clipscore_backend.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Transcript attached to a video.
 *
 * @param available whether the transcript could be obtained.
 * @param text      full transcript text, may be blank when only segments are known.
 * @param segments  timed segments in playback order.
 */
public record Transcript(boolean available, String text, List<TranscriptSegment> segments) {

    public Transcript {
        text = text == null ? "" : text;
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public static Transcript unavailable() {
        return new Transcript(false, "", List.of());
    }

    public static Transcript of(String text) {
        return new Transcript(true, text, List.of());
    }

    /**
     * Returns the transcript text, falling back to the joined segment texts.
     *
     * @return text to search, never {@code null}.
     */
    public String fullText() {
        if (!text.isBlank() || segments.isEmpty()) {
            return text;
        }
        return segments.stream().map(TranscriptSegment::text).collect(Collectors.joining(" "));
    }
}
