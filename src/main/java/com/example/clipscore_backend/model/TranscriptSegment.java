package com.example.clipscore_backend.model;

public record TranscriptSegment(double startSeconds, double durationSeconds, String text) {

    public TranscriptSegment {
        text = text == null ? "" : text;
    }
}
