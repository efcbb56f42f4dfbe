package com.example.clipscore_backend.scoring.profile;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discrete authenticity classifications. Each category uses three of them.
 */
public enum AuthenticityLabel {
    AUTHENTIC("authentic"),
    RESPONSIBLE("responsible"),
    QUESTIONABLE("questionable"),
    LIKELY_STAGED("likely_staged"),
    LIKELY_FAKE("likely_fake"),
    EXPLOITATIVE("exploitative");

    private final String id;

    AuthenticityLabel(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
