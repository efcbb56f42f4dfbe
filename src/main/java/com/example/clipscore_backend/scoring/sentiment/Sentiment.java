package com.example.clipscore_backend.scoring.sentiment;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Sentiment {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    NEUTRAL("neutral");

    private final String id;

    Sentiment(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
