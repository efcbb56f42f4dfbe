package com.example.clipscore_backend.scoring.moment;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuthenticitySignal {
    GENUINE("genuine"),
    QUESTIONABLE("questionable"),
    UNKNOWN("unknown");

    private final String id;

    AuthenticitySignal(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
