package com.example.clipscore_backend.scoring.profile;

import java.util.List;

/**
 * Phrases that suggest genuine content versus staged or exploitative content.
 */
public record AuthenticitySignals(List<String> genuine, List<String> staged) {

    public AuthenticitySignals {
        genuine = List.copyOf(genuine);
        staged = List.copyOf(staged);
    }
}
