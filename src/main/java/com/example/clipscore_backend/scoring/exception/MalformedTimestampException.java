package com.example.clipscore_backend.scoring.exception;

/**
 * Raised for a timestamp-like token that does not follow the clock grammar.
 */
public class MalformedTimestampException extends ScoringException {
    private final String candidate;

    public MalformedTimestampException(String candidate, String reason) {
        super("Malformed timestamp '" + candidate + "': " + reason);
        this.candidate = candidate;
    }

    public String getCandidate() {
        return candidate;
    }
}
