package com.example.clipscore_backend.scoring.exception;

/**
 * Base type for failures raised by the scoring core.
 */
public class ScoringException extends RuntimeException {

    public ScoringException(String message) {
        super(message);
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
