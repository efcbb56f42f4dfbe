package com.example.clipscore_backend.service.video;

/**
 * Failure to retrieve video data from the upstream platform.
 */
public class VideoDataAccessException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        AUTH_ERROR,
        RATE_LIMITED,
        TRANSIENT
    }

    private final Reason reason;

    public VideoDataAccessException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public VideoDataAccessException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
