package com.example.clipscore_backend.scoring.exception;

/**
 * Raised while building the profile registry when a profile is inconsistent. Never raised per request.
 */
public class ProfileConfigurationException extends ScoringException {

    public ProfileConfigurationException(String message) {
        super(message);
    }
}
