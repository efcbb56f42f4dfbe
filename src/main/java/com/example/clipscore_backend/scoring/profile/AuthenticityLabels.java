package com.example.clipscore_backend.scoring.profile;

/**
 * Label triple used by a category, from the most to the least trustworthy.
 */
public record AuthenticityLabels(AuthenticityLabel high, AuthenticityLabel mid, AuthenticityLabel low) {
}
