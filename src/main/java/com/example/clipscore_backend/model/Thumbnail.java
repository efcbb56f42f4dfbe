package com.example.clipscore_backend.model;

/**
 * Pre-computed thumbnail descriptor. Values are normalized to {@code [0, 1]}.
 *
 * @param available    whether a descriptor exists.
 * @param brightness   mean luminance.
 * @param contrast     luminance spread.
 * @param colorProfile dominant tone information.
 */
public record Thumbnail(boolean available, double brightness, double contrast, ColorProfile colorProfile) {

    public Thumbnail {
        colorProfile = colorProfile == null ? new ColorProfile(0, 0, false) : colorProfile;
    }

    public static Thumbnail unavailable() {
        return new Thumbnail(false, 0, 0, null);
    }
}
