package com.example.clipscore_backend.dto.web;

import com.example.clipscore_backend.model.VideoRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Direct scoring of a caller-supplied record, optionally carrying transcript and thumbnail descriptors.
 */
public record ScoreRequest(
        @NotBlank String category,
        @NotNull @Valid VideoRecord video
) {
}
