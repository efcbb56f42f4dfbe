package com.example.clipscore_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record BatchAnalyzeRequest(
        @NotEmpty List<@NotBlank String> urls,
        @NotBlank String category
) {
}
