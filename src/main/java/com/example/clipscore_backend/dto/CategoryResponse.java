package com.example.clipscore_backend.dto;

import com.example.clipscore_backend.scoring.profile.CategoryProfile;

import java.util.Map;

public record CategoryResponse(String id, String displayName, Map<String, Double> componentWeights, String gatingComponent) {

    public static CategoryResponse of(CategoryProfile profile) {
        return new CategoryResponse(profile.id(), profile.displayName(), profile.componentWeights(), profile.gatingComponent());
    }
}
