package com.example.clipscore_backend.scoring.exception;

/**
 * Raised when a category identifier does not resolve to a known profile.
 */
public class InvalidCategoryException extends ScoringException {
    private final String categoryId;

    public InvalidCategoryException(String categoryId) {
        super("Unknown category: " + categoryId);
        this.categoryId = categoryId;
    }

    public String getCategoryId() {
        return categoryId;
    }
}
