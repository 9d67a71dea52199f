package com.reelmatch.recommender.model;

public record RankedResult(
    MovieRecord movie,
    double score
) {
    public RankedResult {
        if (movie == null) {
            throw new IllegalArgumentException("Ranked movie cannot be null");
        }
        if (score < 0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("Invalid ranking score: " + score);
        }
    }
}
