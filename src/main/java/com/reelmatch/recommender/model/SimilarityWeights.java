package com.reelmatch.recommender.model;

/**
 * Relative importance of the three similarity components. Weights need not sum to 1.
 */
public record SimilarityWeights(
    double genre,
    double rating,
    double content
) {
    public static final SimilarityWeights DEFAULT = new SimilarityWeights(0.4, 0.2, 0.4);

    public SimilarityWeights {
        requireValid("genre", genre);
        requireValid("rating", rating);
        requireValid("content", content);
    }

    private static void requireValid(String name, double weight) {
        if (weight < 0 || !Double.isFinite(weight)) {
            throw new IllegalArgumentException("Invalid " + name + " weight: " + weight);
        }
    }
}
