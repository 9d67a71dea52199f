package com.reelmatch.recommender.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CatalogStatistics(
    @JsonProperty("n_movies") int movieCount,
    @JsonProperty("n_genres") int distinctGenreCombinations,
    @JsonProperty("avg_rating") double averageRating,
    @JsonProperty("avg_popularity") double averagePopularity
) {}
