package com.reelmatch.recommender.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RecommendationResponse(
    @JsonProperty("search_type") String searchType,
    @JsonProperty("base_movie") String baseMovie,
    @JsonProperty("base_movie_id") Long baseMovieId,
    List<MovieResultItem> results
) {}
