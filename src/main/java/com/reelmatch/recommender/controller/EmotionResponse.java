package com.reelmatch.recommender.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EmotionResponse(
    @JsonProperty("search_type") String searchType,
    String emotion,
    List<String> genres,
    List<MovieResultItem> results
) {}
