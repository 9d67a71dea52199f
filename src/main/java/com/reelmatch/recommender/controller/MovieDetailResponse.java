package com.reelmatch.recommender.controller;

import com.reelmatch.recommender.model.MovieDetails;

import java.util.List;

public record MovieDetailResponse(
    MovieDetails movie,
    List<MovieResultItem> recommendations
) {}
