package com.reelmatch.recommender.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MovieDetails(
    @JsonProperty("tmdb_id") long tmdbId,
    String title,
    String overview,
    @JsonProperty("release_date") String releaseDate,
    @JsonProperty("vote_average") double voteAverage,
    @JsonProperty("poster_path") String posterPath,
    @JsonProperty("backdrop_path") String backdropPath,
    List<String> genres,
    Integer runtime,
    String tagline,
    String homepage,
    @JsonProperty("imdb_id") String imdbId
) {}
