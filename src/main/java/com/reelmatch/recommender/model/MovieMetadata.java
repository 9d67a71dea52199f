package com.reelmatch.recommender.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Display-only data from the metadata provider. Ranking never reads it.
 */
public record MovieMetadata(
    @JsonProperty("tmdb_id") long tmdbId,
    String title,
    @JsonProperty("poster_path") String posterPath,
    @JsonProperty("release_date") String releaseDate
) {}
