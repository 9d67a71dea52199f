package com.reelmatch.recommender.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reelmatch.recommender.model.MovieMetadata;
import com.reelmatch.recommender.model.MovieRecord;

public record MovieResultItem(
    @JsonProperty("id") Long tmdbId,
    String title,
    String genres,
    double rating,
    @JsonProperty("vote_count") long voteCount,
    String overview,
    Double score,
    @JsonProperty("poster_path") String posterPath,
    @JsonProperty("release_date") String releaseDate
) {
    static final int OVERVIEW_PREVIEW_LENGTH = 300;

    public static MovieResultItem from(MovieRecord movie, Double score, MovieMetadata metadata) {
        return new MovieResultItem(
            metadata == null ? null : metadata.tmdbId(),
            movie.title(),
            movie.genresDisplay(),
            movie.voteAverage(),
            movie.voteCount(),
            preview(movie.overview()),
            score,
            metadata == null ? null : metadata.posterPath(),
            metadata == null ? null : metadata.releaseDate()
        );
    }

    private static String preview(String overview) {
        return overview.length() > OVERVIEW_PREVIEW_LENGTH
            ? overview.substring(0, OVERVIEW_PREVIEW_LENGTH) + "..."
            : overview;
    }
}
