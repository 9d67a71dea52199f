package com.reelmatch.recommender.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One catalog row. Rating is in [0, 10]; vote count and popularity are non-negative and
 * every number is finite. The loader clamps raw values into range before building records.
 */
public record MovieRecord(
    String title,
    String overview,
    Set<String> genres,
    double voteAverage,
    long voteCount,
    double popularity
) {
    public static final String UNKNOWN_GENRE = "Unknown";
    public static final double MAX_RATING = 10.0;

    public MovieRecord {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Movie title cannot be blank");
        }
        if (overview == null || overview.isEmpty()) {
            throw new IllegalArgumentException("Movie overview cannot be empty: " + title);
        }
        if (!Double.isFinite(voteAverage) || voteAverage < 0 || voteAverage > MAX_RATING) {
            throw new IllegalArgumentException("Rating must be between 0 and 10 for " + title + ": " + voteAverage);
        }
        if (voteCount < 0) {
            throw new IllegalArgumentException("Vote count cannot be negative for " + title + ": " + voteCount);
        }
        if (!Double.isFinite(popularity) || popularity < 0) {
            throw new IllegalArgumentException("Popularity must be a non-negative number for " + title + ": " + popularity);
        }
        genres = genres == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(genres));
    }

    public String genresDisplay() {
        return genres.isEmpty() ? UNKNOWN_GENRE : String.join(", ", genres);
    }

    public boolean hasAnyGenre(Set<String> candidates) {
        for (String genre : genres) {
            if (candidates.contains(genre)) {
                return true;
            }
        }
        return false;
    }
}
