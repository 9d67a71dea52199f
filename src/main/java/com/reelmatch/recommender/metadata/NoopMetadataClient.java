package com.reelmatch.recommender.metadata;

import com.reelmatch.recommender.model.MovieDetails;
import com.reelmatch.recommender.model.MovieMetadata;

import java.util.Optional;

/**
 * Used when no TMDB API key is configured.
 */
public class NoopMetadataClient implements MetadataClient {

    @Override
    public Optional<MovieMetadata> findByTitle(String title) {
        return Optional.empty();
    }

    @Override
    public Optional<MovieDetails> getDetails(long tmdbId) {
        return Optional.empty();
    }
}
