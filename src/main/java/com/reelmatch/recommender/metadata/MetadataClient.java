package com.reelmatch.recommender.metadata;

import com.reelmatch.recommender.model.MovieDetails;
import com.reelmatch.recommender.model.MovieMetadata;

import java.util.Optional;

/**
 * Third-party movie metadata. Implementations return empty rather than throw when a
 * lookup fails or finds nothing.
 */
public interface MetadataClient {

    Optional<MovieMetadata> findByTitle(String title);

    Optional<MovieDetails> getDetails(long tmdbId);
}
