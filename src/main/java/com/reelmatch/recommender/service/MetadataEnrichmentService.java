package com.reelmatch.recommender.service;

import com.reelmatch.recommender.controller.MovieResultItem;
import com.reelmatch.recommender.exception.MetadataLookupException;
import com.reelmatch.recommender.metadata.MetadataCache;
import com.reelmatch.recommender.metadata.MetadataClient;
import com.reelmatch.recommender.model.MovieDetails;
import com.reelmatch.recommender.model.MovieMetadata;
import com.reelmatch.recommender.model.MovieRecord;
import com.reelmatch.recommender.model.RankedResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Attaches display metadata to ranked results. Lookups are cached and run in parallel;
 * a failed lookup only drops the poster and release date.
 */
@Slf4j
@Service
public class MetadataEnrichmentService {

    private final MetadataClient metadataClient;
    private final MetadataCache<String, MovieMetadata> titleCache;
    private final MetadataCache<Long, MovieDetails> detailsCache;
    private final Executor enrichmentExecutor;

    public MetadataEnrichmentService(
        MetadataClient metadataClient,
        @Qualifier("titleMetadataCache") MetadataCache<String, MovieMetadata> titleCache,
        @Qualifier("detailsMetadataCache") MetadataCache<Long, MovieDetails> detailsCache,
        @Qualifier("enrichmentTaskExecutor") Executor enrichmentExecutor
    ) {
        this.metadataClient = metadataClient;
        this.titleCache = titleCache;
        this.detailsCache = detailsCache;
        this.enrichmentExecutor = enrichmentExecutor;
    }

    public Optional<MovieMetadata> metadataFor(String title) {
        String key = title.toLowerCase(Locale.ROOT);
        try {
            return titleCache.get(key, k -> metadataClient.findByTitle(title));
        } catch (MetadataLookupException e) {
            log.warn("Metadata lookup failed for '{}': {}", title, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<MovieDetails> detailsFor(long tmdbId) {
        try {
            return detailsCache.get(tmdbId, metadataClient::getDetails);
        } catch (MetadataLookupException e) {
            log.warn("Details lookup failed for id {}: {}", tmdbId, e.getMessage());
            return Optional.empty();
        }
    }

    public List<MovieResultItem> enrich(List<RankedResult> results) {
        List<CompletableFuture<MovieResultItem>> futures = results.stream()
            .map(result -> CompletableFuture.supplyAsync(
                () -> toItem(result.movie(), result.score()), enrichmentExecutor))
            .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    public List<MovieResultItem> enrichMovies(List<MovieRecord> movies) {
        List<CompletableFuture<MovieResultItem>> futures = movies.stream()
            .map(movie -> CompletableFuture.supplyAsync(() -> toItem(movie, null), enrichmentExecutor))
            .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private MovieResultItem toItem(MovieRecord movie, Double score) {
        return MovieResultItem.from(movie, score, metadataFor(movie.title()).orElse(null));
    }
}
