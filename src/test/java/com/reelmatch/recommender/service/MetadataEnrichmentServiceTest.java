package com.reelmatch.recommender.service;

import com.reelmatch.recommender.controller.MovieResultItem;
import com.reelmatch.recommender.exception.MetadataLookupException;
import com.reelmatch.recommender.metadata.MetadataCache;
import com.reelmatch.recommender.metadata.MetadataClient;
import com.reelmatch.recommender.model.MovieDetails;
import com.reelmatch.recommender.model.MovieMetadata;
import com.reelmatch.recommender.model.MovieRecord;
import com.reelmatch.recommender.model.RankedResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.reelmatch.recommender.MovieFixtures.movie;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetadataEnrichmentServiceTest {

    @Mock
    private MetadataClient metadataClient;

    private MetadataEnrichmentService enrichmentService;

    private final MovieRecord matrix = movie("The Matrix", 8.2, "Action");
    private final MovieRecord heat = movie("Heat", 7.9, "Crime");

    @BeforeEach
    void setUp() {
        enrichmentService = new MetadataEnrichmentService(
            metadataClient, cache("title"), cache("details"), Runnable::run);
    }

    @Test
    void shouldCacheTitleLookupsCaseInsensitively() {
        MovieMetadata metadata = new MovieMetadata(603, "The Matrix", "https://img/p.jpg", "1999-03-30");
        when(metadataClient.findByTitle("The Matrix")).thenReturn(Optional.of(metadata));

        assertThat(enrichmentService.metadataFor("The Matrix")).contains(metadata);
        assertThat(enrichmentService.metadataFor("THE MATRIX")).contains(metadata);

        verify(metadataClient, times(1)).findByTitle("The Matrix");
    }

    @Test
    void shouldDegradeToEmptyWhenLookupFails() {
        when(metadataClient.findByTitle("Heat"))
            .thenThrow(new MetadataLookupException("quota exceeded", null));

        assertThat(enrichmentService.metadataFor("Heat")).isEmpty();
        assertThat(enrichmentService.metadataFor("Heat")).isEmpty();

        verify(metadataClient, times(2)).findByTitle("Heat");
    }

    @Test
    void shouldDegradeToEmptyWhenDetailsLookupFails() {
        when(metadataClient.getDetails(42L))
            .thenThrow(new MetadataLookupException("unauthorized", null));

        assertThat(enrichmentService.detailsFor(42L)).isEmpty();
    }

    @Test
    void shouldCacheDetails() {
        MovieDetails details = new MovieDetails(603, "The Matrix", "overview", "1999-03-30", 8.2,
            null, null, List.of("Action"), 136, null, null, null);
        when(metadataClient.getDetails(603L)).thenReturn(Optional.of(details));

        enrichmentService.detailsFor(603L);
        assertThat(enrichmentService.detailsFor(603L)).contains(details);

        verify(metadataClient, times(1)).getDetails(603L);
    }

    @Test
    void shouldEnrichResultsKeepingOrderAndScores() {
        when(metadataClient.findByTitle("The Matrix"))
            .thenReturn(Optional.of(new MovieMetadata(603, "The Matrix", "https://img/p.jpg", "1999-03-30")));
        when(metadataClient.findByTitle("Heat")).thenReturn(Optional.empty());

        List<MovieResultItem> items = enrichmentService.enrich(List.of(
            new RankedResult(matrix, 0.9),
            new RankedResult(heat, 0.4)
        ));

        assertThat(items).extracting(MovieResultItem::title).containsExactly("The Matrix", "Heat");
        assertThat(items.get(0).tmdbId()).isEqualTo(603L);
        assertThat(items.get(0).posterPath()).isEqualTo("https://img/p.jpg");
        assertThat(items.get(0).score()).isEqualTo(0.9);
        assertThat(items.get(1).tmdbId()).isNull();
        assertThat(items.get(1).releaseDate()).isNull();
        assertThat(items.get(1).genres()).isEqualTo("Crime");
    }

    @Test
    void shouldEnrichInParallelWithoutChangingOrder() {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            MetadataEnrichmentService parallel = new MetadataEnrichmentService(
                metadataClient, cache("title"), cache("details"), pool);
            List<MovieRecord> movies = List.of(
                movie("A", 7.0, "Drama"), movie("B", 7.0, "Drama"), movie("C", 7.0, "Drama"),
                movie("D", 7.0, "Drama"), movie("E", 7.0, "Drama"), movie("F", 7.0, "Drama"));
            for (MovieRecord movie : movies) {
                when(metadataClient.findByTitle(movie.title())).thenReturn(Optional.empty());
            }

            List<MovieResultItem> items = parallel.enrichMovies(movies);

            assertThat(items).extracting(MovieResultItem::title).containsExactly("A", "B", "C", "D", "E", "F");
            assertThat(items).allSatisfy(item -> assertThat(item.score()).isNull());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldTruncateLongOverviews() {
        MovieRecord longOverview = movie("Epic", "x".repeat(400), 7.0, 10.0, "Drama");
        when(metadataClient.findByTitle("Epic")).thenReturn(Optional.empty());

        MovieResultItem item = enrichmentService.enrichMovies(List.of(longOverview)).get(0);

        assertThat(item.overview()).hasSize(303).endsWith("...");
    }

    private static <K, V> MetadataCache<K, V> cache(String name) {
        return new MetadataCache<>(name, 100, Duration.ofMinutes(10));
    }
}
