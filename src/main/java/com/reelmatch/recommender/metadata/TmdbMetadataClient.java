package com.reelmatch.recommender.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.reelmatch.recommender.exception.MetadataLookupException;
import com.reelmatch.recommender.infra.RateLimiter;
import com.reelmatch.recommender.model.MovieDetails;
import com.reelmatch.recommender.model.MovieMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * TMDB v3 client. Server errors and I/O failures are retried; anything still failing is
 * logged and reported as "no metadata".
 */
@Slf4j
public class TmdbMetadataClient implements MetadataClient {

    public static final String TMDB_LIMIT = "tmdb_limit";

    private static final String POSTER_SIZE = "w500";
    private static final String BACKDROP_SIZE = "original";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchPage(List<SearchHit> results) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchHit(
        long id,
        String title,
        @JsonProperty("release_date") String releaseDate,
        @JsonProperty("poster_path") String posterPath
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Genre(long id, String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Details(
        long id,
        String title,
        String overview,
        @JsonProperty("release_date") String releaseDate,
        @JsonProperty("vote_average") double voteAverage,
        @JsonProperty("poster_path") String posterPath,
        @JsonProperty("backdrop_path") String backdropPath,
        List<Genre> genres,
        Integer runtime,
        String tagline,
        String homepage,
        @JsonProperty("imdb_id") String imdbId
    ) {}

    private final RestClient restClient;
    private final RateLimiter rateLimiter;
    private final String apiKey;
    private final String language;
    private final String imageBaseUrl;

    public TmdbMetadataClient(RestClient restClient, RateLimiter rateLimiter,
                              String apiKey, String language, String imageBaseUrl) {
        this.restClient = restClient;
        this.rateLimiter = rateLimiter;
        this.apiKey = apiKey;
        this.language = language;
        this.imageBaseUrl = imageBaseUrl;
    }

    @Override
    @Retryable(
        retryFor = {ResourceAccessException.class, HttpServerErrorException.class},
        maxAttempts = 3,
        backoff = @Backoff(delay = 500, multiplier = 2),
        recover = "recoverSearch"
    )
    public Optional<MovieMetadata> findByTitle(String title) {
        log.debug("Searching TMDB for '{}'", title);
        SearchPage page = rateLimiter.execute(TMDB_LIMIT, 1, () -> call(() -> restClient.get()
            .uri(uri -> uri.path("/search/movie")
                .queryParam("api_key", apiKey)
                .queryParam("language", language)
                .queryParam("query", title)
                .build())
            .retrieve()
            .body(SearchPage.class), "search '" + title + "'"));

        if (page == null || page.results() == null) {
            return Optional.empty();
        }
        // only hits with a release date and a poster are usable for display
        return page.results().stream()
            .filter(hit -> hasText(hit.releaseDate()) && hasText(hit.posterPath()))
            .findFirst()
            .map(hit -> new MovieMetadata(hit.id(), hit.title(),
                imageUrl(POSTER_SIZE, hit.posterPath()), hit.releaseDate()));
    }

    @Override
    @Retryable(
        retryFor = {ResourceAccessException.class, HttpServerErrorException.class},
        maxAttempts = 3,
        backoff = @Backoff(delay = 500, multiplier = 2),
        recover = "recoverDetails"
    )
    public Optional<MovieDetails> getDetails(long tmdbId) {
        log.debug("Fetching TMDB details for id {}", tmdbId);
        Details details = rateLimiter.execute(TMDB_LIMIT, 1, () -> call(() -> restClient.get()
            .uri(uri -> uri.path("/movie/{id}")
                .queryParam("api_key", apiKey)
                .queryParam("language", language)
                .build(tmdbId))
            .retrieve()
            .body(Details.class), "details " + tmdbId));

        if (details == null) {
            return Optional.empty();
        }
        return Optional.of(new MovieDetails(
            details.id(),
            details.title(),
            details.overview(),
            details.releaseDate(),
            details.voteAverage(),
            imageUrl(POSTER_SIZE, details.posterPath()),
            imageUrl(BACKDROP_SIZE, details.backdropPath()),
            details.genres() == null ? List.of() : details.genres().stream().map(Genre::name).toList(),
            details.runtime(),
            details.tagline(),
            details.homepage(),
            details.imdbId()
        ));
    }

    @Recover
    Optional<MovieMetadata> recoverSearch(RuntimeException e, String title) {
        log.error("TMDB search failed for title '{}': {}", title, e.getMessage());
        return Optional.empty();
    }

    @Recover
    Optional<MovieDetails> recoverDetails(RuntimeException e, long tmdbId) {
        log.error("TMDB details lookup failed for id {}: {}", tmdbId, e.getMessage());
        return Optional.empty();
    }

    // 404 means "no such movie"; other client errors (bad key, bad request) are not retryable
    private <T> T call(Supplier<T> request, String description) {
        try {
            return request.get();
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.warn("TMDB returned 404 for {}", description);
                return null;
            }
            throw new MetadataLookupException("TMDB rejected " + description + ": " + e.getStatusCode(), e);
        }
    }

    private String imageUrl(String size, String path) {
        return hasText(path) ? imageBaseUrl + "/" + size + path : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
