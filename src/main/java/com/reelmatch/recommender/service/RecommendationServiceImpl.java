package com.reelmatch.recommender.service;

import com.reelmatch.recommender.catalog.Catalog;
import com.reelmatch.recommender.config.RecommenderProperties;
import com.reelmatch.recommender.controller.EmotionResponse;
import com.reelmatch.recommender.controller.MovieDetailResponse;
import com.reelmatch.recommender.controller.MovieResultItem;
import com.reelmatch.recommender.controller.RecommendationResponse;
import com.reelmatch.recommender.engine.EmotionScorer;
import com.reelmatch.recommender.engine.GenreRanker;
import com.reelmatch.recommender.engine.SimilarityEngine;
import com.reelmatch.recommender.engine.TitleResolver;
import com.reelmatch.recommender.exception.EmotionNotMappedException;
import com.reelmatch.recommender.exception.MovieNotFoundException;
import com.reelmatch.recommender.exception.NoRecommendationsException;
import com.reelmatch.recommender.exception.WrongQueryException;
import com.reelmatch.recommender.model.CatalogStatistics;
import com.reelmatch.recommender.model.EmotionMatchStatus;
import com.reelmatch.recommender.model.EmotionRecommendation;
import com.reelmatch.recommender.model.MovieDetails;
import com.reelmatch.recommender.model.MovieMetadata;
import com.reelmatch.recommender.model.MovieRecord;
import com.reelmatch.recommender.model.RankedResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationServiceImpl implements RecommendationService {

    static final String TITLE_SEARCH = "title";
    static final String EMOTION_SEARCH = "emotion";

    private static final int MAX_QUERY_LENGTH = 200;

    private final Catalog catalog;
    private final TitleResolver titleResolver;
    private final SimilarityEngine similarityEngine;
    private final EmotionScorer emotionScorer;
    private final GenreRanker genreRanker;
    private final MetadataEnrichmentService enrichmentService;
    private final RecommenderProperties properties;

    @Override
    public RecommendationResponse recommendByTitle(String title) {
        String query = validateQuery(title, "Please enter a movie title.");
        log.info("Searching for movie: {}", query);

        List<MovieRecord> matches = titleResolver.search(query, properties.thresholds().seed());
        if (matches.isEmpty()) {
            throw new MovieNotFoundException(query);
        }

        String baseTitle = matches.get(0).title();
        log.debug("Found local movie: {}", baseTitle);

        List<RankedResult> recommendations = similarityEngine.recommend(
            baseTitle, properties.recommendations(), properties.weights().toSimilarityWeights());
        if (recommendations.isEmpty()) {
            throw NoRecommendationsException.forTitle(baseTitle);
        }

        List<MovieResultItem> results = enrichmentService.enrich(recommendations);
        Long baseMovieId = enrichmentService.metadataFor(baseTitle).map(MovieMetadata::tmdbId).orElse(null);

        log.info("Returning {} recommendations for '{}'", results.size(), baseTitle);
        return new RecommendationResponse(TITLE_SEARCH, baseTitle, baseMovieId, results);
    }

    @Override
    public List<MovieResultItem> searchTitles(String query, Optional<Integer> threshold) {
        String cleanQuery = validateQuery(query, "Query cannot be blank");
        int effectiveThreshold = threshold.orElse(properties.thresholds().search());
        if (effectiveThreshold < 0 || effectiveThreshold > 100) {
            throw new WrongQueryException("Threshold must be between 0 and 100");
        }
        return enrichmentService.enrichMovies(titleResolver.search(cleanQuery, effectiveThreshold));
    }

    @Override
    public EmotionResponse recommendByEmotion(String emotionInput) {
        String selected = validateQuery(emotionInput, "Please select an emotion.");
        // accepts the "joie / joy" display form
        String emotion = selected.split("/")[0].trim();
        log.info("Searching for emotion: {}", emotion);

        EmotionRecommendation recommendation = emotionScorer.recommendByEmotion(
            emotion, properties.recommendations(), properties.minRating());

        if (!recommendation.mapped()) {
            throw new EmotionNotMappedException(emotion, emotionScorer.availableEmotions());
        }
        if (recommendation.status() == EmotionMatchStatus.NO_MATCHES) {
            throw NoRecommendationsException.forEmotion(selected, properties.minRating());
        }

        List<MovieResultItem> results = enrichmentService.enrich(recommendation.results());
        log.info("Returning {} recommendations for emotion '{}'", results.size(), emotion);
        return new EmotionResponse(EMOTION_SEARCH, selected, recommendation.genres(), results);
    }

    @Override
    public List<String> availableEmotions() {
        return emotionScorer.availableEmotions();
    }

    @Override
    public List<MovieResultItem> recommendByGenres(List<String> genres, Optional<Double> minRating) {
        if (genres == null || genres.stream().allMatch(g -> g == null || g.isBlank())) {
            throw new WrongQueryException("At least one genre is required");
        }
        List<String> cleanGenres = genres.stream()
            .filter(g -> g != null && !g.isBlank())
            .map(String::trim)
            .toList();
        List<RankedResult> ranked = genreRanker.recommendByGenres(
            cleanGenres, minRating.orElse(properties.minRating()), properties.recommendations());
        return enrichmentService.enrich(ranked);
    }

    @Override
    public MovieDetailResponse movieDetail(long tmdbId) {
        MovieDetails details = enrichmentService.detailsFor(tmdbId)
            .orElseThrow(() -> {
                log.warn("No metadata found for TMDB id {}", tmdbId);
                return new MovieNotFoundException("TMDB id " + tmdbId);
            });

        List<MovieRecord> local = details.title() == null
            ? List.of()
            : titleResolver.search(details.title(), properties.thresholds().detail());
        if (local.isEmpty()) {
            log.debug("'{}' is not in the local catalog, no recommendations", details.title());
            return new MovieDetailResponse(details, List.of());
        }

        List<RankedResult> recommendations = similarityEngine.recommend(
            local.get(0).title(), properties.recommendations(), properties.weights().toSimilarityWeights());
        return new MovieDetailResponse(details, enrichmentService.enrich(recommendations));
    }

    @Override
    public CatalogStatistics statistics() {
        return catalog.statistics();
    }

    private String validateQuery(String query, String blankMessage) {
        if (query == null || query.isBlank()) {
            throw new WrongQueryException(blankMessage);
        }
        if (query.length() > MAX_QUERY_LENGTH) {
            throw new WrongQueryException("Query too long");
        }
        return query.trim();
    }
}
