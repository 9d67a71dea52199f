package com.reelmatch.recommender.controller;

import com.reelmatch.recommender.model.CatalogStatistics;
import com.reelmatch.recommender.service.RecommendationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationService recommendationService;

    @PostMapping("/search")
    public ResponseEntity<RecommendationResponse> searchByTitle(@Valid @RequestBody TitleSearchRequest request) {
        return ResponseEntity.ok(recommendationService.recommendByTitle(request.title()));
    }

    @GetMapping("/movies")
    public ResponseEntity<List<MovieResultItem>> findMovies(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "threshold", required = false) Integer threshold) {

        return ResponseEntity.ok(recommendationService.searchTitles(query, Optional.ofNullable(threshold)));
    }

    @GetMapping("/movies/{tmdbId}")
    public ResponseEntity<MovieDetailResponse> getMovie(@PathVariable long tmdbId) {
        return ResponseEntity.ok(recommendationService.movieDetail(tmdbId));
    }

    @PostMapping("/emotion-search")
    public ResponseEntity<EmotionResponse> searchByEmotion(@Valid @RequestBody EmotionSearchRequest request) {
        return ResponseEntity.ok(recommendationService.recommendByEmotion(request.emotion()));
    }

    @GetMapping("/emotions")
    public ResponseEntity<Map<String, List<String>>> emotions() {
        return ResponseEntity.ok(Map.of("emotions", recommendationService.availableEmotions()));
    }

    @GetMapping("/genres/recommendations")
    public ResponseEntity<List<MovieResultItem>> recommendByGenres(
        @RequestParam(name = "genres") List<String> genres,
        @RequestParam(name = "min_rating", required = false) Double minRating) {

        return ResponseEntity.ok(recommendationService.recommendByGenres(genres, Optional.ofNullable(minRating)));
    }

    @GetMapping("/stats")
    public ResponseEntity<CatalogStatistics> statistics() {
        return ResponseEntity.ok(recommendationService.statistics());
    }
}
