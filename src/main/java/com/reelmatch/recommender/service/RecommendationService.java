package com.reelmatch.recommender.service;

import com.reelmatch.recommender.controller.EmotionResponse;
import com.reelmatch.recommender.controller.MovieDetailResponse;
import com.reelmatch.recommender.controller.MovieResultItem;
import com.reelmatch.recommender.controller.RecommendationResponse;
import com.reelmatch.recommender.model.CatalogStatistics;

import java.util.List;
import java.util.Optional;

public interface RecommendationService {

    RecommendationResponse recommendByTitle(String title);
    List<MovieResultItem> searchTitles(String query, Optional<Integer> threshold);
    EmotionResponse recommendByEmotion(String emotion);
    List<String> availableEmotions();
    List<MovieResultItem> recommendByGenres(List<String> genres, Optional<Double> minRating);
    MovieDetailResponse movieDetail(long tmdbId);
    CatalogStatistics statistics();

}
