package com.reelmatch.recommender.model;

import java.util.List;

/**
 * Outcome of a mood lookup. {@link EmotionMatchStatus#NO_MAPPING} and
 * {@link EmotionMatchStatus#NO_MATCHES} both carry an empty result list but mean different things.
 */
public record EmotionRecommendation(
    String emotion,
    List<String> genres,
    List<RankedResult> results,
    EmotionMatchStatus status
) {
    public EmotionRecommendation {
        genres = genres == null ? List.of() : List.copyOf(genres);
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static EmotionRecommendation noMapping(String emotion) {
        return new EmotionRecommendation(emotion, List.of(), List.of(), EmotionMatchStatus.NO_MAPPING);
    }

    public static EmotionRecommendation of(String emotion, List<String> genres, List<RankedResult> results) {
        return new EmotionRecommendation(
            emotion,
            genres,
            results,
            results.isEmpty() ? EmotionMatchStatus.NO_MATCHES : EmotionMatchStatus.MATCHED
        );
    }

    public boolean mapped() {
        return status != EmotionMatchStatus.NO_MAPPING;
    }
}
