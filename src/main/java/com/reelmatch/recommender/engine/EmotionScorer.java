package com.reelmatch.recommender.engine;

import com.reelmatch.recommender.catalog.Catalog;
import com.reelmatch.recommender.model.EmotionRecommendation;
import com.reelmatch.recommender.model.MovieRecord;
import com.reelmatch.recommender.model.RankedResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@RequiredArgsConstructor
public class EmotionScorer {

    private static final double GENRE_WEIGHT = 0.5;
    private static final double RATING_WEIGHT = 0.3;
    private static final double POPULARITY_WEIGHT = 0.2;

    private final Catalog catalog;
    private final EmotionGenreMap emotionGenreMap;

    public EmotionRecommendation recommendByEmotion(String emotion, int n, double minRating) {
        Optional<List<String>> mapped = emotionGenreMap.genresFor(emotion);
        if (mapped.isEmpty()) {
            log.warn("No genres found for emotion '{}'. Available emotions: {}", emotion, availableEmotions());
            return EmotionRecommendation.noMapping(emotion);
        }

        List<String> genres = mapped.get();
        Set<String> genreSet = new LinkedHashSet<>(genres);
        log.debug("Emotion '{}' mapped to genres: {}", emotion, genres);

        List<RankedResult> ranked = new ArrayList<>();
        for (MovieRecord movie : catalog.movies()) {
            if (movie.voteAverage() >= minRating && movie.hasAnyGenre(genreSet)) {
                ranked.add(new RankedResult(movie, score(movie, genreSet)));
            }
        }
        ranked.sort(Comparator.comparingDouble(RankedResult::score).reversed());

        List<RankedResult> top = n <= 0 ? List.of() : ranked.subList(0, Math.min(n, ranked.size()));
        if (top.isEmpty()) {
            log.info("No movies found for emotion '{}' with rating >= {}", emotion, minRating);
        }
        return EmotionRecommendation.of(emotion, genres, top);
    }

    static double score(MovieRecord movie, Set<String> genres) {
        long matched = genres.stream().filter(movie.genres()::contains).count();
        return GENRE_WEIGHT * matched / genres.size()
            + RATING_WEIGHT * movie.voteAverage() / 10.0
            + POPULARITY_WEIGHT * Math.log1p(movie.popularity()) / 10.0;
    }

    public List<String> availableEmotions() {
        return emotionGenreMap.emotions();
    }
}
