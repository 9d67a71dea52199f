package com.reelmatch.recommender.engine;

import com.reelmatch.recommender.catalog.Catalog;
import com.reelmatch.recommender.model.MovieRecord;
import com.reelmatch.recommender.model.RankedResult;
import lombok.RequiredArgsConstructor;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Genre browse: any listed genre, minimum rating, ordered by rating with a popularity boost.
 * Scores are not normalized.
 */
@RequiredArgsConstructor
public class GenreRanker {

    private final Catalog catalog;

    public List<RankedResult> recommendByGenres(Collection<String> genres, double minRating, int n) {
        if (genres == null || genres.isEmpty() || n <= 0) {
            return List.of();
        }
        Set<String> wanted = new LinkedHashSet<>(genres);

        return catalog.movies().stream()
            .filter(movie -> movie.voteAverage() >= minRating && movie.hasAnyGenre(wanted))
            .map(movie -> new RankedResult(movie, score(movie)))
            .sorted(Comparator.comparingDouble(RankedResult::score).reversed())
            .limit(n)
            .toList();
    }

    static double score(MovieRecord movie) {
        return movie.voteAverage() * 0.7 + Math.log1p(movie.popularity()) * 0.3;
    }
}
