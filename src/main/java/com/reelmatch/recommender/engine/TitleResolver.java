package com.reelmatch.recommender.engine;

import com.reelmatch.recommender.catalog.Catalog;
import com.reelmatch.recommender.model.MovieRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves free-text queries to catalog entries. A case-insensitive exact title match
 * short-circuits fuzzy scoring.
 */
@Slf4j
@RequiredArgsConstructor
public class TitleResolver {

    static final int CANDIDATE_LIMIT = 5;

    private record Candidate(MovieRecord movie, int score) {}

    private final Catalog catalog;

    public List<MovieRecord> search(String query, int threshold) {
        if (query == null || query.isBlank()) {
            return List.of();
        }

        String normalized = query.trim().toLowerCase(Locale.ROOT);
        List<MovieRecord> exact = catalog.movies().stream()
            .filter(movie -> movie.title().toLowerCase(Locale.ROOT).equals(normalized))
            .toList();
        if (!exact.isEmpty()) {
            log.debug("Exact title match for '{}': {} movie(s)", query, exact.size());
            return exact;
        }

        // stable sort keeps catalog order between equal scores
        List<Candidate> candidates = new ArrayList<>(catalog.size());
        for (MovieRecord movie : catalog.movies()) {
            candidates.add(new Candidate(movie, TokenSetRatio.score(query, movie.title())));
        }
        candidates.sort(Comparator.comparingInt(Candidate::score).reversed());

        Map<String, MovieRecord> matches = new LinkedHashMap<>();
        candidates.stream()
            .limit(CANDIDATE_LIMIT)
            .filter(candidate -> candidate.score() >= threshold)
            .sorted(Comparator.comparingInt(Candidate::score).reversed())
            .forEach(candidate -> matches.putIfAbsent(candidate.movie().title(), candidate.movie()));

        log.debug("Fuzzy search for '{}' at threshold {}: {} match(es)", query, threshold, matches.size());
        return List.copyOf(matches.values());
    }
}
