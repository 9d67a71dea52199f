package com.reelmatch.recommender.catalog;

import com.reelmatch.recommender.exception.CatalogDataException;
import com.reelmatch.recommender.model.CatalogStatistics;
import com.reelmatch.recommender.model.MovieRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, ordered collection of movies. Row positions are stable for the lifetime of
 * the instance and are shared with the {@link com.reelmatch.recommender.engine.ContentIndex}
 * built from it.
 */
@Slf4j
public final class Catalog {

    public static final String TITLE = "title";
    public static final String OVERVIEW = "overview";
    public static final String GENRES = "genres";
    public static final String VOTE_AVERAGE = "vote_average";
    public static final String VOTE_COUNT = "vote_count";
    public static final String POPULARITY = "popularity";

    public static final List<String> REQUIRED_COLUMNS =
        List.of(TITLE, OVERVIEW, GENRES, VOTE_AVERAGE, VOTE_COUNT, POPULARITY);


    private final List<MovieRecord> movies;
    private final Map<String, Integer> positionsByTitle;

    private Catalog(List<MovieRecord> movies) {
        this.movies = Collections.unmodifiableList(movies);
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < movies.size(); i++) {
            positions.put(movies.get(i).title(), i);
        }
        this.positionsByTitle = Collections.unmodifiableMap(positions);
    }

    public static Catalog of(List<MovieRecord> movies) {
        Set<String> seen = new HashSet<>();
        List<MovieRecord> unique = new ArrayList<>(movies.size());
        for (MovieRecord movie : movies) {
            if (seen.add(movie.title())) {
                unique.add(movie);
            }
        }
        return new Catalog(unique);
    }

    public static Catalog load(RawTable table) {
        return load(table, new GenreParser());
    }

    public static Catalog load(RawTable table, GenreParser genreParser) {
        if (table == null) {
            throw new CatalogDataException("Movie table is missing");
        }

        List<String> missing = REQUIRED_COLUMNS.stream()
            .filter(column -> !table.columns().contains(column))
            .toList();
        if (!missing.isEmpty()) {
            throw new CatalogDataException("Movie table is missing required columns: " + missing);
        }

        Set<String> seenTitles = new HashSet<>();
        List<MovieRecord> movies = new ArrayList<>();
        int duplicates = 0;
        int incomplete = 0;

        for (Map<String, String> row : table.rows()) {
            String title = row.get(TITLE);
            // first occurrence wins, even when it is later dropped as incomplete
            if (!seenTitles.add(title == null ? "" : title)) {
                duplicates++;
                continue;
            }

            String overview = row.get(OVERVIEW) == null ? "" : row.get(OVERVIEW);
            if (title == null || title.isBlank() || overview.isEmpty()) {
                incomplete++;
                continue;
            }

            movies.add(new MovieRecord(
                title,
                overview,
                genreParser.parse(row.get(GENRES)),
                Math.min(MovieRecord.MAX_RATING, nonNegative(parseDouble(row.get(VOTE_AVERAGE)))),
                (long) nonNegative(parseDouble(row.get(VOTE_COUNT))),
                nonNegative(parseDouble(row.get(POPULARITY)))
            ));
        }

        if (movies.isEmpty()) {
            throw new CatalogDataException("Movie table contains no usable rows");
        }

        log.info("Catalog loaded: {} movies ({} duplicate titles, {} rows without title or overview dropped)",
            movies.size(), duplicates, incomplete);
        return new Catalog(movies);
    }

    static double parseDouble(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : 0;
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static double nonNegative(double value) {
        return Math.max(0, value);
    }

    public int size() {
        return movies.size();
    }

    public MovieRecord get(int index) {
        return movies.get(index);
    }

    public List<MovieRecord> movies() {
        return movies;
    }

    public int indexOf(MovieRecord movie) {
        Integer position = positionsByTitle.get(movie.title());
        return position != null && movies.get(position).equals(movie) ? position : -1;
    }

    public CatalogStatistics statistics() {
        Set<String> genreCombinations = new LinkedHashSet<>();
        double ratingSum = 0;
        double popularitySum = 0;
        for (MovieRecord movie : movies) {
            genreCombinations.add(movie.genresDisplay());
            ratingSum += movie.voteAverage();
            popularitySum += movie.popularity();
        }
        int count = movies.size();
        return new CatalogStatistics(
            count,
            genreCombinations.size(),
            count == 0 ? 0 : ratingSum / count,
            count == 0 ? 0 : popularitySum / count
        );
    }
}
