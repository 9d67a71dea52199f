package com.reelmatch.recommender.engine;

import com.reelmatch.recommender.catalog.Catalog;
import com.reelmatch.recommender.model.MovieRecord;
import com.reelmatch.recommender.model.RankedResult;
import com.reelmatch.recommender.model.SimilarityWeights;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ranks catalog movies against a reference movie by a weighted blend of genre overlap,
 * rating closeness and overview similarity.
 */
@Slf4j
public class SimilarityEngine {

    public static final int DEFAULT_SEED_THRESHOLD = 80;
    public static final double DEFAULT_MIN_SIMILARITY = 0.1;

    private static final double RATING_SCALE = 10.0;

    private final Catalog catalog;
    private final TitleResolver titleResolver;
    private final ContentIndex contentIndex;
    private final int seedThreshold;
    private final double minSimilarity;

    public SimilarityEngine(Catalog catalog, TitleResolver titleResolver, ContentIndex contentIndex) {
        this(catalog, titleResolver, contentIndex, DEFAULT_SEED_THRESHOLD, DEFAULT_MIN_SIMILARITY);
    }

    public SimilarityEngine(Catalog catalog, TitleResolver titleResolver, ContentIndex contentIndex,
                            int seedThreshold, double minSimilarity) {
        if (contentIndex.size() != catalog.size()) {
            throw new IllegalArgumentException("Content index has " + contentIndex.size()
                + " rows but catalog has " + catalog.size() + " movies");
        }
        this.catalog = catalog;
        this.titleResolver = titleResolver;
        this.contentIndex = contentIndex;
        this.seedThreshold = seedThreshold;
        this.minSimilarity = minSimilarity;
    }

    public List<RankedResult> recommend(String seedTitle, int n) {
        return recommend(seedTitle, n, SimilarityWeights.DEFAULT);
    }

    /**
     * Returns an empty list when the seed title does not resolve; the caller decides how
     * to report that.
     */
    public List<RankedResult> recommend(String seedTitle, int n, SimilarityWeights weights) {
        if (n <= 0) {
            return List.of();
        }
        List<MovieRecord> seeds = titleResolver.search(seedTitle, seedThreshold);
        if (seeds.isEmpty()) {
            log.debug("No seed movie resolved for '{}'", seedTitle);
            return List.of();
        }

        int reference = catalog.indexOf(seeds.get(0));
        SimilarityWeights effective = weights == null ? SimilarityWeights.DEFAULT : weights;

        List<RankedResult> ranked = new ArrayList<>();
        for (int i = 0; i < catalog.size(); i++) {
            if (i == reference) {
                continue;
            }
            double score = combinedSimilarity(reference, i, effective);
            if (score >= minSimilarity) {
                ranked.add(new RankedResult(catalog.get(i), score));
            }
        }
        ranked.sort(Comparator.comparingDouble(RankedResult::score).reversed());

        log.debug("'{}' -> {} candidates above {}", seeds.get(0).title(), ranked.size(), minSimilarity);
        return ranked.size() > n ? List.copyOf(ranked.subList(0, n)) : List.copyOf(ranked);
    }

    public double combinedSimilarity(int first, int second, SimilarityWeights weights) {
        return weights.genre() * genreSimilarity(catalog.get(first), catalog.get(second))
            + weights.rating() * ratingSimilarity(catalog.get(first), catalog.get(second))
            + weights.content() * contentSimilarity(first, second);
    }

    public double contentSimilarity(int first, int second) {
        return contentIndex.similarity(first, second);
    }

    /**
     * Jaccard index of the genre sets; 0 when either movie has no genres.
     */
    public static double genreSimilarity(MovieRecord first, MovieRecord second) {
        if (first.genres().isEmpty() || second.genres().isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(first.genres());
        union.addAll(second.genres());
        long shared = first.genres().stream().filter(second.genres()::contains).count();
        return (double) shared / union.size();
    }

    public static double ratingSimilarity(MovieRecord first, MovieRecord second) {
        return Math.max(0, 1 - Math.abs(first.voteAverage() - second.voteAverage()) / RATING_SCALE);
    }
}
