package com.reelmatch.recommender.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * TF-IDF representation of movie overviews, one L2-normalized sparse row per catalog
 * position. Built once and never modified.
 */
@Slf4j
public final class ContentIndex {

    public static final int DEFAULT_MAX_FEATURES = 5000;

    private final int[][] termIds;
    private final double[][] weights;
    private final int vocabularySize;

    private ContentIndex(int[][] termIds, double[][] weights, int vocabularySize) {
        this.termIds = termIds;
        this.weights = weights;
        this.vocabularySize = vocabularySize;
    }

    public static ContentIndex build(List<String> documents) {
        return build(documents, new OverviewTokenizer(), DEFAULT_MAX_FEATURES);
    }

    public static ContentIndex build(List<String> documents, OverviewTokenizer tokenizer, int maxFeatures) {
        if (maxFeatures < 1) {
            throw new IllegalArgumentException("maxFeatures must be positive: " + maxFeatures);
        }

        List<Map<String, Integer>> counts = new ArrayList<>(documents.size());
        Map<String, Long> corpusFrequency = new HashMap<>();
        for (String document : documents) {
            Map<String, Integer> termCounts = new HashMap<>();
            for (String term : tokenizer.terms(document)) {
                termCounts.merge(term, 1, Integer::sum);
                corpusFrequency.merge(term, 1L, Long::sum);
            }
            counts.add(termCounts);
        }

        Map<String, Integer> vocabulary = selectVocabulary(corpusFrequency, maxFeatures);

        int[] documentFrequency = new int[vocabulary.size()];
        for (Map<String, Integer> termCounts : counts) {
            for (String term : termCounts.keySet()) {
                Integer id = vocabulary.get(term);
                if (id != null) {
                    documentFrequency[id]++;
                }
            }
        }

        int n = documents.size();
        double[] idf = new double[vocabulary.size()];
        for (int id = 0; id < idf.length; id++) {
            idf[id] = Math.log((1.0 + n) / (1.0 + documentFrequency[id])) + 1.0;
        }

        int[][] termIds = new int[n][];
        double[][] weights = new double[n][];
        for (int row = 0; row < n; row++) {
            TreeMap<Integer, Double> entries = new TreeMap<>();
            for (Map.Entry<String, Integer> entry : counts.get(row).entrySet()) {
                Integer id = vocabulary.get(entry.getKey());
                if (id != null) {
                    entries.put(id, entry.getValue() * idf[id]);
                }
            }

            double norm = Math.sqrt(entries.values().stream().mapToDouble(w -> w * w).sum());
            termIds[row] = new int[entries.size()];
            weights[row] = new double[entries.size()];
            int k = 0;
            for (Map.Entry<Integer, Double> entry : entries.entrySet()) {
                termIds[row][k] = entry.getKey();
                weights[row][k] = norm > 0 ? entry.getValue() / norm : 0;
                k++;
            }
        }

        log.info("Content index built: {} documents, {} terms", n, vocabulary.size());
        return new ContentIndex(termIds, weights, vocabulary.size());
    }

    // most frequent terms across the corpus, ties alphabetical; ids follow alphabetical order
    private static Map<String, Integer> selectVocabulary(Map<String, Long> corpusFrequency, int maxFeatures) {
        List<String> selected = corpusFrequency.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(maxFeatures)
            .map(Map.Entry::getKey)
            .sorted()
            .toList();

        Map<String, Integer> vocabulary = new HashMap<>(selected.size() * 2);
        for (int id = 0; id < selected.size(); id++) {
            vocabulary.put(selected.get(id), id);
        }
        return vocabulary;
    }

    /**
     * Cosine similarity of two rows, in [0, 1]. A row without any vocabulary term scores 0.
     */
    public double similarity(int first, int second) {
        int[] leftIds = termIds[first];
        int[] rightIds = termIds[second];
        double[] leftWeights = weights[first];
        double[] rightWeights = weights[second];

        double dot = 0;
        int i = 0;
        int j = 0;
        while (i < leftIds.length && j < rightIds.length) {
            if (leftIds[i] == rightIds[j]) {
                dot += leftWeights[i++] * rightWeights[j++];
            } else if (leftIds[i] < rightIds[j]) {
                i++;
            } else {
                j++;
            }
        }
        return Math.max(0, Math.min(1, dot));
    }

    public int size() {
        return termIds.length;
    }

    int vocabularySize() {
        return vocabularySize;
    }

    int termCount(int row) {
        return termIds[row].length;
    }
}
