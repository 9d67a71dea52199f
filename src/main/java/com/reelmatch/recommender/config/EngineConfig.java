package com.reelmatch.recommender.config;

import com.reelmatch.recommender.catalog.Catalog;
import com.reelmatch.recommender.catalog.CsvCatalogReader;
import com.reelmatch.recommender.engine.ContentIndex;
import com.reelmatch.recommender.engine.EmotionGenreMap;
import com.reelmatch.recommender.engine.EmotionScorer;
import com.reelmatch.recommender.engine.GenreRanker;
import com.reelmatch.recommender.engine.OverviewTokenizer;
import com.reelmatch.recommender.engine.SimilarityEngine;
import com.reelmatch.recommender.engine.TitleResolver;
import com.reelmatch.recommender.model.MovieRecord;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Builds the catalog and the engines once at startup. A {@code CatalogDataException}
 * here aborts context startup.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Catalog catalog(RecommenderProperties properties, ResourceLoader resourceLoader) {
        var table = new CsvCatalogReader().read(resourceLoader.getResource(properties.dataFile()));
        return Catalog.load(table);
    }

    @Bean
    public ContentIndex contentIndex(Catalog catalog, RecommenderProperties properties) {
        return ContentIndex.build(
            catalog.movies().stream().map(MovieRecord::overview).toList(),
            new OverviewTokenizer(),
            properties.maxFeatures()
        );
    }

    @Bean
    public TitleResolver titleResolver(Catalog catalog) {
        return new TitleResolver(catalog);
    }

    @Bean
    public SimilarityEngine similarityEngine(Catalog catalog, TitleResolver titleResolver,
                                             ContentIndex contentIndex, RecommenderProperties properties) {
        return new SimilarityEngine(
            catalog,
            titleResolver,
            contentIndex,
            properties.thresholds().seed(),
            properties.minSimilarity()
        );
    }

    @Bean
    public EmotionScorer emotionScorer(Catalog catalog) {
        return new EmotionScorer(catalog, EmotionGenreMap.defaults());
    }

    @Bean
    public GenreRanker genreRanker(Catalog catalog) {
        return new GenreRanker(catalog);
    }
}
