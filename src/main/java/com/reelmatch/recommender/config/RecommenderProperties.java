package com.reelmatch.recommender.config;

import com.reelmatch.recommender.model.SimilarityWeights;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.recommender")
public record RecommenderProperties(
    @NotBlank String dataFile,
    @NotNull @Min(1) @Max(100) Integer recommendations,
    @NotNull @DecimalMin("0.0") Double minSimilarity,
    @NotNull @DecimalMin("0.0") @DecimalMax("10.0") Double minRating,
    @NotNull @Min(1) Integer maxFeatures,
    @NotNull @Valid Weights weights,
    @NotNull @Valid Thresholds thresholds
) {

    public record Weights(
        @NotNull @DecimalMin("0.0") Double genre,
        @NotNull @DecimalMin("0.0") Double rating,
        @NotNull @DecimalMin("0.0") Double content
    ) {
        public SimilarityWeights toSimilarityWeights() {
            return new SimilarityWeights(genre, rating, content);
        }
    }

    /**
     * Fuzzy title thresholds (0-100) per call site.
     */
    public record Thresholds(
        @NotNull @Min(0) @Max(100) Integer seed,
        @NotNull @Min(0) @Max(100) Integer search,
        @NotNull @Min(0) @Max(100) Integer detail
    ) {}
}
