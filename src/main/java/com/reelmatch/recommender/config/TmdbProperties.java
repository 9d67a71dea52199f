package com.reelmatch.recommender.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.tmdb")
public record TmdbProperties(
    String apiKey,
    @NotBlank String baseUrl,
    @NotBlank String imageBaseUrl,
    @NotBlank String language,
    @NotNull @Min(1) Integer requestsPerMinute,
    @NotNull Duration timeout,
    @NotNull @Min(1) Long cacheMaximumSize,
    @NotNull Duration cacheTtl
) {
    public boolean enabled() {
        return apiKey != null && !apiKey.isBlank();
    }
}
