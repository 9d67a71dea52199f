package com.reelmatch.recommender.config;

import com.reelmatch.recommender.infra.InMemoryRpmRateLimiter;
import com.reelmatch.recommender.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("tmdbLimiter")
    public RateLimiter tmdbLimiter(TmdbProperties properties) {
        return new InMemoryRpmRateLimiter(properties.requestsPerMinute());
    }
}
