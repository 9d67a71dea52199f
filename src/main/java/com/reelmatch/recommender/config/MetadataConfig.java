package com.reelmatch.recommender.config;

import com.reelmatch.recommender.infra.RateLimiter;
import com.reelmatch.recommender.metadata.MetadataCache;
import com.reelmatch.recommender.metadata.MetadataClient;
import com.reelmatch.recommender.metadata.NoopMetadataClient;
import com.reelmatch.recommender.metadata.TmdbMetadataClient;
import com.reelmatch.recommender.model.MovieDetails;
import com.reelmatch.recommender.model.MovieMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Slf4j
@Configuration
public class MetadataConfig {

    @Bean
    public MetadataClient metadataClient(TmdbProperties properties,
                                         @Qualifier("tmdbLimiter") RateLimiter tmdbLimiter,
                                         RestClient.Builder restClientBuilder) {
        if (!properties.enabled()) {
            log.warn("app.tmdb.api-key is not set, movie metadata enrichment is disabled");
            return new NoopMetadataClient();
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.timeout());
        requestFactory.setReadTimeout(properties.timeout());

        RestClient restClient = restClientBuilder
            .baseUrl(properties.baseUrl())
            .requestFactory(requestFactory)
            .build();

        return new TmdbMetadataClient(
            restClient,
            tmdbLimiter,
            properties.apiKey(),
            properties.language(),
            properties.imageBaseUrl()
        );
    }

    @Bean("titleMetadataCache")
    public MetadataCache<String, MovieMetadata> titleMetadataCache(TmdbProperties properties) {
        return new MetadataCache<>("title", properties.cacheMaximumSize(), properties.cacheTtl());
    }

    @Bean("detailsMetadataCache")
    public MetadataCache<Long, MovieDetails> detailsMetadataCache(TmdbProperties properties) {
        return new MetadataCache<>("details", properties.cacheMaximumSize(), properties.cacheTtl());
    }
}
