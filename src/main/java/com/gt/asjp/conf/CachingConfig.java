package com.gt.asjp.conf;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableCaching
public class CachingConfig {

    // Word lists never change after start-up, so cached comparisons are never evicted
    public static final String LANGUAGE_COMPARISONS = "language_comparisons";

    @Bean
    public CacheManager getComparisonCacheManager() {
        return new ConcurrentMapCacheManager(LANGUAGE_COMPARISONS);
    }
}
