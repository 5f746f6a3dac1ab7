package com.churnmetrics.api.account;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.NonNull;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Beans used by the account package.
 */
@Configuration
class AccountBeans {

    static final String CACHE_NAME = "account_cache";

    @NonNull
    @Bean(name = CACHE_NAME)
    Cache cache(@NonNull AccountConfiguration config) {
        return new CaffeineCache(CACHE_NAME, Caffeine.newBuilder()
            .expireAfterWrite(config.getCacheTtl())
            .initialCapacity(100)
            .maximumSize(10000)
            .recordStats()
            .build());
    }
}
