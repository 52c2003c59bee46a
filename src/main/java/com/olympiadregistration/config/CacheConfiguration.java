package com.olympiadregistration.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Caffeine caching for static reference data.
 *
 * Only data that cannot change while the service runs is cached. Registration
 * records, file visibility and exports are always read fresh.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfiguration {

    @Bean
    public CacheManager cacheManager() {
        log.info("Configuring Caffeine cache for reference data");

        CaffeineCacheManager cacheManager = new CaffeineCacheManager();

        cacheManager.setCaffeine(Caffeine.newBuilder()
            .maximumSize(100)
            .recordStats()
        );

        cacheManager.setCacheNames(List.of(
            "roster"    // Country and person numbers from previous events
        ));

        return cacheManager;
    }
}
