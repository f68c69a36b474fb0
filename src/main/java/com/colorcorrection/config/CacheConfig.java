package com.colorcorrection.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Caffeine caches.
 *
 * GPU PROBE CACHE - one entry holding the result of GPU detection.
 * Probing loads driver state, so it runs once per TTL instead of per batch.
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${app.gpu.cache-ttl-minutes:60}")
    private int gpuCacheTtlMinutes;

    @Bean
    public Cache<String, Boolean> gpuProbeCache() {
        log.info("Creating GPU probe cache: ttl={}m", gpuCacheTtlMinutes);
        return Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(Duration.ofMinutes(gpuCacheTtlMinutes))
                .recordStats()
                .build();
    }
}
