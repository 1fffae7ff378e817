package com.simplespell.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Configuration
public class CacheConfig {

    // caches "generation:word" -> ranked suggestions; a rebuild bumps the generation
    @Bean("suggestionCache")
    public Cache<String, List<String>> suggestionCache(
            @Value("${spellcheck.cache.max-size:50000}") long maxSize,
            @Value("${spellcheck.cache.ttl-minutes:10}") long ttlMinutes) {
        return Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(Duration.ofMinutes(ttlMinutes))
                .build();
    }
}
