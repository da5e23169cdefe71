package com.trendlens.engine.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Read caches for the listing views. Every append clears them. */
@Configuration
@EnableCaching
public class CacheConfig {

  public static final String LATEST = "latest";
  public static final String BY_DATE = "byDate";
  public static final String TRENDING = "trending";

  @Bean
  public CacheManager cacheManager(@Value("${trendlens.cache.ttl-minutes:15}") long ttlMinutes,
                                   @Value("${trendlens.cache.max-entries:1000}") long maxEntries) {
    CaffeineCacheManager manager = new CaffeineCacheManager(LATEST, BY_DATE, TRENDING);
    manager.setCaffeine(Caffeine.newBuilder()
        .recordStats()
        .maximumSize(maxEntries)
        .expireAfterWrite(Duration.ofMinutes(ttlMinutes)));
    return manager;
  }
}
