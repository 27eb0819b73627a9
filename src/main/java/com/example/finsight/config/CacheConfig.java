package com.example.finsight.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 엔티티 해석 같은 보조 조회용 캐시. Fact 캐시는 FactStore 가 직접 관리한다.
 */
@Configuration
public class CacheConfig {
    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cm = new CaffeineCacheManager("entities");
        cm.setCaffeine(Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(Duration.ofHours(12)));
        // Reactive @Cacheable(Mono/Flux) 사용 시 AsyncCache 필요
        cm.setAsyncCacheMode(true);
        return cm;
    }
}
