package com.example.finsight.service.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis 문자열(JSON) 캐시. 장애 시 캐시 미스로 취급한다.
 */
@Service
public class RedisCacheService {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheService.class);

    private final ReactiveStringRedisTemplate redis;
    private final ObjectMapper mapper;

    public RedisCacheService(ReactiveStringRedisTemplate redis, ObjectMapper mapper) {
        this.redis = redis;
        this.mapper = mapper;
    }

    public <T> Mono<T> get(String key, TypeReference<T> type) {
        return redis.opsForValue().get(key)
                .flatMap(json -> Mono.fromCallable(() -> mapper.readValue(json, type)))
                .onErrorResume(e -> {
                    log.debug("Redis get {} failed: {}", key, e.toString());
                    return Mono.empty();
                });
    }

    public Mono<Boolean> set(String key, Object value, Duration ttl) {
        return Mono.fromCallable(() -> mapper.writeValueAsString(value))
                .flatMap(js -> redis.opsForValue().set(key, js, ttl))
                .onErrorResume(e -> {
                    log.debug("Redis set {} failed: {}", key, e.toString());
                    return Mono.just(false);
                });
    }

    public Mono<Boolean> delete(String key) {
        return redis.opsForValue().delete(key)
                .onErrorResume(e -> {
                    log.debug("Redis delete {} failed: {}", key, e.toString());
                    return Mono.just(false);
                });
    }
}
