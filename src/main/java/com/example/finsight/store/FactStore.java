package com.example.finsight.store;

import com.example.finsight.config.FinanceProperties;
import com.example.finsight.model.Concept;
import com.example.finsight.model.RoutedFact;
import com.example.finsight.service.cache.RedisCacheService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 확정된 Fact 캐시. L1 Caffeine(엔트리별 TTL) + 선택적 L2 Redis.
 * 같은 키의 동시 조회는 원천 호출 하나로 합친다(single-flight).
 */
@Component
public class FactStore {

    private static final Logger log = LoggerFactory.getLogger(FactStore.class);
    private static final TypeReference<RoutedFact> ROUTED = new TypeReference<>() {};

    private final Cache<FactKey, Entry> l1;
    private final RedisCacheService l2;
    private final Duration factTtl;
    private final Duration liveTtl;
    private final ConcurrentHashMap<FactKey, InFlight> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public FactStore(FinanceProperties props, ObjectProvider<RedisCacheService> redis) {
        this(props, props.getStore().isL2Enabled() ? redis.getIfAvailable() : null, Ticker.systemTicker());
    }

    FactStore(FinanceProperties props, RedisCacheService l2, Ticker ticker) {
        FinanceProperties.Store cfg = props.getStore();
        this.factTtl = cfg.getFactTtl();
        this.liveTtl = cfg.getLiveTtl();
        this.l2 = l2;
        this.l1 = Caffeine.newBuilder()
                .maximumSize(cfg.getMaximumSize())
                .ticker(ticker)
                .expireAfter(new Expiry<FactKey, Entry>() {
                    @Override
                    public long expireAfterCreate(FactKey key, Entry value, long currentTime) {
                        return value.ttl.toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(FactKey key, Entry value, long currentTime, long currentDuration) {
                        return value.ttl.toNanos();
                    }

                    @Override
                    public long expireAfterRead(FactKey key, Entry value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    /** 메모리 조회만 한다. 네트워크를 기다리지 않는다 */
    public Optional<RoutedFact> get(FactKey key) {
        Entry e = l1.getIfPresent(key);
        return e == null ? Optional.empty() : Optional.of(e.value);
    }

    /** L1, 그다음 L2. L2 적중 시 L1 을 채운다 */
    public Mono<RoutedFact> lookup(FactKey key) {
        Optional<RoutedFact> hit = get(key);
        if (hit.isPresent()) return Mono.just(hit.get());
        if (l2 == null) return Mono.empty();
        return l2.get(key.redisKey(), ROUTED)
                .doOnNext(v -> l1.put(key, new Entry(v, ttlFor(key))));
    }

    /**
     * 캐시에 없으면 fetch 를 실행한다. 같은 키로 진행 중인 fetch 가 있으면 그 결과를 기다린다.
     * 성공 값은 캐시에 넣고, 오류는 캐시하지 않고 모든 대기자에게 같은 오류를 전달한다.
     * 대기자가 모두 취소하면 원천 호출도 취소된다.
     */
    public Mono<RoutedFact> getOrFetch(FactKey key, Supplier<Mono<RoutedFact>> fetch) {
        return Mono.defer(() -> {
            Entry hit = l1.getIfPresent(key);
            if (hit != null) return Mono.just(hit.value);
            InFlight flight = inFlight.computeIfAbsent(key,
                    k -> l1.getIfPresent(k) != null ? null : new InFlight(k, fetch));
            if (flight == null || !flight.join()) {
                // 직전에 완료되었거나 취소된 fetch
                return getOrFetch(key, fetch);
            }
            return flight.sink.asMono()
                    .doOnSubscribe(s -> flight.start())
                    .doOnCancel(flight::leave);
        });
    }

    public void put(FactKey key, RoutedFact value, Duration ttl) {
        l1.put(key, new Entry(value, ttl));
        if (l2 != null) {
            l2.set(key.redisKey(), value, ttl).subscribe();
        }
    }

    public void put(FactKey key, RoutedFact value) {
        put(key, value, ttlFor(key));
    }

    public void invalidate(FactKey key) {
        l1.invalidate(key);
        if (l2 != null) {
            l2.delete(key.redisKey()).subscribe();
        }
    }

    public Duration ttlFor(FactKey key) {
        return Concept.of(key.getConcept()).map(Concept::isLive).orElse(false) ? liveTtl : factTtl;
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private static final class Entry {
        final RoutedFact value;
        final Duration ttl;

        Entry(RoutedFact value, Duration ttl) {
            this.value = value;
            this.ttl = ttl;
        }
    }

    private final class InFlight {
        final FactKey key;
        final Supplier<Mono<RoutedFact>> fetch;
        final Sinks.One<RoutedFact> sink = Sinks.one();
        /** -1 이면 모든 대기자가 떠나 닫힌 상태 */
        final AtomicInteger waiters = new AtomicInteger();
        final AtomicBoolean started = new AtomicBoolean();
        final Disposable.Swap upstream = Disposables.swap();

        InFlight(FactKey key, Supplier<Mono<RoutedFact>> fetch) {
            this.key = key;
            this.fetch = fetch;
        }

        boolean join() {
            for (;;) {
                int n = waiters.get();
                if (n < 0) return false;
                if (waiters.compareAndSet(n, n + 1)) return true;
            }
        }

        void leave() {
            if (waiters.decrementAndGet() == 0 && waiters.compareAndSet(0, -1)) {
                inFlight.remove(key, this);
                upstream.dispose();
                log.debug("fetch for {} cancelled by all waiters", key);
            }
        }

        void start() {
            if (!started.compareAndSet(false, true)) return;
            upstream.update(Mono.defer(fetch)
                    .switchIfEmpty(Mono.error(() -> new IllegalStateException("Empty fetch for " + key)))
                    .subscribe(
                            v -> {
                                put(key, v);
                                inFlight.remove(key, this);
                                sink.tryEmitValue(v);
                            },
                            e -> {
                                inFlight.remove(key, this);
                                sink.tryEmitError(e);
                            }));
        }
    }
}
