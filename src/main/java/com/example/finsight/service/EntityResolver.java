package com.example.finsight.service;

import com.example.finsight.http.SecEdgarClient;
import com.example.finsight.model.EntityRef;
import com.example.finsight.model.doc.EntityDoc;
import com.example.finsight.repo.EntityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static com.example.finsight.util.JsonMaps.asDecimal;
import static com.example.finsight.util.JsonMaps.asMap;
import static com.example.finsight.util.JsonMaps.asString;

/**
 * 티커 → EntityRef. 로컬 entities 컬렉션을 먼저 보고 없으면 SEC 티커 표에서 CIK 를 찾는다.
 * CIK 를 못 찾으면 티커만으로 된 엔티티를 돌려준다(시장 데이터 원천은 티커로 조회 가능).
 */
@Component
public class EntityResolver {

    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    private final EntityRepository entityRepo;
    private final Mono<Map<String, EntityRef>> secTickers;

    public EntityResolver(EntityRepository entityRepo, SecEdgarClient sec) {
        this.entityRepo = entityRepo;
        // 성공한 표는 12시간 재사용, 실패는 캐시하지 않음
        this.secTickers = sec.getCompanyTickers()
                .map(EntityResolver::parseTickers)
                .cache(ok -> Duration.ofHours(12), err -> Duration.ZERO, () -> Duration.ZERO);
    }

    // CIK 없는 결과(SEC 표 장애 포함)는 캐시하지 않는다. 표 자체는 secTickers 가 성공 시에만 보관
    @Cacheable(cacheNames = "entities", key = "#raw", unless = "#result == null || !#result.hasCik()")
    public Mono<EntityRef> resolve(String raw) {
        String t = normalize(raw);
        return entityRepo.findByTicker(t)
                .map(EntityResolver::toRef)
                .onErrorResume(e -> {
                    log.warn("Entity lookup in Mongo failed for {}: {}", t, e.toString());
                    return Mono.empty();
                })
                .switchIfEmpty(Mono.defer(() -> fromSec(t)));
    }

    static String normalize(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("ticker is required");
        String t = raw.trim().toUpperCase(Locale.ROOT);
        if (!t.matches("[A-Z0-9.\\-]{1,12}")) throw new IllegalArgumentException("Invalid ticker: " + raw);
        return t;
    }

    private Mono<EntityRef> fromSec(String ticker) {
        return secTickers
                .map(m -> m.getOrDefault(ticker.replace('.', '-'), EntityRef.ofTicker(ticker)))
                .onErrorResume(e -> {
                    log.warn("SEC ticker map unavailable, using bare ticker {}: {}", ticker, e.toString());
                    return Mono.just(EntityRef.ofTicker(ticker));
                })
                .defaultIfEmpty(EntityRef.ofTicker(ticker));
    }

    private static EntityRef toRef(EntityDoc doc) {
        if (doc.getCik() == null || doc.getCik().isBlank()) return EntityRef.ofTicker(doc.getTicker());
        return EntityRef.ofCik(doc.getTicker(), doc.getCik(), doc.getName());
    }

    static Map<String, EntityRef> parseTickers(Map<String, Object> body) {
        Map<String, EntityRef> out = new HashMap<>();
        for (Object v : body.values()) {
            Map<String, Object> row = asMap(v);
            if (row == null) continue;
            String ticker = asString(row.get("ticker"));
            BigDecimal cik = asDecimal(row.get("cik_str"));
            if (ticker == null || cik == null) continue;
            String t = ticker.toUpperCase(Locale.ROOT);
            String cik10 = String.format("%010d", cik.longValue());
            // 같은 티커가 여러 번 나오면 첫 행(주 종목)을 유지
            out.putIfAbsent(t, EntityRef.ofCik(t.replace('-', '.'), cik10, asString(row.get("title"))));
        }
        return out;
    }
}
