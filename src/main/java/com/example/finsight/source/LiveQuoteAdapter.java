package com.example.finsight.source;

import com.example.finsight.http.FinnhubClient;
import com.example.finsight.model.Concept;
import com.example.finsight.model.EntityRef;
import com.example.finsight.model.Fact;
import com.example.finsight.model.Frequency;
import com.example.finsight.period.PeriodRequest;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.finsight.util.JsonMaps.asDecimal;

/**
 * Finnhub 현재가/발행주식수. 값은 조회 시점 기준이라 회계기간 정보가 없다.
 */
@Component
public class LiveQuoteAdapter implements SourceAdapter {

    public static final String ID = "live-quote";

    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000L);

    private final FinnhubClient finnhub;

    public LiveQuoteAdapter(FinnhubClient finnhub) {
        this.finnhub = finnhub;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public int tier() {
        return 2;
    }

    @Override
    public Set<String> supportedConcepts() {
        return Set.of(Concept.PRICE.id(), Concept.SHARES_OUTSTANDING.id());
    }

    @Override
    public boolean isEnabled() {
        return finnhub.isEnabled();
    }

    @Override
    public Mono<List<Fact>> fetch(EntityRef entity, String concept, PeriodRequest hint) {
        String symbol = entity.getTicker();
        Mono<BigDecimal> value;
        if (Concept.PRICE.id().equals(concept)) {
            // c: current price. 모르는 심볼이면 0 으로 온다
            value = finnhub.getQuote(symbol).map(body -> positive(body, "c"));
        } else if (Concept.SHARES_OUTSTANDING.id().equals(concept)) {
            value = finnhub.getProfile(symbol).map(body -> positive(body, "shareOutstanding").multiply(MILLION));
        } else {
            return Mono.error(SourceException.notFound(ID, "Unsupported concept " + concept));
        }
        Concept c = Concept.require(concept);
        Frequency freq = hint == null || hint.getFrequency() == null ? Frequency.Q : hint.getFrequency();
        return value
                .switchIfEmpty(Mono.error(new SourceException(ID, SourceException.Reason.UNAVAILABLE, "Finnhub disabled")))
                .map(v -> List.of(Fact.builder()
                        .entityId(entity.getId())
                        .concept(c.id())
                        .periodEnd(LocalDate.now(ZoneOffset.UTC))
                        .frequency(freq)
                        .value(v)
                        .unit(c.unit())
                        .sourceId(ID)
                        .url("https://finnhub.io/quote/" + symbol)
                        .retrievedAt(Instant.now())
                        .build()))
                .onErrorMap(e -> SourceErrors.classify(ID, e));
    }

    private BigDecimal positive(Map<String, Object> body, String field) {
        BigDecimal v = asDecimal(body.get(field));
        if (v == null || v.signum() == 0) {
            throw SourceException.notFound(ID, "No " + field + " in response");
        }
        return v;
    }
}
