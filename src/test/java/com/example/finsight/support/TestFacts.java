package com.example.finsight.support;

import com.example.finsight.config.FinanceProperties;
import com.example.finsight.model.Concept;
import com.example.finsight.model.EntityRef;
import com.example.finsight.model.Fact;
import com.example.finsight.model.Frequency;
import com.example.finsight.model.RoutedFact;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * 테스트용 Fact/설정 생성기.
 */
public final class TestFacts {

    public static final EntityRef AAPL = EntityRef.ofCik("AAPL", "0000320193", "Apple Inc.");

    private TestFacts() {}

    public static Fact quarter(String concept, String source, int fy, int fq, String end, String value) {
        return Fact.builder()
                .entityId(AAPL.getId())
                .concept(concept)
                .periodEnd(LocalDate.parse(end))
                .fiscalYear(fy)
                .fiscalQuarter(fq)
                .frequency(Frequency.Q)
                .value(new BigDecimal(value))
                .unit(Concept.require(concept).unit())
                .sourceId(source)
                .url("https://example.test/" + source + "/" + fy + "-Q" + fq)
                .form("10-Q")
                .filed(LocalDate.parse(end).plusDays(30))
                .retrievedAt(Instant.parse("2025-01-01T00:00:00Z"))
                .build();
    }

    public static Fact annual(String concept, String source, int fy, String end, String value) {
        return Fact.builder()
                .entityId(AAPL.getId())
                .concept(concept)
                .periodEnd(LocalDate.parse(end))
                .fiscalYear(fy)
                .frequency(Frequency.A)
                .value(new BigDecimal(value))
                .unit(Concept.require(concept).unit())
                .sourceId(source)
                .url("https://example.test/" + source + "/" + fy)
                .form("10-K")
                .filed(LocalDate.parse(end).plusDays(35))
                .retrievedAt(Instant.parse("2025-01-01T00:00:00Z"))
                .build();
    }

    public static RoutedFact routed(Fact fact) {
        return RoutedFact.builder().fact(fact).sourceId(fact.getSourceId()).build();
    }

    /** Apple FY2024 분기 매출(USD) */
    public static List<Fact> appleRevenueQuarters(String source) {
        return List.of(
                quarter("revenue", source, 2024, 1, "2023-12-30", "119575000000"),
                quarter("revenue", source, 2024, 2, "2024-03-30", "90753000000"),
                quarter("revenue", source, 2024, 3, "2024-06-29", "85777000000"),
                quarter("revenue", source, 2024, 4, "2024-09-28", "94930000000"));
    }

    /** 재시도 backoff 를 짧게, AAPL 분기 매출 범위 [20B, 120B] */
    public static FinanceProperties properties() {
        FinanceProperties props = new FinanceProperties();
        props.getRouter().setBackoff(Duration.ofMillis(1));
        props.getRouter().setAdapterTimeout(Duration.ofSeconds(2));
        props.getStore().setL2Enabled(false);
        FinanceProperties.Rule rule = new FinanceProperties.Rule();
        rule.setTicker("AAPL");
        rule.setConcept("revenue");
        rule.setFrequency("Q");
        rule.setMin(new BigDecimal("20000000000"));
        rule.setMax(new BigDecimal("120000000000"));
        props.getValidation().getRules().add(rule);
        return props;
    }
}
