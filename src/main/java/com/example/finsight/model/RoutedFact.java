package com.example.finsight.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

/**
 * 라우터가 확정한 정규 값(캐시 엔트리 값). TTM 이면 분기 4개를 들고 있고 합산은 계산 엔진이 한다.
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@ToString
@EqualsAndHashCode
public class RoutedFact {
    @Singular
    private final List<Fact> facts;
    private final boolean ttm;
    private final String sourceId;
    /** 체인의 첫 원천이 아닌 곳에서 가져왔으면 true */
    private final boolean fallback;
    /** 크기 비교 휴리스틱으로 기간을 고른 경우 true */
    private final boolean heuristic;

    /** 기간 기준이 되는 Fact (TTM 이면 가장 최근 분기) */
    public Fact anchor() {
        return facts.stream()
                .max(Comparator.comparing(Fact::getPeriodEnd))
                .orElseThrow(() -> new IllegalStateException("RoutedFact without facts"));
    }

    public String periodLabel() {
        return anchor().periodLabel();
    }

    public String unit() {
        return anchor().getUnit();
    }
}
