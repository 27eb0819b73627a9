package com.example.finsight.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * 원천 하나가 보고한 수치 하나. 생성 후 변경하지 않는다(재조회 시 새 Fact).
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@ToString
@EqualsAndHashCode
public class Fact {
    private final String entityId;
    private final String concept;
    private final LocalDate periodEnd;
    private final Integer fiscalYear;
    /** 1~4, 연간 값이면 null */
    private final Integer fiscalQuarter;
    private final Frequency frequency;
    private final BigDecimal value;
    private final String unit;
    private final String sourceId;
    private final String url;
    /** 10-Q, 10-K, 10-Q/A ... 원천이 양식 정보를 주지 않으면 null */
    private final String form;
    private final LocalDate filed;
    private final Instant retrievedAt;

    public boolean isAmendment() {
        return form != null && form.toUpperCase().endsWith("/A");
    }

    /** 2024-Q4, 2024 또는 회계연도 정보가 없으면 기말일 */
    public String periodLabel() {
        if (fiscalYear == null) return periodEnd == null ? "" : periodEnd.toString();
        if (frequency == Frequency.Q && fiscalQuarter != null) return fiscalYear + "-Q" + fiscalQuarter;
        return String.valueOf(fiscalYear);
    }
}
