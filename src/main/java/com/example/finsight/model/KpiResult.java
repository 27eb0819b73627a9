package com.example.finsight.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Getter
@Setter
@ToString
@EqualsAndHashCode
@Schema(description = "KPI 계산 결과")
public class KpiResult {
    @Schema(description = "티커", example = "AAPL")
    private String ticker;

    @Schema(description = "지표 이름", example = "grossMargin")
    private String metric;

    @Schema(description = "값(비율은 소수 6자리, 금액은 소수 2자리)", example = "0.462")
    private BigDecimal value;

    @Schema(description = "단위", example = "ratio")
    private String unit;

    @Schema(description = "회계 기간", example = "2024-Q4")
    private String period;

    @Schema(description = "기말일")
    private LocalDate periodEnd;

    @Schema(description = "빈도(Q/A)", example = "Q")
    private Frequency frequency;

    @Schema(description = "최근 4개 분기 합산 여부")
    private boolean ttm;

    @Schema(description = "신뢰도 high|medium|low", example = "high")
    private Confidence confidence;

    @Schema(description = "계산식(기본 항목이면 null)", example = "grossProfit / revenue")
    private String formula;

    @Schema(description = "입력 추적")
    private List<InputTrace> inputs;

    @Schema(description = "출처 목록(원천+기간 기준 중복 제거)")
    private List<Citation> citations;

    @Schema(description = "품질 경고. 예) PERIOD_MISMATCH, HEURISTIC_PERIOD, FALLBACK_SOURCE, ZERO_RESULT")
    private List<String> warnings;

    @Schema(description = "기준일(이 날짜 이후 기말 값은 제외)")
    private LocalDate asOf;
}
