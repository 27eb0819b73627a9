package com.example.finsight.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.List;

@Getter
@Setter
@Schema(description = "최근 N개 기간의 KPI 값")
public class KpiSeries {
    @Schema(description = "티커", example = "AAPL")
    private String ticker;

    @Schema(description = "지표 이름", example = "revenue")
    private String metric;

    @Schema(description = "빈도(Q/A)", example = "Q")
    private Frequency frequency;

    @Schema(description = "최근 4개 분기 합산 여부")
    private boolean ttm;

    @Schema(description = "요청한 기간 수", example = "12")
    private int limit;

    @Schema(description = "기간별 계산 결과(최근 기간부터)")
    private List<KpiResult> points;

    @Schema(description = "값을 구하지 못한 기간과 사유. 예) 2023-Q1: NotFound")
    private List<String> missing;

    @Schema(description = "기준일")
    private LocalDate asOf;
}
