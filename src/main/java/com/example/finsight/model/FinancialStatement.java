package com.example.finsight.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.List;

@Getter
@Setter
@Schema(description = "한 기간의 재무제표 항목 모음")
public class FinancialStatement {
    @Schema(description = "티커", example = "AAPL")
    private String ticker;

    @Schema(description = "재무제표 종류 income|balance|cashflow", example = "income")
    private String statement;

    @Schema(description = "요청 기간", example = "2024-Q4")
    private String period;

    @Schema(description = "빈도(Q/A)", example = "Q")
    private Frequency frequency;

    @Schema(description = "항목별 계산 결과(항목 정의 순서)")
    private List<KpiResult> lineItems;

    @Schema(description = "값을 구하지 못한 항목과 사유. 예) epsDiluted: NotFound")
    private List<String> missing;

    @Schema(description = "기준일")
    private LocalDate asOf;
}
