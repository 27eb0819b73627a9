package com.example.finsight.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

@Getter
@Setter
@ToString
@EqualsAndHashCode
@Schema(description = "계산에 쓰인 입력(중첩 트리)")
public class InputTrace {
    @Schema(description = "항목 또는 지표 이름", example = "revenue")
    private String name;

    @Schema(description = "값")
    private BigDecimal value;

    @Schema(description = "단위", example = "USD")
    private String unit;

    @Schema(description = "회계 기간", example = "2024-Q4")
    private String period;

    @Schema(description = "파생 지표의 식(기본 항목이면 null)", example = "revenue - costOfRevenue")
    private String formula;

    @Schema(description = "기본 항목의 원천 id")
    private String source;

    @Schema(description = "우선 원천이 아닌 곳에서 가져왔는지")
    private Boolean fallback;

    @Schema(description = "하위 입력")
    private List<InputTrace> inputs;
}
