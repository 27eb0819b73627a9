package com.example.finsight.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@Schema(description = "조회 가능한 지표")
public class MetricInfo {
    @Schema(description = "이름", example = "grossMargin")
    private String name;

    @Schema(description = "base(원천 항목) 또는 derived(파생 지표)", example = "derived")
    private String kind;

    @Schema(description = "입력 이름")
    private List<String> inputs;

    @Schema(description = "계산식")
    private String formula;

    @Schema(description = "단위", example = "ratio")
    private String unit;
}
