package com.example.finsight.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.List;

@Getter
@Setter
@Schema(description = "원천 상태")
public class SourceStatus {
    @Schema(description = "원천 id", example = "regulatory-filing")
    private String id;

    @Schema(description = "우선순위(낮을수록 우선)", example = "1")
    private int tier;

    @Schema(description = "활성 여부(자격 증명/설정)")
    private boolean enabled;

    @Schema(description = "연속 장애로 체인 뒤로 밀린 상태인지")
    private boolean degraded;

    @Schema(description = "연속 실패 횟수")
    private int consecutiveFailures;

    @Schema(description = "마지막 성공 시각")
    private Instant lastSuccess;

    @Schema(description = "마지막 실패 시각")
    private Instant lastFailure;

    @Schema(description = "마지막 오류 메시지")
    private String lastError;

    @Schema(description = "제공 항목")
    private List<String> concepts;
}
