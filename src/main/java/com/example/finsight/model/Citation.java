package com.example.finsight.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDate;

@Getter
@Setter
@ToString
@EqualsAndHashCode
@Schema(description = "값의 출처")
public class Citation {
    @Schema(description = "원천 id", example = "regulatory-filing")
    private String source;

    @Schema(description = "원문 URL", example = "https://www.sec.gov/Archives/edgar/data/320193/000032019324000123/")
    private String url;

    @Schema(description = "회계 기간", example = "2024-Q4")
    private String period;

    @Schema(description = "공시 양식(있을 때)", example = "10-K")
    private String form;

    @Schema(description = "제출일(있을 때)")
    private LocalDate filed;
}
