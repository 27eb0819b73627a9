package com.example.finsight.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("finsight-java-lite API")
                        .version("0.1.0")
                        .description("SEC/AlphaVantage/Finnhub/Yahoo 원천 Fact 집계 및 KPI 계산 API"));
    }

    /**
     * 계산 API 의 실패 응답(problem details)을 문서에 서술적으로 추가.
     */
    @Bean
    public OpenApiCustomizer problemResponses() {
        return openApi -> {
            if (openApi.getPaths() == null) return;
            Schema<?> problem = new Schema<>().type("object")
                    .addProperty("type", new Schema<String>().type("string"))
                    .addProperty("title", new Schema<String>().type("string"))
                    .addProperty("detail", new Schema<String>().type("string"))
                    .addProperty("status", new Schema<Integer>().type("integer").format("int32"));
            Map<String, String> codes = Map.of(
                    "400", "BadRequest: period/freq 형식 오류",
                    "404", "NotFound: 엔티티/지표/기간 데이터 없음",
                    "409", "AmbiguousPeriod: 기간 확정 불가",
                    "422", "ValidationFailed / InsufficientHistory / Undefined",
                    "503", "SourceUnavailable: 모든 원천 일시 장애",
                    "504", "DeadlineExceeded: 요청 제한 시간 초과");
            openApi.getPaths().forEach((path, item) -> {
                if (!(path.startsWith("/v1/finance/calc/{ticker}") || path.startsWith("/v1/finance/statements/"))
                        || item.getGet() == null || item.getGet().getResponses() == null) return;
                codes.forEach((code, desc) -> item.getGet().getResponses().addApiResponse(code,
                        new ApiResponse().description(desc).content(new Content()
                                .addMediaType("application/problem+json", new MediaType().schema(problem)))));
            });
        };
    }
}
