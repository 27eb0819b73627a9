package com.example.finsight.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

@Component
public class AlphaVantageClient {

    private static final Logger log = LoggerFactory.getLogger(AlphaVantageClient.class);

    private final WebClient http;
    private final String apiKey;

    public AlphaVantageClient(@Qualifier("alphaVantageHttp") WebClient http,
                              @Value("${alphaVantage.apiKey:}") String apiKey) {
        this.http = http;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean isEnabled() {
        return !this.apiKey.isBlank();
    }

    /**
     * 재무제표 조회. function 은 INCOME_STATEMENT, BALANCE_SHEET, CASH_FLOW, EARNINGS 중 하나.
     * 응답은 annualReports / quarterlyReports 배열을 가진다.
     */
    public Mono<Map<String, Object>> getStatement(String function, String symbol) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/query")
                        .queryParam("function", function)
                        .queryParam("symbol", symbol)
                        .queryParam("apikey", apiKey)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .doOnError(e -> log.warn("AlphaVantage {} failed for {}: {}", function, symbol, e.toString()));
    }
}
