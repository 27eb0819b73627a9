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
public class FinnhubClient {

    private static final Logger log = LoggerFactory.getLogger(FinnhubClient.class);

    private final WebClient http;
    private final String apiKey;

    public FinnhubClient(@Qualifier("finnhubHttp") WebClient http,
                         @Value("${finnhub.apiKey:}") String apiKey) {
        this.http = http;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    public boolean isEnabled() { return !apiKey.isBlank(); }

    /** Quote endpoint: https://finnhub.io/api/v1/quote?symbol=AAPL&token=... */
    public Mono<Map<String, Object>> getQuote(String symbol) {
        return get("/api/v1/quote", symbol);
    }

    /** Profile2: shareOutstanding 은 백만 주 단위 */
    public Mono<Map<String, Object>> getProfile(String symbol) {
        return get("/api/v1/stock/profile2", symbol);
    }

    private Mono<Map<String, Object>> get(String path, String symbol) {
        if (!isEnabled()) return Mono.empty();
        return http.get()
                .uri(uriBuilder -> uriBuilder
                        .path(path)
                        .queryParam("symbol", symbol)
                        .queryParam("token", apiKey)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .doOnError(e -> log.warn("Finnhub {} failed for {}: {}", path, symbol, e.toString()));
    }
}
