package com.example.finsight.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Yahoo 비공식 API. 키 없이 동작하지만 401/403 차단이 잦아 query1 로 한 번 더 시도한다.
 */
@Component
public class YahooApiClient {

    private static final Logger log = LoggerFactory.getLogger(YahooApiClient.class);

    private final WebClient yahooClient;   // query2
    private final WebClient yahooClient1;  // query1

    private final AtomicInteger uaIndex = new AtomicInteger(0);
    private static final String[] USER_AGENTS = new String[] {
            // 다양한 브라우저 UA 회전으로 Anti-bot 완화
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome Safari",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.3 Safari/605.1.15",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome Safari",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:120.0) Gecko/20100101 Firefox/120.0"
    };

    public YahooApiClient(@Qualifier("yahooClient") WebClient yahooClient,
                          @Qualifier("yahooClient1") WebClient yahooClient1) {
        this.yahooClient = yahooClient;
        this.yahooClient1 = yahooClient1;
    }

    /**
     * fundamentals-timeseries. types 예) quarterlyTotalRevenue, annualTotalRevenue
     */
    public Mono<Map<String, Object>> getTimeseries(String symbol, List<String> types, Instant from, Instant to) {
        String path = "/ws/fundamentals-timeseries/v1/finance/timeseries/" + symbol
                + "?type=" + String.join(",", types)
                + "&period1=" + from.getEpochSecond()
                + "&period2=" + to.getEpochSecond()
                + "&merge=false&padTimeSeries=false&lang=en-US&region=US";
        return getJson(path);
    }

    public Mono<Map<String, Object>> getJson(String path) {
        long started = System.nanoTime();
        return doRequestJson(yahooClient, path)
                .onErrorResume(this::isBlocked, e ->
                        Mono.delay(Duration.ofMillis(250))
                                .then(doRequestJson(yahooClient1, path)))
                .doOnSuccess(r -> log.debug("Yahoo GET {} took {} ms", path, (System.nanoTime() - started) / 1_000_000))
                .doOnError(err -> log.warn("Yahoo GET {} failed after {} ms: {}", path, (System.nanoTime() - started) / 1_000_000, err.toString()));
    }

    private Mono<Map<String, Object>> doRequestJson(WebClient client, String path) {
        return client.get().uri(path)
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> {
                    h.set("Accept-Language", "en-US,en;q=0.9");
                    h.set("User-Agent", nextUserAgent());
                    h.set("Origin", "https://finance.yahoo.com");
                    h.set("Referer", "https://finance.yahoo.com/");
                })
                .exchangeToMono(this::handleJson);
    }

    private Mono<Map<String, Object>> handleJson(ClientResponse resp) {
        if (resp.statusCode().isError()) {
            return resp.createException().flatMap(Mono::error);
        }
        String ct = resp.headers().contentType().map(MediaType::toString).orElse("<none>");
        if (!ct.contains("json")) {
            return resp.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(body -> {
                        String preview = body.length() > 256 ? body.substring(0, 256) + "..." : body;
                        log.warn("Yahoo non-JSON response: contentType={}, preview={}",
                                ct, preview.replace('\n', ' ').replace('\r', ' '));
                        return Mono.error(new DecodingException("Yahoo returned non-JSON (" + ct + ")"));
                    });
        }
        return resp.bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {});
    }

    private boolean isBlocked(Throwable e) {
        if (e instanceof WebClientResponseException w) {
            int s = w.getStatusCode().value();
            return s == 401 || s == 403;
        }
        return false;
    }

    private String nextUserAgent() {
        int idx = Math.abs(uaIndex.getAndIncrement());
        return USER_AGENTS[idx % USER_AGENTS.length];
    }
}
