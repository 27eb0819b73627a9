package com.example.finsight.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * SEC EDGAR 공개 API. 키가 필요 없고 User-Agent 만 요구한다.
 */
@Component
public class SecEdgarClient {

    private static final Logger log = LoggerFactory.getLogger(SecEdgarClient.class);

    private final WebClient data;
    private final WebClient www;

    public SecEdgarClient(@Qualifier("secDataHttp") WebClient data,
                          @Qualifier("secWwwHttp") WebClient www) {
        this.data = data;
        this.www = www;
    }

    /** XBRL companyfacts: https://data.sec.gov/api/xbrl/companyfacts/CIK0000320193.json */
    public Mono<Map<String, Object>> getCompanyFacts(String cik10) {
        long started = System.nanoTime();
        return data.get()
                .uri("/api/xbrl/companyfacts/CIK{cik}.json", cik10)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .doOnSuccess(r -> log.debug("SEC companyfacts {} took {} ms", cik10, (System.nanoTime() - started) / 1_000_000))
                .doOnError(e -> log.warn("SEC companyfacts failed for {}: {}", cik10, e.toString()));
    }

    /** 전체 티커 → CIK 표: {"0":{"cik_str":320193,"ticker":"AAPL","title":"Apple Inc."},...} */
    public Mono<Map<String, Object>> getCompanyTickers() {
        return www.get()
                .uri("/files/company_tickers.json")
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .doOnError(e -> log.warn("SEC company_tickers failed: {}", e.toString()));
    }

    public static String filingUrl(String cik, String accession) {
        String cikNum = cik == null ? "" : cik.replaceFirst("^0+", "");
        String acc = accession == null ? "" : accession.replace("-", "");
        return "https://www.sec.gov/Archives/edgar/data/" + cikNum + "/" + acc + "/";
    }
}
