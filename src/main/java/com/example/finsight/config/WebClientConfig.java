package com.example.finsight.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    private static final String BROWSER_UA = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome Safari";

    private static WebClient mk(String baseUrl, String userAgent) {
        HttpClient http = HttpClient.create()
                .followRedirect(true)
                .compress(true)
                .responseTimeout(Duration.ofSeconds(12))
                .httpResponseDecoder(h -> h
                        .maxHeaderSize(64 * 1024)
                        .maxInitialLineLength(8 * 1024));

        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(http))
                // SEC companyfacts 는 대형 기업의 경우 수십 MB
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
                        .build())
                .defaultHeader("User-Agent", userAgent)
                .build();
    }

    // SEC 는 연락처가 포함된 User-Agent 를 요구한다
    @Bean("secDataHttp")
    public WebClient secDataHttp(@Value("${sec.userAgent:finsight-java-lite admin@example.com}") String ua) {
        return mk("https://data.sec.gov", ua);
    }

    @Bean("secWwwHttp")
    public WebClient secWwwHttp(@Value("${sec.userAgent:finsight-java-lite admin@example.com}") String ua) {
        return mk("https://www.sec.gov", ua);
    }

    @Bean("alphaVantageHttp")
    public WebClient alphaVantageHttp() {
        return mk("https://www.alphavantage.co", BROWSER_UA);
    }

    @Bean("finnhubHttp")
    public WebClient finnhubHttp() {
        return mk("https://finnhub.io", BROWSER_UA);
    }

    @Bean("yahooClient")
    public WebClient yahooClient() {
        return mk("https://query2.finance.yahoo.com", BROWSER_UA);
    }

    @Bean("yahooClient1")
    public WebClient yahooClient1() {
        return mk("https://query1.finance.yahoo.com", BROWSER_UA);
    }
}
