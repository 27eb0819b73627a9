package com.example.finsight.source;

import com.example.finsight.http.AlphaVantageClient;
import com.example.finsight.model.Fact;
import com.example.finsight.model.Frequency;
import com.example.finsight.period.PeriodRequest;
import com.example.finsight.support.TestFacts;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketDataAdapterTest {

    private static final PeriodRequest HINT = PeriodRequest.latest(Frequency.Q, LocalDate.parse("2025-01-15"));

    private static final String INCOME_STATEMENT = "{"
            + "\"symbol\":\"AAPL\","
            + "\"annualReports\":["
            + "{\"fiscalDateEnding\":\"2024-09-30\",\"reportedCurrency\":\"USD\",\"totalRevenue\":\"391035000000\",\"costOfRevenue\":\"210352000000\"},"
            + "{\"fiscalDateEnding\":\"2023-09-30\",\"reportedCurrency\":\"USD\",\"totalRevenue\":\"383285000000\",\"costOfRevenue\":\"214137000000\"}],"
            + "\"quarterlyReports\":["
            + "{\"fiscalDateEnding\":\"2024-09-30\",\"reportedCurrency\":\"USD\",\"totalRevenue\":\"94930000000\",\"costOfRevenue\":\"None\"},"
            + "{\"fiscalDateEnding\":\"2024-06-30\",\"reportedCurrency\":\"USD\",\"totalRevenue\":\"85777000000\",\"costOfRevenue\":\"46099000000\"}]"
            + "}";

    private static MarketDataAdapter adapter(String apiKey, String body) {
        WebClient stub = WebClient.builder()
                .exchangeFunction(req -> Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build()))
                .build();
        return new MarketDataAdapter(new AlphaVantageClient(stub, apiKey));
    }

    @Test
    void mapsReportsToFiscalQuarters() {
        List<Fact> facts = adapter("demo", INCOME_STATEMENT).fetch(TestFacts.AAPL, "revenue", HINT).block();

        assertNotNull(facts);
        assertEquals(4, facts.size());
        Fact q = facts.stream()
                .filter(f -> f.getFrequency() == Frequency.Q && f.getPeriodEnd().equals(LocalDate.parse("2024-06-30")))
                .findFirst().orElseThrow();
        assertEquals(2024, q.getFiscalYear());
        assertEquals(3, q.getFiscalQuarter());
        assertEquals(new BigDecimal("85777000000"), q.getValue());
        assertEquals("USD", q.getUnit());
        assertNull(q.getForm());
    }

    @Test
    void skipsNoneValues() {
        List<Fact> facts = adapter("demo", INCOME_STATEMENT).fetch(TestFacts.AAPL, "costOfRevenue", HINT).block();

        assertNotNull(facts);
        assertEquals(3, facts.size());
        assertTrue(facts.stream().noneMatch(f -> f.getPeriodEnd().equals(LocalDate.parse("2024-09-30"))
                && f.getFrequency() == Frequency.Q));
    }

    @Test
    void rateLimitNoteIsRetryable() {
        String note = "{\"Note\":\"Thank you for using Alpha Vantage! Our standard API call frequency is 5 calls per minute.\"}";
        StepVerifier.create(adapter("demo", note).fetch(TestFacts.AAPL, "revenue", HINT))
                .expectErrorSatisfies(e -> {
                    SourceException se = (SourceException) e;
                    assertEquals(SourceException.Reason.RATE_LIMITED, se.getReason());
                    assertTrue(se.isRetryable());
                })
                .verify();
    }

    @Test
    void unknownSymbolIsNotFound() {
        String error = "{\"Error Message\":\"Invalid API call.\"}";
        StepVerifier.create(adapter("demo", error).fetch(TestFacts.AAPL, "revenue", HINT))
                .expectErrorSatisfies(e -> assertEquals(SourceException.Reason.NOT_FOUND, ((SourceException) e).getReason()))
                .verify();
    }

    @Test
    void disabledWithoutApiKey() {
        MarketDataAdapter adapter = adapter(" ", INCOME_STATEMENT);
        assertFalse(adapter.isEnabled());
        StepVerifier.create(adapter.fetch(TestFacts.AAPL, "revenue", HINT))
                .expectErrorSatisfies(e -> assertEquals(SourceException.Reason.UNAVAILABLE, ((SourceException) e).getReason()))
                .verify();
    }
}
