package com.example.finsight;

import com.example.finsight.exception.AmbiguousPeriodException;
import com.example.finsight.exception.DeadlineExceededException;
import com.example.finsight.exception.NotFoundException;
import com.example.finsight.model.Confidence;
import com.example.finsight.model.FinancialStatement;
import com.example.finsight.model.Frequency;
import com.example.finsight.model.KpiResult;
import com.example.finsight.model.KpiSeries;
import com.example.finsight.model.StatementType;
import com.example.finsight.period.PeriodRequest;
import com.example.finsight.service.FinanceCalcService;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@WebFluxTest(controllers = {CalcController.class, StatusController.class, StatementController.class})
class CalcControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    FinanceCalcService calcSvc;

    private static KpiResult revenueResult() {
        KpiResult r = new KpiResult();
        r.setTicker("AAPL");
        r.setMetric("revenue");
        r.setValue(new BigDecimal("94930000000"));
        r.setUnit("USD");
        r.setPeriod("2024-Q4");
        r.setPeriodEnd(LocalDate.parse("2024-09-28"));
        r.setFrequency(Frequency.Q);
        r.setConfidence(Confidence.HIGH);
        r.setInputs(List.of());
        r.setCitations(List.of());
        r.setWarnings(List.of());
        r.setAsOf(LocalDate.parse("2025-01-15"));
        return r;
    }

    @Test
    @DisplayName("정상 계산: 값은 지수 표기 없이, 신뢰도는 소문자")
    void calcOk() {
        PeriodRequest q4 = PeriodRequest.quarter(2024, 4, LocalDate.parse("2025-01-15"));
        when(calcSvc.compute(eq("AAPL"), eq("revenue"), eq(q4), isNull())).thenReturn(Mono.just(revenueResult()));

        webTestClient.get().uri("/v1/finance/calc/aapl/revenue?period=2024-Q4&asOf=2025-01-15")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ticker").isEqualTo("AAPL")
                .jsonPath("$.period").isEqualTo("2024-Q4")
                .jsonPath("$.confidence").isEqualTo("high")
                .jsonPath("$.frequency").isEqualTo("Q");
    }

    @Test
    void deadlineParameterIsPassedThrough() {
        when(calcSvc.compute(eq("AAPL"), eq("revenue"), any(PeriodRequest.class), eq(Duration.ofMillis(250))))
                .thenReturn(Mono.error(new DeadlineExceededException("revenue for AAPL exceeded deadline of 250 ms", null)));

        webTestClient.get().uri("/v1/finance/calc/AAPL/revenue?deadlineMs=250")
                .exchange()
                .expectStatus().isEqualTo(504)
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON)
                .expectBody()
                .jsonPath("$.type").isEqualTo("DeadlineExceeded")
                .jsonPath("$.status").isEqualTo(504);
    }

    @Test
    @DisplayName("NotFound 는 404 problem+json, 원천별 사유 포함")
    void notFoundIsProblemJson() {
        when(calcSvc.compute(eq("ZZZZ"), eq("revenue"), any(PeriodRequest.class), isNull()))
                .thenReturn(Mono.error(new NotFoundException("No data: revenue for ZZZZ latest",
                        List.of("regulatory-filing: NOT_FOUND (No CIK for ZZZZ)"))));

        webTestClient.get().uri("/v1/finance/calc/ZZZZ/revenue")
                .exchange()
                .expectStatus().isNotFound()
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON)
                .expectBody()
                .jsonPath("$.type").isEqualTo("NotFound")
                .jsonPath("$.detail").value(Matchers.containsString("regulatory-filing"));
    }

    @Test
    void ambiguousPeriodIsConflict() {
        when(calcSvc.compute(eq("AAPL"), eq("revenue"), any(PeriodRequest.class), isNull()))
                .thenReturn(Mono.error(new AmbiguousPeriodException("Ambiguous period: revenue for AAPL 2024-Q4")));

        webTestClient.get().uri("/v1/finance/calc/AAPL/revenue?period=2024-Q4")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.type").isEqualTo("AmbiguousPeriod");
    }

    @Test
    @DisplayName("잘못된 기간/빈도 조합은 400, 서비스는 호출하지 않는다")
    void badRequests() {
        webTestClient.get().uri("/v1/finance/calc/AAPL/revenue?period=Q4-2024")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.type").isEqualTo("BadRequest");

        webTestClient.get().uri("/v1/finance/calc/AAPL/revenue?period=2024&ttm=true")
                .exchange()
                .expectStatus().isBadRequest();

        webTestClient.get().uri("/v1/finance/calc/AAPL/revenue?deadlineMs=0")
                .exchange()
                .expectStatus().isBadRequest();

        webTestClient.get().uri("/v1/finance/calc/AAPL/revenue?asOf=15-01-2025")
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(calcSvc);
    }

    @Test
    @DisplayName("시계열: latest 기준 요청과 limit 을 서비스에 넘긴다")
    void seriesOk() {
        KpiSeries series = new KpiSeries();
        series.setTicker("AAPL");
        series.setMetric("revenue");
        series.setFrequency(Frequency.Q);
        series.setLimit(4);
        series.setPoints(List.of(revenueResult()));
        series.setMissing(List.of("2023-Q4: NotFound"));
        PeriodRequest latest = PeriodRequest.latest(Frequency.Q, LocalDate.parse("2025-01-15"));
        when(calcSvc.series(eq("AAPL"), eq("revenue"), eq(latest), eq(4))).thenReturn(Mono.just(series));

        webTestClient.get().uri("/v1/finance/calc/aapl/revenue/series?limit=4&asOf=2025-01-15")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.points[0].period").isEqualTo("2024-Q4")
                .jsonPath("$.missing[0]").isEqualTo("2023-Q4: NotFound");
    }

    @Test
    void statementOk() {
        FinancialStatement st = new FinancialStatement();
        st.setTicker("AAPL");
        st.setStatement("income");
        st.setPeriod("2024-Q4");
        st.setLineItems(List.of(revenueResult()));
        st.setMissing(List.of());
        PeriodRequest q4 = PeriodRequest.quarter(2024, 4, LocalDate.parse("2025-01-15"));
        when(calcSvc.statement(eq("AAPL"), eq(StatementType.INCOME), eq(q4))).thenReturn(Mono.just(st));

        webTestClient.get().uri("/v1/finance/statements/AAPL/income?period=2024-Q4&asOf=2025-01-15")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.statement").isEqualTo("income")
                .jsonPath("$.lineItems[0].metric").isEqualTo("revenue");
    }

    @Test
    @DisplayName("시계열 limit 범위와 재무제표 종류 검증은 400")
    void seriesAndStatementBadRequests() {
        webTestClient.get().uri("/v1/finance/calc/AAPL/revenue/series?limit=0")
                .exchange()
                .expectStatus().isBadRequest();
        webTestClient.get().uri("/v1/finance/calc/AAPL/revenue/series?limit=51")
                .exchange()
                .expectStatus().isBadRequest();
        webTestClient.get().uri("/v1/finance/calc/AAPL/revenue/series?freq=A&ttm=true")
                .exchange()
                .expectStatus().isBadRequest();
        webTestClient.get().uri("/v1/finance/statements/AAPL/equity")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.type").isEqualTo("BadRequest");

        verifyNoInteractions(calcSvc);
    }

    @Test
    void metricsAndStatus() {
        when(calcSvc.metrics()).thenReturn(List.of());
        when(calcSvc.sourceStatus()).thenReturn(List.of());

        webTestClient.get().uri("/v1/finance/calc/metrics").exchange().expectStatus().isOk();
        webTestClient.get().uri("/v1/finance/status").exchange().expectStatus().isOk();
    }
}
