package com.example.finsight.kpi;

import com.example.finsight.exception.NotFoundException;
import com.example.finsight.exception.SourceUnavailableException;
import com.example.finsight.exception.UndefinedMetricException;
import com.example.finsight.exception.ValidationFailedException;
import com.example.finsight.model.Concept;
import com.example.finsight.model.RoutedFact;
import com.example.finsight.period.PeriodRequest;
import com.example.finsight.router.FactQuery;
import com.example.finsight.router.SourceRouter;
import com.example.finsight.support.TestFacts;
import com.example.finsight.validation.FactValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

import static com.example.finsight.support.TestFacts.quarter;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CalculationEngineTest {

    private static final PeriodRequest Q4 = PeriodRequest.quarter(2024, 4, LocalDate.parse("2025-01-15"));

    @Mock
    private SourceRouter router;

    private CalculationEngine engine;
    private final Map<Concept, Mono<RoutedFact>> answers = new EnumMap<>(Concept.class);

    @BeforeEach
    void setUp() {
        engine = new CalculationEngine(new KpiRegistry(), router, new FactValidator(TestFacts.properties()));
        lenient().when(router.route(any(FactQuery.class))).thenAnswer(inv -> {
            FactQuery q = inv.getArgument(0);
            return answers.getOrDefault(q.getConcept(),
                    Mono.error(new NotFoundException("no " + q.getConcept().id())));
        });
    }

    private void value(Concept concept, String v) {
        answers.put(concept, Mono.just(TestFacts.routed(
                quarter(concept.id(), "regulatory-filing", 2024, 4, "2024-09-28", v))));
    }

    @Test
    @DisplayName("같은 요청 안에서 공유 입력(revenue)은 한 번만 조회")
    void sharedInputFetchedOnce() {
        value(Concept.REVENUE, "94930000000");
        value(Concept.COST_OF_REVENUE, "51051000000");

        StepVerifier.create(engine.evaluate(TestFacts.AAPL, "grossMargin", Q4))
                .assertNext(node -> {
                    BigDecimal expected = new BigDecimal("43879000000")
                            .divide(new BigDecimal("94930000000"), MathContext.DECIMAL64);
                    assertEquals(0, expected.compareTo(node.getValue()));
                    assertEquals("grossProfit / revenue", node.getFormula());
                    assertEquals(2, node.getInputs().size());
                    assertFalse(node.getInputs().get(0).isBase());
                    assertTrue(node.getInputs().get(1).isBase());
                })
                .verifyComplete();

        verify(router, times(1)).route(argThat(q -> q.getConcept() == Concept.REVENUE));
        verify(router, times(1)).route(argThat(q -> q.getConcept() == Concept.COST_OF_REVENUE));
    }

    @Test
    @DisplayName("분기 peRatio 의 분모는 최근 4개 분기 순이익 합")
    void peRatioDividesByTrailingNetIncome() {
        value(Concept.PRICE, "227.52");
        value(Concept.SHARES_OUTSTANDING, "15116786000");
        RoutedFact single = TestFacts.routed(
                quarter("netIncome", "regulatory-filing", 2024, 4, "2024-09-28", "14736000000"));
        RoutedFact trailing = RoutedFact.builder()
                .fact(quarter("netIncome", "regulatory-filing", 2024, 1, "2023-12-30", "33916000000"))
                .fact(quarter("netIncome", "regulatory-filing", 2024, 2, "2024-03-30", "23636000000"))
                .fact(quarter("netIncome", "regulatory-filing", 2024, 3, "2024-06-29", "21448000000"))
                .fact(quarter("netIncome", "regulatory-filing", 2024, 4, "2024-09-28", "14736000000"))
                .ttm(true)
                .sourceId("regulatory-filing")
                .build();
        when(router.route(argThat(q -> q.getConcept() == Concept.NET_INCOME)))
                .thenAnswer(inv -> Mono.just(((FactQuery) inv.getArgument(0)).isTrailing() ? trailing : single));

        StepVerifier.create(engine.evaluate(TestFacts.AAPL, "peRatio", Q4))
                .assertNext(node -> {
                    EvaluationNode netIncome = node.getInputs().get(1);
                    assertEquals("netIncome", netIncome.getName());
                    assertEquals(0, new BigDecimal("93736000000").compareTo(netIncome.getValue()));
                    BigDecimal expected = new BigDecimal("227.52")
                            .multiply(new BigDecimal("15116786000"), MathContext.DECIMAL64)
                            .divide(new BigDecimal("93736000000"), MathContext.DECIMAL64);
                    assertEquals(0, expected.compareTo(node.getValue()));
                    assertTrue(node.getValue().compareTo(new BigDecimal("50")) < 0);
                })
                .verifyComplete();

        verify(router, never()).route(argThat(q -> q.getConcept() == Concept.NET_INCOME && !q.isTrailing()));
    }

    @Test
    @DisplayName("입력 일부가 없으면 UndefinedMetric")
    void missingInputIsUndefined() {
        value(Concept.REVENUE, "94930000000");

        StepVerifier.create(engine.evaluate(TestFacts.AAPL, "grossMargin", Q4))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof UndefinedMetricException);
                    assertTrue(e.getMessage().contains("grossProfit"));
                })
                .verify();
    }

    @Test
    @DisplayName("입력 전부가 없으면 NotFound")
    void allInputsMissingIsNotFound() {
        StepVerifier.create(engine.evaluate(TestFacts.AAPL, "grossMargin", Q4))
                .expectError(NotFoundException.class)
                .verify();
    }

    @Test
    void divisionByZeroIsUndefined() {
        value(Concept.REVENUE, "0");
        value(Concept.NET_INCOME, "100");

        StepVerifier.create(engine.evaluate(TestFacts.AAPL, "netMargin", Q4))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof UndefinedMetricException);
                    assertTrue(e.getMessage().contains("division by zero"));
                })
                .verify();
    }

    @Test
    @DisplayName("원천 장애는 Undefined 로 바꾸지 않고 그대로 전달")
    void sourceUnavailablePropagates() {
        answers.put(Concept.REVENUE, Mono.error(new SourceUnavailableException("all sources down")));
        value(Concept.NET_INCOME, "100");

        StepVerifier.create(engine.evaluate(TestFacts.AAPL, "netMargin", Q4))
                .expectError(SourceUnavailableException.class)
                .verify();
    }

    @Test
    void marginOutsideBandFailsValidation() {
        value(Concept.REVENUE, "100");
        value(Concept.COST_OF_REVENUE, "-10");

        StepVerifier.create(engine.evaluate(TestFacts.AAPL, "grossMargin", Q4))
                .expectError(ValidationFailedException.class)
                .verify();
    }

    @Test
    void baseConceptAndUnknownMetric() {
        value(Concept.REVENUE, "94930000000");

        StepVerifier.create(engine.evaluate(TestFacts.AAPL, "revenue", Q4))
                .assertNext(node -> {
                    assertTrue(node.isBase());
                    assertEquals(new BigDecimal("94930000000"), node.getValue());
                })
                .verifyComplete();

        StepVerifier.create(engine.evaluate(TestFacts.AAPL, "bogusMetric", Q4))
                .expectError(NotFoundException.class)
                .verify();
        verify(router, never()).route(argThat(q -> q.getConcept() == Concept.NET_INCOME));
    }
}
