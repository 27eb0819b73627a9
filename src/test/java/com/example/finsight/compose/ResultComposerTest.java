package com.example.finsight.compose;

import com.example.finsight.kpi.EvaluationNode;
import com.example.finsight.kpi.KpiDefinition;
import com.example.finsight.kpi.KpiRegistry;
import com.example.finsight.model.Confidence;
import com.example.finsight.model.Fact;
import com.example.finsight.model.InputTrace;
import com.example.finsight.model.KpiResult;
import com.example.finsight.model.RoutedFact;
import com.example.finsight.period.PeriodRequest;
import com.example.finsight.support.TestFacts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.List;

import static com.example.finsight.support.TestFacts.quarter;
import static org.junit.jupiter.api.Assertions.*;

class ResultComposerTest {

    private static final PeriodRequest Q4 = PeriodRequest.quarter(2024, 4, LocalDate.parse("2025-01-15"));

    private final ResultComposer composer = new ResultComposer();
    private final KpiRegistry registry = new KpiRegistry();

    private static EvaluationNode base(String concept, RoutedFact routed) {
        return EvaluationNode.base(concept, routed);
    }

    private EvaluationNode grossMargin(EvaluationNode revenue, EvaluationNode cost) {
        KpiDefinition gp = registry.get("grossProfit").orElseThrow();
        KpiDefinition gm = registry.get("grossMargin").orElseThrow();
        BigDecimal gpValue = revenue.getValue().subtract(cost.getValue());
        EvaluationNode gpNode = EvaluationNode.derived(gp, gpValue, List.of(revenue, cost));
        BigDecimal gmValue = gpValue.divide(revenue.getValue(), MathContext.DECIMAL64);
        return EvaluationNode.derived(gm, gmValue, List.of(gpNode, revenue));
    }

    @Test
    void rounding() {
        assertEquals("94930000000", ResultComposer.round(new BigDecimal("94930000000.000"), "USD").toPlainString());
        assertEquals("12.36", ResultComposer.round(new BigDecimal("12.355"), "USD").toPlainString());
        assertEquals("1.5", ResultComposer.round(new BigDecimal("1.50"), "USD/shares").toPlainString());
        assertEquals("0.462225", ResultComposer.round(new BigDecimal("0.4622247972190030"), "ratio").toPlainString());
        assertNull(ResultComposer.round(null, "USD"));
    }

    @Test
    @DisplayName("같은 원천·기간 출처는 하나로, 입력 추적은 중첩 구조")
    void composesDerivedMetric() {
        EvaluationNode revenue = base("revenue", TestFacts.routed(
                quarter("revenue", "regulatory-filing", 2024, 4, "2024-09-28", "94930000000")));
        EvaluationNode cost = base("costOfRevenue", TestFacts.routed(
                quarter("costOfRevenue", "regulatory-filing", 2024, 4, "2024-09-28", "51051000000")));

        KpiResult res = composer.compose(TestFacts.AAPL, "grossMargin", Q4, grossMargin(revenue, cost));

        assertEquals("AAPL", res.getTicker());
        assertEquals("ratio", res.getUnit());
        assertEquals(6, res.getValue().scale());
        assertEquals("2024-Q4", res.getPeriod());
        assertEquals(LocalDate.parse("2024-09-28"), res.getPeriodEnd());
        assertEquals(Confidence.HIGH, res.getConfidence());
        assertTrue(res.getWarnings().isEmpty());
        assertEquals(1, res.getCitations().size());
        assertEquals("regulatory-filing", res.getCitations().get(0).getSource());

        assertEquals(2, res.getInputs().size());
        InputTrace gp = res.getInputs().get(0);
        assertEquals("grossProfit", gp.getName());
        assertEquals("revenue - costOfRevenue", gp.getFormula());
        assertEquals(2, gp.getInputs().size());
        assertEquals("regulatory-filing", gp.getInputs().get(1).getSource());
        assertEquals(new BigDecimal("43879000000"), gp.getValue());
    }

    @Test
    @DisplayName("입력 기간이 서로 다르면 PERIOD_MISMATCH, 신뢰도 low")
    void periodMismatch() {
        EvaluationNode revenue = base("revenue", TestFacts.routed(
                quarter("revenue", "regulatory-filing", 2024, 4, "2024-09-28", "94930000000")));
        EvaluationNode cost = base("costOfRevenue", TestFacts.routed(
                quarter("costOfRevenue", "regulatory-filing", 2024, 3, "2024-06-29", "46099000000")));

        KpiResult res = composer.compose(TestFacts.AAPL, "grossMargin", Q4, grossMargin(revenue, cost));

        assertTrue(res.getWarnings().contains(ResultComposer.PERIOD_MISMATCH));
        assertEquals(Confidence.LOW, res.getConfidence());
        assertEquals(2, res.getCitations().size());
    }

    @Test
    void fallbackLowersConfidenceToMedium() {
        Fact f = quarter("revenue", "market-data", 2024, 4, "2024-09-28", "94930000000");
        RoutedFact routed = TestFacts.routed(f).toBuilder().fallback(true).build();

        KpiResult res = composer.compose(TestFacts.AAPL, "revenue", Q4, base("revenue", routed));

        assertEquals(Confidence.MEDIUM, res.getConfidence());
        assertEquals(List.of(ResultComposer.FALLBACK_SOURCE), res.getWarnings());
        assertTrue(res.getInputs().isEmpty());
        assertNull(res.getFormula());
    }

    @Test
    void heuristicAndZeroWarnings() {
        Fact f = quarter("netIncome", "regulatory-filing", 2024, 4, "2024-09-28", "0");
        RoutedFact routed = TestFacts.routed(f).toBuilder().heuristic(true).build();

        KpiResult res = composer.compose(TestFacts.AAPL, "netIncome", Q4, base("netIncome", routed));

        assertEquals(Confidence.LOW, res.getConfidence());
        assertTrue(res.getWarnings().contains(ResultComposer.HEURISTIC_PERIOD));
        assertTrue(res.getWarnings().contains(ResultComposer.ZERO_RESULT));
    }

    @Test
    @DisplayName("TTM 은 분기별 출처를 모두 남긴다")
    void trailingCitesEveryQuarter() {
        RoutedFact routed = RoutedFact.builder()
                .facts(TestFacts.appleRevenueQuarters("regulatory-filing"))
                .ttm(true)
                .sourceId("regulatory-filing")
                .build();

        KpiResult res = composer.compose(TestFacts.AAPL, "revenue", Q4.withTtm(true), base("revenue", routed));

        assertEquals(new BigDecimal("391035000000"), res.getValue());
        assertTrue(res.isTtm());
        assertEquals("2024-Q4", res.getPeriod());
        assertEquals(4, res.getCitations().size());
    }
}
