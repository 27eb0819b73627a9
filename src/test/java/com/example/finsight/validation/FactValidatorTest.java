package com.example.finsight.validation;

import com.example.finsight.config.FinanceProperties;
import com.example.finsight.model.Fact;
import com.example.finsight.support.TestFacts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.example.finsight.support.TestFacts.annual;
import static com.example.finsight.support.TestFacts.quarter;
import static org.junit.jupiter.api.Assertions.*;

class FactValidatorTest {

    private final FactValidator validator = new FactValidator(TestFacts.properties());

    @Test
    @DisplayName("AAPL 분기 매출 범위를 벗어난 값(연간 합계 혼입)은 거부")
    void rejectsOutOfBandRevenue() {
        Fact bad = quarter("revenue", "market-data", 2024, 4, "2024-09-28", "202695000000");
        ValidationResult r = validator.validate(bad, "AAPL");
        assertFalse(r.isValid());
        assertTrue(r.getReason().contains("above"));

        assertTrue(validator.validate(quarter("revenue", "market-data", 2024, 4, "2024-09-28", "94930000000"), "aapl").isValid());
    }

    @Test
    void signRules() {
        assertFalse(validator.validate(quarter("revenue", "x", 2024, 4, "2024-09-28", "-1"), "MSFT").isValid());
        assertTrue(validator.validate(quarter("netIncome", "x", 2024, 4, "2024-09-28", "-5000000"), "MSFT").isValid());
    }

    @Test
    void rejectsUnitMismatch() {
        Fact shares = quarter("revenue", "x", 2024, 4, "2024-09-28", "94930000000").toBuilder().unit("shares").build();
        ValidationResult r = validator.validate(shares, "AAPL");
        assertFalse(r.isValid());
        assertTrue(r.getReason().contains("unit"));
    }

    @Test
    @DisplayName("규칙은 빈도가 맞을 때만, 티커 규칙이 와일드카드보다 우선")
    void tickerRuleOverridesWildcard() {
        FinanceProperties props = TestFacts.properties();
        FinanceProperties.Rule wildcard = new FinanceProperties.Rule();
        wildcard.setConcept("revenue");
        wildcard.setMax(new BigDecimal("50000000000"));
        props.getValidation().getRules().add(0, wildcard);
        FactValidator v = new FactValidator(props);

        Fact q4 = quarter("revenue", "x", 2024, 4, "2024-09-28", "94930000000");
        assertTrue(v.validate(q4, "AAPL").isValid());
        assertFalse(v.validate(q4, "MSFT").isValid());
        // AAPL 규칙은 분기 전용이므로 연간 값에는 와일드카드가 적용된다
        assertFalse(v.validate(annual("revenue", "x", 2024, "2024-09-28", "391035000000"), "AAPL").isValid());
    }

    @Test
    void marginBand() {
        assertTrue(validator.validateKpi("grossMargin", new BigDecimal("0.4621")).isValid());
        assertTrue(validator.validateKpi("netMargin", new BigDecimal("-3.5")).isValid());
        assertFalse(validator.validateKpi("grossMargin", new BigDecimal("1.2")).isValid());
        assertTrue(validator.validateKpi("revenueGrowth", new BigDecimal("5")).isValid());
    }
}
