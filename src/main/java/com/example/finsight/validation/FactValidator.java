package com.example.finsight.validation;

import com.example.finsight.config.FinanceProperties;
import com.example.finsight.model.Concept;
import com.example.finsight.model.Fact;
import com.example.finsight.model.Frequency;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 원천 값과 계산 값의 타당성 검사. 값을 고치지 않고 수용/거부만 한다.
 */
@Component
public class FactValidator {

    private static final BigDecimal MARGIN_MIN = BigDecimal.valueOf(-10);
    private static final BigDecimal MARGIN_MAX = BigDecimal.ONE;

    /** 계산 지표별 허용 범위 [min, max] */
    private static final Map<String, BigDecimal[]> KPI_BANDS = Map.of(
            "grossMargin", new BigDecimal[]{MARGIN_MIN, MARGIN_MAX},
            "operatingMargin", new BigDecimal[]{MARGIN_MIN, MARGIN_MAX},
            "netMargin", new BigDecimal[]{MARGIN_MIN, MARGIN_MAX},
            "ebitdaMargin", new BigDecimal[]{MARGIN_MIN, MARGIN_MAX},
            "fcfMargin", new BigDecimal[]{MARGIN_MIN, MARGIN_MAX});

    private final List<FinanceProperties.Rule> rules;

    public FactValidator(FinanceProperties props) {
        this.rules = List.copyOf(props.getValidation().getRules());
    }

    public ValidationResult validate(Fact fact, String ticker) {
        Optional<Concept> concept = Concept.of(fact.getConcept());
        if (concept.isEmpty()) return ValidationResult.reject("unknown concept " + fact.getConcept());
        Concept c = concept.get();
        BigDecimal v = fact.getValue();
        if (v == null) return ValidationResult.reject("missing value");

        if (!c.isSigned() && v.signum() < 0) {
            return ValidationResult.reject(c.id() + " must not be negative: " + v.toPlainString());
        }
        if (fact.getUnit() == null || !fact.getUnit().equalsIgnoreCase(c.unit())) {
            return ValidationResult.reject(c.id() + " expected unit " + c.unit() + " but was " + fact.getUnit());
        }
        FinanceProperties.Rule rule = ruleFor(ticker, c.id(), fact.getFrequency());
        if (rule != null) {
            if (rule.getMin() != null && v.compareTo(rule.getMin()) < 0) {
                return ValidationResult.reject(c.id() + " " + v.toPlainString() + " below " + rule.getMin().toPlainString());
            }
            if (rule.getMax() != null && v.compareTo(rule.getMax()) > 0) {
                return ValidationResult.reject(c.id() + " " + v.toPlainString() + " above " + rule.getMax().toPlainString());
            }
        }
        return ValidationResult.ok();
    }

    public ValidationResult validateKpi(String name, BigDecimal value) {
        BigDecimal[] band = KPI_BANDS.get(name);
        if (band == null || value == null) return ValidationResult.ok();
        if (value.compareTo(band[0]) < 0 || value.compareTo(band[1]) > 0) {
            return ValidationResult.reject(name + " " + value.toPlainString() + " outside ["
                    + band[0].toPlainString() + ", " + band[1].toPlainString() + "]");
        }
        return ValidationResult.ok();
    }

    /** 티커 전용 규칙이 "*" 규칙보다 우선 */
    private FinanceProperties.Rule ruleFor(String ticker, String concept, Frequency frequency) {
        FinanceProperties.Rule wildcard = null;
        String t = ticker == null ? "" : ticker.toUpperCase(Locale.ROOT);
        for (FinanceProperties.Rule r : rules) {
            if (!concept.equals(r.getConcept())) continue;
            if (r.getFrequency() != null && !r.getFrequency().isBlank()
                    && Frequency.parse(r.getFrequency()) != frequency) continue;
            String rt = r.getTicker() == null ? "*" : r.getTicker().toUpperCase(Locale.ROOT);
            if (rt.equals(t)) return r;
            if (rt.equals("*") && wildcard == null) wildcard = r;
        }
        return wildcard;
    }
}
