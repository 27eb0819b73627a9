package com.example.finsight.kpi;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * 파생 지표 정의. inputs 는 기본 항목 또는 다른 지표 이름이며 fn 에 같은 순서로 전달된다.
 * trailing 에 든 입력은 분기 요청에서도 최근 4개 분기 합(TTM)으로 평가한다.
 */
public class KpiDefinition {

    private final String name;
    private final List<String> inputs;
    private final String formula;
    private final String unit;
    private final Set<String> trailing;
    private final Function<List<BigDecimal>, BigDecimal> fn;

    public KpiDefinition(String name, List<String> inputs, String formula, String unit,
                         Function<List<BigDecimal>, BigDecimal> fn) {
        this(name, inputs, Set.of(), formula, unit, fn);
    }

    public KpiDefinition(String name, List<String> inputs, Set<String> trailing, String formula, String unit,
                         Function<List<BigDecimal>, BigDecimal> fn) {
        if (!inputs.containsAll(trailing)) {
            throw new IllegalArgumentException(name + ": trailing inputs " + trailing + " not in " + inputs);
        }
        this.name = name;
        this.inputs = List.copyOf(inputs);
        this.trailing = Set.copyOf(trailing);
        this.formula = formula;
        this.unit = unit;
        this.fn = fn;
    }

    public String getName() { return name; }
    public List<String> getInputs() { return inputs; }
    public String getFormula() { return formula; }
    public String getUnit() { return unit; }

    public boolean isTrailing(String input) {
        return trailing.contains(input);
    }

    public BigDecimal apply(List<BigDecimal> values) {
        return fn.apply(values);
    }
}
