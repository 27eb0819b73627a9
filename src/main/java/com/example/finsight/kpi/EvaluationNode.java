package com.example.finsight.kpi;

import com.example.finsight.model.Fact;
import com.example.finsight.model.RoutedFact;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 * 계산 트리의 노드. 기본 항목이면 routed 가 있고 inputs 가 비어 있다.
 */
@Getter
@ToString
public class EvaluationNode {
    private final String name;
    private final BigDecimal value;
    private final String unit;
    private final String formula;
    private final RoutedFact routed;
    private final List<EvaluationNode> inputs;

    private EvaluationNode(String name, BigDecimal value, String unit, String formula,
                           RoutedFact routed, List<EvaluationNode> inputs) {
        this.name = name;
        this.value = value;
        this.unit = unit;
        this.formula = formula;
        this.routed = routed;
        this.inputs = inputs;
    }

    /** TTM 이면 4개 분기 합 */
    public static EvaluationNode base(String concept, RoutedFact routed) {
        BigDecimal v = routed.getFacts().stream()
                .map(Fact::getValue)
                .reduce((a, b) -> a.add(b, KpiCatalog.MC))
                .orElseThrow(() -> new IllegalStateException("RoutedFact without facts"));
        if (!routed.isTtm()) v = routed.anchor().getValue();
        return new EvaluationNode(concept, v, routed.unit(), null, routed, List.of());
    }

    public static EvaluationNode derived(KpiDefinition def, BigDecimal value, List<EvaluationNode> inputs) {
        return new EvaluationNode(def.getName(), value, def.getUnit(), def.getFormula(), null, List.copyOf(inputs));
    }

    public boolean isBase() {
        return routed != null;
    }
}
