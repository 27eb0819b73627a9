package com.example.finsight.compose;

import com.example.finsight.kpi.EvaluationNode;
import com.example.finsight.model.Citation;
import com.example.finsight.model.Concept;
import com.example.finsight.model.Confidence;
import com.example.finsight.model.EntityRef;
import com.example.finsight.model.Fact;
import com.example.finsight.model.InputTrace;
import com.example.finsight.model.KpiResult;
import com.example.finsight.model.RoutedFact;
import com.example.finsight.period.PeriodRequest;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 계산 트리를 응답으로 만든다: 값 반올림, 기간, 신뢰도, 출처, 경고.
 */
@Component
public class ResultComposer {

    public static final String PERIOD_MISMATCH = "PERIOD_MISMATCH";
    public static final String HEURISTIC_PERIOD = "HEURISTIC_PERIOD";
    public static final String FALLBACK_SOURCE = "FALLBACK_SOURCE";
    public static final String ZERO_RESULT = "ZERO_RESULT";

    public KpiResult compose(EntityRef entity, String metric, PeriodRequest request, EvaluationNode root) {
        List<EvaluationNode> leaves = new ArrayList<>();
        collectLeaves(root, leaves, new LinkedHashSet<>());

        // 시세(LIVE) 입력은 회계 기간이 없으므로 기간 비교에서 제외
        List<EvaluationNode> periodic = new ArrayList<>();
        for (EvaluationNode leaf : leaves) {
            if (!isLive(leaf)) periodic.add(leaf);
        }
        EvaluationNode primary = periodic.isEmpty() ? (leaves.isEmpty() ? null : leaves.get(0)) : periodic.get(0);

        Set<String> warnings = new LinkedHashSet<>();
        Confidence confidence = Confidence.HIGH;
        for (EvaluationNode leaf : periodic) {
            if (!leaf.getRouted().periodLabel().equals(primary.getRouted().periodLabel())) {
                warnings.add(PERIOD_MISMATCH);
                confidence = confidence.min(Confidence.LOW);
            }
        }
        for (EvaluationNode leaf : leaves) {
            RoutedFact rf = leaf.getRouted();
            if (rf.isHeuristic()) {
                warnings.add(HEURISTIC_PERIOD);
                confidence = confidence.min(Confidence.LOW);
            }
            if (rf.isFallback()) {
                warnings.add(FALLBACK_SOURCE);
                confidence = confidence.min(Confidence.MEDIUM);
            }
        }
        if (root.getValue().signum() == 0) warnings.add(ZERO_RESULT);

        KpiResult res = new KpiResult();
        res.setTicker(entity.getTicker());
        res.setMetric(metric);
        res.setValue(round(root.getValue(), root.getUnit()));
        res.setUnit(root.getUnit());
        if (primary != null) {
            Fact anchor = primary.getRouted().anchor();
            res.setPeriod(anchor.periodLabel());
            res.setPeriodEnd(anchor.getPeriodEnd());
        }
        res.setFrequency(request.getFrequency());
        res.setTtm(request.isTtm());
        res.setConfidence(confidence);
        res.setFormula(root.getFormula());
        res.setInputs(root.isBase() ? List.of() : traces(root.getInputs()));
        res.setCitations(citations(leaves));
        res.setWarnings(new ArrayList<>(warnings));
        res.setAsOf(request.getAsOf());
        return res;
    }

    /** 비율은 소수 6자리, 그 외는 소수 2자리(끝자리 0 제거) */
    public static BigDecimal round(BigDecimal value, String unit) {
        if (value == null) return null;
        if (Concept.Units.RATIO.equals(unit)) {
            return value.setScale(6, RoundingMode.HALF_EVEN);
        }
        BigDecimal v = value.setScale(2, RoundingMode.HALF_EVEN).stripTrailingZeros();
        return v.scale() < 0 ? v.setScale(0) : v;
    }

    private static boolean isLive(EvaluationNode leaf) {
        return Concept.of(leaf.getName()).map(Concept::isLive).orElse(false);
    }

    /** 메모이제이션으로 같은 노드가 여러 번 나올 수 있어 이름과 TTM 여부로 중복 제거 */
    private static void collectLeaves(EvaluationNode node, List<EvaluationNode> out, Set<String> seen) {
        if (node.isBase()) {
            if (seen.add(node.getName() + (node.getRouted().isTtm() ? "@ttm" : ""))) out.add(node);
            return;
        }
        for (EvaluationNode in : node.getInputs()) {
            collectLeaves(in, out, seen);
        }
    }

    private static List<InputTrace> traces(List<EvaluationNode> nodes) {
        List<InputTrace> out = new ArrayList<>();
        for (EvaluationNode n : nodes) {
            InputTrace t = new InputTrace();
            t.setName(n.getName());
            t.setValue(round(n.getValue(), n.getUnit()));
            t.setUnit(n.getUnit());
            t.setFormula(n.getFormula());
            if (n.isBase()) {
                t.setPeriod(n.getRouted().periodLabel());
                t.setSource(n.getRouted().getSourceId());
                t.setFallback(n.getRouted().isFallback());
                t.setInputs(List.of());
            } else {
                t.setInputs(traces(n.getInputs()));
            }
            out.add(t);
        }
        return out;
    }

    private static List<Citation> citations(List<EvaluationNode> leaves) {
        Map<String, Citation> byKey = new LinkedHashMap<>();
        for (EvaluationNode leaf : leaves) {
            for (Fact f : leaf.getRouted().getFacts()) {
                String period = f.periodLabel();
                String key = f.getSourceId() + "|" + period;
                if (byKey.containsKey(key)) continue;
                Citation c = new Citation();
                c.setSource(f.getSourceId());
                c.setUrl(f.getUrl());
                c.setPeriod(period);
                c.setForm(f.getForm());
                LocalDate filed = f.getFiled();
                c.setFiled(filed);
                byKey.put(key, c);
            }
        }
        return new ArrayList<>(byKey.values());
    }
}
