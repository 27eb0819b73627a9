package com.example.finsight.period;

import com.example.finsight.config.FinanceProperties;
import com.example.finsight.exception.AmbiguousPeriodException;
import com.example.finsight.exception.InsufficientHistoryException;
import com.example.finsight.model.Concept;
import com.example.finsight.model.Fact;
import com.example.finsight.model.Frequency;
import com.example.finsight.source.SourceException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 한 원천이 돌려준 후보 Fact 중에서 요청 기간에 해당하는 값 하나(TTM 이면 4개 분기)를 고른다.
 *
 * <p>같은 기말일에 후보가 여럿이면 다음 순서로 정리한다.
 * <ol>
 *   <li>값이 같으면 하나로 합친다.</li>
 *   <li>정정 공시(/A)가 있으면 가장 늦게 제출된 정정본을 쓴다.</li>
 *   <li>분기 번호가 있는 후보를 우선한다.</li>
 *   <li>분기 요청에 한해, 최대/최소 절대값 비율이 기준 이상이면 작은 값을 고르고 heuristic 으로 표시한다.
 *       비슷한 크기면 {@link AmbiguousPeriodException}.</li>
 * </ol>
 */
@Component
public class PeriodResolver {

    /** 연속 분기로 보는 기말일 간격(약 2~4개월) */
    private static final long MIN_QUARTER_GAP_DAYS = 56;
    private static final long MAX_QUARTER_GAP_DAYS = 125;

    private final double magnitudeRatio;

    public PeriodResolver(FinanceProperties props) {
        this.magnitudeRatio = props.getPeriod().getMagnitudeRatio();
    }

    public Resolution resolve(Concept concept, PeriodRequest request, List<Fact> candidates, String sourceId) {
        if (candidates == null || candidates.isEmpty()) {
            throw SourceException.notFound(sourceId, "No candidates for " + concept.id());
        }
        if (concept.isLive()) {
            // 시세는 요청 기간과 무관하게 가장 최근 값
            Fact latest = Collections.max(candidates, Comparator.comparing(Fact::getPeriodEnd));
            return Resolution.single(latest, false);
        }
        if (request.isTtm() && concept.isFlow()) {
            return resolveTrailing(concept, request, candidates, sourceId);
        }
        return resolveSingle(concept, request.withTtm(false), candidates, sourceId);
    }

    private Resolution resolveSingle(Concept concept, PeriodRequest request, List<Fact> candidates, String sourceId) {
        boolean quarterly = request.getFrequency() == Frequency.Q;
        List<Fact> pool = candidates.stream()
                .filter(f -> f.getPeriodEnd() != null && f.getValue() != null)
                .filter(f -> f.getFrequency() == request.getFrequency())
                .filter(f -> !f.getPeriodEnd().isAfter(request.getAsOf()))
                .filter(f -> quarterly || f.getFiscalQuarter() == null)
                .filter(f -> matchesPeriod(f, request))
                .collect(Collectors.toList());
        if (pool.isEmpty()) {
            throw SourceException.notFound(sourceId, concept.id() + " has no " + request.getFrequency()
                    + " value for " + request.label() + " as of " + request.getAsOf());
        }
        LocalDate end = pool.stream().map(Fact::getPeriodEnd).max(Comparator.naturalOrder()).get();
        List<Fact> group = pool.stream().filter(f -> f.getPeriodEnd().equals(end)).collect(Collectors.toList());
        return pick(concept, group, quarterly, sourceId);
    }

    private Resolution resolveTrailing(Concept concept, PeriodRequest request, List<Fact> candidates, String sourceId) {
        TreeMap<LocalDate, List<Fact>> byEnd = candidates.stream()
                .filter(f -> f.getPeriodEnd() != null && f.getValue() != null)
                .filter(f -> f.getFrequency() == Frequency.Q)
                .filter(f -> !f.getPeriodEnd().isAfter(request.getAsOf()))
                .collect(Collectors.groupingBy(Fact::getPeriodEnd, TreeMap::new, Collectors.toList()));
        if (byEnd.isEmpty()) {
            throw SourceException.notFound(sourceId, concept.id() + " has no quarterly values as of " + request.getAsOf());
        }

        LocalDate anchor;
        if (request.isLatest()) {
            anchor = byEnd.lastKey();
        } else {
            anchor = byEnd.entrySet().stream()
                    .filter(e -> e.getValue().stream().anyMatch(f -> matchesPeriod(f, request)))
                    .map(Map.Entry::getKey)
                    .reduce((a, b) -> b)
                    .orElseThrow(() -> SourceException.notFound(sourceId,
                            concept.id() + " has no quarterly value for " + request.label()));
        }

        List<Fact> chain = new ArrayList<>();
        boolean heuristic = false;
        LocalDate previous = null;
        for (LocalDate end : byEnd.headMap(anchor, true).descendingKeySet()) {
            if (previous != null) {
                long gap = ChronoUnit.DAYS.between(end, previous);
                // 같은 분기의 다른 기말일 표기는 건너뛴다
                if (gap < MIN_QUARTER_GAP_DAYS) continue;
                if (gap > MAX_QUARTER_GAP_DAYS) break;
            }
            Resolution r = pick(concept, byEnd.get(end), true, sourceId);
            chain.add(r.latest());
            heuristic |= r.isHeuristic();
            previous = end;
            if (chain.size() == 4) break;
        }
        if (chain.size() < 4) {
            throw new InsufficientHistoryException("TTM " + concept.id() + " needs 4 consecutive quarters ending "
                    + anchor + ", " + sourceId + " has " + chain.size());
        }
        Collections.reverse(chain);
        return new Resolution(chain, heuristic);
    }

    private static boolean matchesPeriod(Fact f, PeriodRequest request) {
        if (request.isLatest()) return true;
        if (!request.getFiscalYear().equals(f.getFiscalYear())) return false;
        return request.getFiscalQuarter() == null || request.getFiscalQuarter().equals(f.getFiscalQuarter());
    }

    Resolution pick(Concept concept, List<Fact> group, boolean allowHeuristic, String sourceId) {
        if (distinctValues(group) == 1) return Resolution.single(latestFiled(group), false);

        List<Fact> amendments = group.stream().filter(Fact::isAmendment).collect(Collectors.toList());
        if (!amendments.isEmpty()) return Resolution.single(latestFiled(amendments), false);

        List<Fact> labelled = group.stream().filter(f -> f.getFiscalQuarter() != null).collect(Collectors.toList());
        List<Fact> remaining = labelled.isEmpty() ? group : labelled;
        if (distinctValues(remaining) == 1) return Resolution.single(latestFiled(remaining), false);

        Fact smallest = Collections.min(remaining, Comparator.comparing(f -> f.getValue().abs()));
        Fact largest = Collections.max(remaining, Comparator.comparing(f -> f.getValue().abs()));
        if (allowHeuristic && exceedsRatio(largest.getValue().abs(), smallest.getValue().abs())) {
            return Resolution.single(smallest, true);
        }
        String values = remaining.stream().map(f -> f.getValue().toPlainString()).distinct()
                .collect(Collectors.joining(", "));
        throw new AmbiguousPeriodException(sourceId + " reports " + values + " for " + concept.id()
                + " ending " + smallest.getPeriodEnd());
    }

    private boolean exceedsRatio(BigDecimal max, BigDecimal min) {
        if (min.signum() == 0) return max.signum() != 0;
        return max.divide(min, MathContext.DECIMAL64).compareTo(BigDecimal.valueOf(magnitudeRatio)) >= 0;
    }

    private static long distinctValues(List<Fact> facts) {
        return facts.stream().map(f -> f.getValue().stripTrailingZeros()).distinct().count();
    }

    private static Fact latestFiled(List<Fact> facts) {
        return facts.stream()
                .max(Comparator.comparing(Fact::getFiled, Comparator.nullsFirst(Comparator.naturalOrder())))
                .get();
    }
}
