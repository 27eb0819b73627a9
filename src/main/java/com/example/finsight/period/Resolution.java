package com.example.finsight.period;

import com.example.finsight.model.Fact;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 기간 확정 결과. 단일 Fact 이거나 TTM 용 연속 4개 분기(오래된 순).
 */
@Getter
@ToString
public class Resolution {
    private final List<Fact> facts;
    private final boolean heuristic;

    public Resolution(List<Fact> facts, boolean heuristic) {
        this.facts = List.copyOf(facts);
        this.heuristic = heuristic;
    }

    public static Resolution single(Fact fact, boolean heuristic) {
        return new Resolution(List.of(fact), heuristic);
    }

    public Fact latest() {
        return facts.get(facts.size() - 1);
    }
}
