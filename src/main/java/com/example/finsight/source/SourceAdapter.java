package com.example.finsight.source;

import com.example.finsight.model.EntityRef;
import com.example.finsight.model.Fact;
import com.example.finsight.period.PeriodRequest;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * 외부 원천 하나. 구현체는 상태가 없고 캐시하지 않는다.
 * 기간 확정은 하지 않고 후보 Fact 목록만 돌려준다.
 */
public interface SourceAdapter {

    String id();

    /** 낮을수록 권위 있는 원천 */
    int tier();

    Set<String> supportedConcepts();

    /** 자격 증명이 없으면 false. 비활성 원천은 체인에서 제외된다 */
    boolean isEnabled();

    default boolean supports(String concept) {
        return supportedConcepts().contains(concept);
    }

    /**
     * @param hint 요청 기간. 원천이 기간 필터를 지원하면 참고용으로 쓴다
     * @return 후보 Fact. 항목 자체가 없으면 {@link SourceException} NOT_FOUND
     */
    Mono<List<Fact>> fetch(EntityRef entity, String concept, PeriodRequest hint);
}
