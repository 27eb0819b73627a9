package com.example.finsight.store;

import com.example.finsight.model.Frequency;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Fact 캐시 키. periodToken 은 2024-Q4, 2024 같은 회계 기간 라벨 또는 latest@asOf.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FactKey {
    private final String entityId;
    private final String concept;
    private final String periodToken;
    private final Frequency frequency;
    private final boolean ttm;

    public FactKey(String entityId, String concept, String periodToken, Frequency frequency, boolean ttm) {
        this.entityId = entityId;
        this.concept = concept;
        this.periodToken = periodToken;
        this.frequency = frequency;
        this.ttm = ttm;
    }

    public FactKey withPeriodToken(String token) {
        return new FactKey(entityId, concept, token, frequency, ttm);
    }

    public String redisKey() {
        return "fact:" + entityId + ":" + concept + ":" + periodToken + ":" + frequency + (ttm ? ":ttm" : "");
    }
}
