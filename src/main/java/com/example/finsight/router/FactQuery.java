package com.example.finsight.router;

import com.example.finsight.model.Concept;
import com.example.finsight.model.EntityRef;
import com.example.finsight.period.PeriodRequest;
import com.example.finsight.store.FactKey;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 라우터 입력: 어떤 기업의 어떤 항목을 어떤 기간으로.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FactQuery {
    private final EntityRef entity;
    private final Concept concept;
    private final PeriodRequest period;

    public FactQuery(EntityRef entity, Concept concept, PeriodRequest period) {
        this.entity = entity;
        this.concept = concept;
        this.period = period;
    }

    /** TTM 합산은 FLOW 항목에만 의미가 있다 */
    public boolean isTrailing() {
        return period.isTtm() && concept.isFlow();
    }

    public FactKey key() {
        if (concept.isLive()) {
            return new FactKey(entity.getId(), concept.id(), "live", null, false);
        }
        return new FactKey(entity.getId(), concept.id(), period.token(), period.getFrequency(), isTrailing());
    }
}
