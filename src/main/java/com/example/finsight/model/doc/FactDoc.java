package com.example.finsight.model.doc;

import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * 수용된 Fact 이력(감사용). 계산 경로에서는 읽지 않는다.
 */
@Getter
@Setter
@Document(collection = "facts")
@CompoundIndex(name = "entity_concept_end", def = "{'entityId': 1, 'concept': 1, 'periodEnd': -1}")
public class FactDoc {
    @Id
    private String id;
    private String entityId;
    private String ticker;
    private String concept;
    private LocalDate periodEnd;
    private Integer fiscalYear;
    private Integer fiscalQuarter;
    private String frequency;     // Q/A
    private BigDecimal value;
    private String unit;
    private String sourceId;      // regulatory-filing, market-data ...
    private String url;
    private String form;          // 10-Q, 10-K, 10-Q/A
    private LocalDate filed;
    private boolean heuristic;
    private Instant retrievedAt;
    private Instant recordedAt;
}
