package com.example.finsight.service;

import com.example.finsight.model.EntityRef;
import com.example.finsight.model.Fact;
import com.example.finsight.model.RoutedFact;
import com.example.finsight.model.doc.EntityDoc;
import com.example.finsight.model.doc.FactDoc;
import com.example.finsight.repo.EntityRepository;
import com.example.finsight.repo.FactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * 수용된 Fact 를 Mongo 에 이력으로 남기고 엔티티를 등록한다.
 * 저장 실패는 계산 결과에 영향을 주지 않는다.
 */
@Service
public class FactAuditService {

    private static final Logger log = LoggerFactory.getLogger(FactAuditService.class);

    private final FactRepository factRepo;
    private final EntityRepository entityRepo;

    public FactAuditService(FactRepository factRepo, EntityRepository entityRepo) {
        this.factRepo = factRepo;
        this.entityRepo = entityRepo;
    }

    /** 비동기 기록. 호출자는 기다리지 않는다 */
    public void record(EntityRef entity, RoutedFact routed) {
        save(entity, routed).subscribe();
    }

    Mono<Void> save(EntityRef entity, RoutedFact routed) {
        Instant now = Instant.now();
        Flux<FactDoc> docs = Flux.fromIterable(routed.getFacts())
                .map(f -> toDoc(entity, f, routed.isHeuristic(), now));
        return factRepo.saveAll(docs)
                .then(upsertEntity(entity, now))
                .onErrorResume(e -> {
                    log.warn("Fact audit failed for {} {}: {}", entity.getTicker(), routed.getSourceId(), e.toString());
                    return Mono.empty();
                });
    }

    private Mono<Void> upsertEntity(EntityRef entity, Instant now) {
        if (!entity.hasCik()) return Mono.empty();
        return entityRepo.findById(entity.getId())
                .defaultIfEmpty(new EntityDoc())
                .flatMap(doc -> {
                    doc.setId(entity.getId());
                    doc.setTicker(entity.getTicker());
                    doc.setCik(entity.getCik());
                    if (entity.getName() != null) doc.setName(entity.getName());
                    doc.setUpdatedAt(now);
                    return entityRepo.save(doc);
                })
                .then();
    }

    private static FactDoc toDoc(EntityRef entity, Fact f, boolean heuristic, Instant now) {
        FactDoc d = new FactDoc();
        d.setEntityId(entity.getId());
        d.setTicker(entity.getTicker());
        d.setConcept(f.getConcept());
        d.setPeriodEnd(f.getPeriodEnd());
        d.setFiscalYear(f.getFiscalYear());
        d.setFiscalQuarter(f.getFiscalQuarter());
        d.setFrequency(f.getFrequency() == null ? null : f.getFrequency().name());
        d.setValue(f.getValue());
        d.setUnit(f.getUnit());
        d.setSourceId(f.getSourceId());
        d.setUrl(f.getUrl());
        d.setForm(f.getForm());
        d.setFiled(f.getFiled());
        d.setHeuristic(heuristic);
        d.setRetrievedAt(f.getRetrievedAt());
        d.setRecordedAt(now);
        return d;
    }
}
