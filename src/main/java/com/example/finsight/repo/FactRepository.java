package com.example.finsight.repo;

import com.example.finsight.model.doc.FactDoc;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface FactRepository extends ReactiveCrudRepository<FactDoc, String> {
    Flux<FactDoc> findByEntityIdAndConceptOrderByRecordedAtDesc(String entityId, String concept);
}
