package com.example.finsight.repo;

import com.example.finsight.model.doc.EntityDoc;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

public interface EntityRepository extends ReactiveCrudRepository<EntityDoc, String> {
    Mono<EntityDoc> findByTicker(String ticker);
}
