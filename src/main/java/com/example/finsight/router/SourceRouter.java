package com.example.finsight.router;

import com.example.finsight.config.FinanceProperties;
import com.example.finsight.exception.AmbiguousPeriodException;
import com.example.finsight.exception.FinanceException;
import com.example.finsight.exception.InsufficientHistoryException;
import com.example.finsight.exception.NotFoundException;
import com.example.finsight.exception.SourceUnavailableException;
import com.example.finsight.exception.ValidationFailedException;
import com.example.finsight.model.Concept;
import com.example.finsight.model.Fact;
import com.example.finsight.model.RoutedFact;
import com.example.finsight.period.PeriodResolver;
import com.example.finsight.period.Resolution;
import com.example.finsight.service.FactAuditService;
import com.example.finsight.source.SourceAdapter;
import com.example.finsight.source.SourceErrors;
import com.example.finsight.source.SourceException;
import com.example.finsight.source.SourceRegistry;
import com.example.finsight.store.FactKey;
import com.example.finsight.store.FactStore;
import com.example.finsight.validation.FactValidator;
import com.example.finsight.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 항목 하나를 원천 우선순위 체인으로 조회한다.
 * 캐시 → tier 순 원천(장애 중인 원천은 뒤로) → 기간 확정 → 검증 → 캐시 기록 순서.
 */
@Component
public class SourceRouter {

    private static final Logger log = LoggerFactory.getLogger(SourceRouter.class);

    private final SourceRegistry registry;
    private final FactStore store;
    private final PeriodResolver resolver;
    private final FactValidator validator;
    private final SourceHealth health;
    private final FactAuditService audit;
    private final FinanceProperties.Router cfg;

    public SourceRouter(SourceRegistry registry,
                        FactStore store,
                        PeriodResolver resolver,
                        FactValidator validator,
                        SourceHealth health,
                        FactAuditService audit,
                        FinanceProperties props) {
        this.registry = registry;
        this.store = store;
        this.resolver = resolver;
        this.validator = validator;
        this.health = health;
        this.audit = audit;
        this.cfg = props.getRouter();
    }

    public Mono<RoutedFact> route(FactQuery query) {
        FactKey key = query.key();
        return store.lookup(key)
                .switchIfEmpty(store.getOrFetch(key, () -> fetchChain(query, key)));
    }

    private Mono<RoutedFact> fetchChain(FactQuery query, FactKey key) {
        List<SourceAdapter> configured = registry.chainFor(query.getConcept().id());
        if (configured.isEmpty()) {
            return Mono.error(new NotFoundException("No enabled source provides " + query.getConcept().id()));
        }
        String preferred = registry.preferredFor(query.getConcept().id()).orElse(configured.get(0).id());
        List<SourceAdapter> chain = new ArrayList<>();
        configured.stream().filter(a -> !health.isDegraded(a.id())).forEach(chain::add);
        configured.stream().filter(a -> health.isDegraded(a.id())).forEach(chain::add);

        List<Attempt> attempts = Collections.synchronizedList(new ArrayList<>());
        return Flux.fromIterable(chain)
                .concatMap(adapter -> attempt(query, key, adapter, preferred, attempts), 1)
                .next()
                .switchIfEmpty(Mono.error(() -> aggregate(query, attempts)));
    }

    private Mono<RoutedFact> attempt(FactQuery query, FactKey key, SourceAdapter adapter,
                                     String preferred, List<Attempt> attempts) {
        Concept concept = query.getConcept();
        Predicate<Throwable> retryable = e -> e instanceof SourceException se && se.isRetryable();
        return Mono.defer(() -> adapter.fetch(query.getEntity(), concept.id(), query.getPeriod()))
                .timeout(cfg.getAdapterTimeout())
                .onErrorMap(e -> SourceErrors.classify(adapter.id(), e))
                .retryWhen(Retry.backoff(cfg.getMaxRetries(), cfg.getBackoff())
                        .filter(retryable)
                        .doBeforeRetry(s -> log.debug("Retrying {} for {} ({}): {}", adapter.id(), concept.id(),
                                s.totalRetries() + 1, s.failure().toString()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .map(candidates -> resolver.resolve(concept, query.getPeriod(), candidates, adapter.id()))
                .flatMap(resolution -> accept(query, key, adapter, resolution, preferred, attempts))
                .doOnNext(v -> health.recordSuccess(adapter.id()))
                .onErrorResume(e -> {
                    Attempt a = Attempt.failed(adapter.id(), e);
                    attempts.add(a);
                    if (a.outcome == Outcome.UNAVAILABLE) {
                        health.recordFailure(adapter.id(), e.getMessage());
                    } else {
                        health.recordSuccess(adapter.id());
                    }
                    log.debug("{} {} for {} {}: {} → next source", adapter.id(), a.outcome, query.getEntity().getTicker(),
                            concept.id(), a.message);
                    return Mono.empty();
                });
    }

    private Mono<RoutedFact> accept(FactQuery query, FactKey key, SourceAdapter adapter, Resolution resolution,
                                    String preferred, List<Attempt> attempts) {
        String ticker = query.getEntity().getTicker();
        for (Fact f : resolution.getFacts()) {
            ValidationResult vr = validator.validate(f, ticker);
            if (!vr.isValid()) {
                store.invalidate(key);
                log.warn("Rejected {} {} {} = {} from {}: {}", ticker, f.getConcept(), f.periodLabel(),
                        f.getValue().toPlainString(), adapter.id(), vr.getReason());
                attempts.add(new Attempt(adapter.id(), Outcome.REJECTED, vr.getReason()));
                health.recordSuccess(adapter.id());
                return Mono.empty();
            }
        }
        RoutedFact routed = RoutedFact.builder()
                .facts(resolution.getFacts())
                .ttm(query.isTrailing())
                .sourceId(adapter.id())
                .fallback(!adapter.id().equals(preferred))
                .heuristic(resolution.isHeuristic())
                .build();
        if (query.getPeriod().isLatest() && !query.getConcept().isLive()) {
            // latest 결과는 확정된 회계 기간 키로도 조회되게
            String pinned = query.getPeriod().pinnedTo(routed.anchor()).token();
            if (!pinned.equals(key.getPeriodToken())) {
                store.put(key.withPeriodToken(pinned), routed);
            }
        }
        audit.record(query.getEntity(), routed);
        return Mono.just(routed);
    }

    private FinanceException aggregate(FactQuery query, List<Attempt> attempts) {
        List<Attempt> all;
        synchronized (attempts) {
            all = new ArrayList<>(attempts);
        }
        List<String> diagnostics = all.stream()
                .map(a -> a.sourceId + ": " + a.outcome.name() + " (" + a.message + ")")
                .collect(Collectors.toList());
        String what = query.getConcept().id() + " for " + query.getEntity().getTicker() + " " + query.getPeriod().label()
                + (query.isTrailing() ? " TTM" : "");

        if (all.stream().allMatch(a -> a.outcome == Outcome.REJECTED)) {
            return new ValidationFailedException("Every source value failed validation: " + what, diagnostics);
        }
        if (all.stream().allMatch(a -> a.outcome == Outcome.UNAVAILABLE)) {
            return new SourceUnavailableException("All sources unavailable: " + what, diagnostics);
        }
        if (all.stream().anyMatch(a -> a.outcome == Outcome.AMBIGUOUS)) {
            return new AmbiguousPeriodException("Ambiguous period: " + what, diagnostics);
        }
        if (all.stream().anyMatch(a -> a.outcome == Outcome.INSUFFICIENT_HISTORY)) {
            return new InsufficientHistoryException("Insufficient history: " + what, diagnostics);
        }
        if (all.stream().anyMatch(a -> a.outcome == Outcome.REJECTED)) {
            return new ValidationFailedException("No valid value: " + what, diagnostics);
        }
        return new NotFoundException("No data: " + what, diagnostics);
    }

    enum Outcome { NOT_FOUND, UNAVAILABLE, AMBIGUOUS, INSUFFICIENT_HISTORY, REJECTED }

    private static final class Attempt {
        final String sourceId;
        final Outcome outcome;
        final String message;

        Attempt(String sourceId, Outcome outcome, String message) {
            this.sourceId = sourceId;
            this.outcome = outcome;
            this.message = message;
        }

        static Attempt failed(String sourceId, Throwable e) {
            Outcome outcome;
            if (e instanceof SourceException se) {
                // 형식 오류도 호출자 입장에서는 원천 장애
                outcome = se.getReason() == SourceException.Reason.NOT_FOUND ? Outcome.NOT_FOUND : Outcome.UNAVAILABLE;
            } else if (e instanceof AmbiguousPeriodException) {
                outcome = Outcome.AMBIGUOUS;
            } else if (e instanceof InsufficientHistoryException) {
                outcome = Outcome.INSUFFICIENT_HISTORY;
            } else {
                outcome = Outcome.UNAVAILABLE;
            }
            return new Attempt(sourceId, outcome, e.getMessage());
        }
    }
}
