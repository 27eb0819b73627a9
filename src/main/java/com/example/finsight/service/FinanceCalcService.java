package com.example.finsight.service;

import com.example.finsight.compose.ResultComposer;
import com.example.finsight.config.FinanceProperties;
import com.example.finsight.exception.DeadlineExceededException;
import com.example.finsight.exception.ErrorKind;
import com.example.finsight.exception.FinanceException;
import com.example.finsight.exception.NotFoundException;
import com.example.finsight.kpi.CalculationEngine;
import com.example.finsight.kpi.KpiDefinition;
import com.example.finsight.kpi.KpiRegistry;
import com.example.finsight.model.Concept;
import com.example.finsight.model.FinancialStatement;
import com.example.finsight.model.KpiResult;
import com.example.finsight.model.KpiSeries;
import com.example.finsight.model.MetricInfo;
import com.example.finsight.model.SourceStatus;
import com.example.finsight.model.StatementType;
import com.example.finsight.period.PeriodRequest;
import com.example.finsight.router.SourceHealth;
import com.example.finsight.source.SourceAdapter;
import com.example.finsight.source.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 계산 엔진의 단일 진입점. 티커 해석 → DAG 평가 → 응답 구성, 요청 전체에 제한 시간을 건다.
 */
@Service
public class FinanceCalcService {

    private static final Logger log = LoggerFactory.getLogger(FinanceCalcService.class);

    private final EntityResolver entityResolver;
    private final CalculationEngine engine;
    private final ResultComposer composer;
    private final KpiRegistry registry;
    private final SourceRegistry sources;
    private final SourceHealth health;
    private final Duration defaultDeadline;

    public FinanceCalcService(EntityResolver entityResolver,
                              CalculationEngine engine,
                              ResultComposer composer,
                              KpiRegistry registry,
                              SourceRegistry sources,
                              SourceHealth health,
                              FinanceProperties props) {
        this.entityResolver = entityResolver;
        this.engine = engine;
        this.composer = composer;
        this.registry = registry;
        this.sources = sources;
        this.health = health;
        this.defaultDeadline = props.getRouter().getRequestDeadline();
    }

    public Mono<KpiResult> compute(String ticker, String metric, PeriodRequest period) {
        return compute(ticker, metric, period, defaultDeadline);
    }

    public Mono<KpiResult> compute(String ticker, String metric, PeriodRequest period, Duration deadline) {
        long started = System.nanoTime();
        Duration limit = deadline == null ? defaultDeadline : deadline;
        return Mono.defer(() -> entityResolver.resolve(ticker))
                .flatMap(entity -> engine.evaluate(entity, metric, period)
                        .map(root -> composer.compose(entity, metric, period, root)))
                .timeout(limit, Mono.error(() -> new DeadlineExceededException(
                        metric + " for " + ticker + " exceeded deadline of " + limit.toMillis() + " ms", null)))
                .doOnSuccess(r -> {
                    if (r != null) {
                        log.info("calc {} {} {} = {} {} ({}) in {} ms", r.getTicker(), metric, r.getPeriod(),
                                r.getValue().toPlainString(), r.getUnit(), r.getConfidence().json(),
                                (System.nanoTime() - started) / 1_000_000);
                    }
                })
                .doOnError(e -> log.info("calc {} {} {} failed in {} ms: {}", ticker, metric, period.label(),
                        (System.nanoTime() - started) / 1_000_000, e.toString()));
    }

    /**
     * 최근 limit 개 기간의 값. latest 로 기준 기간을 정한 뒤 직전 기간을 차례로 계산한다.
     * 데이터가 없는 기간은 건너뛰고 missing 에 남기며, 원천 장애와 시간 초과는 그대로 올린다.
     * 시세(LIVE) 입력에 의존하는 지표는 과거 기간 값이 없으므로 최신 한 건만 돌려준다.
     */
    public Mono<KpiSeries> series(String ticker, String metric, PeriodRequest latest, int limit) {
        return compute(ticker, metric, latest).flatMap(first -> {
            List<String> missing = Collections.synchronizedList(new ArrayList<>());
            Optional<PeriodRequest> anchor = dependsOnLive(metric)
                    ? Optional.empty()
                    : PeriodRequest.ofLabel(first.getPeriod(), latest.getFrequency(), latest.isTtm(), latest.getAsOf());
            if (anchor.isEmpty() || limit <= 1) {
                return Mono.just(toSeries(first, metric, latest, limit, List.of(first), missing));
            }
            List<PeriodRequest> earlier = new ArrayList<>();
            PeriodRequest p = anchor.get();
            for (int i = 1; i < limit; i++) {
                p = p.previous();
                earlier.add(p);
            }
            return Flux.fromIterable(earlier)
                    .concatMap(req -> compute(ticker, metric, req)
                            .onErrorResume(FinanceCalcService::isDataGap, e -> {
                                missing.add(req.label() + ": " + ((FinanceException) e).getKind().type());
                                return Mono.empty();
                            }))
                    .collectList()
                    .map(rest -> {
                        List<KpiResult> points = new ArrayList<>();
                        points.add(first);
                        points.addAll(rest);
                        return toSeries(first, metric, latest, limit, points, missing);
                    });
        });
    }

    /**
     * 한 기간의 재무제표 항목. latest 요청이면 처음 계산된 항목의 기간으로 나머지를 맞춘다.
     * 없는 항목은 missing 에 남기고, 하나도 없으면 NotFound.
     */
    public Mono<FinancialStatement> statement(String ticker, StatementType type, PeriodRequest period) {
        List<String> missing = Collections.synchronizedList(new ArrayList<>());
        AtomicReference<PeriodRequest> pinned = new AtomicReference<>(period);
        return Flux.fromIterable(type.items())
                .concatMap(item -> Mono.defer(() -> compute(ticker, item, pinned.get()))
                        .doOnNext(r -> {
                            if (pinned.get().isLatest()) {
                                PeriodRequest.ofLabel(r.getPeriod(), period.getFrequency(), period.isTtm(), period.getAsOf())
                                        .ifPresent(pinned::set);
                            }
                        })
                        .onErrorResume(FinanceCalcService::isDataGap, e -> {
                            missing.add(item + ": " + ((FinanceException) e).getKind().type());
                            return Mono.empty();
                        }))
                .collectList()
                .flatMap(items -> {
                    if (items.isEmpty()) {
                        return Mono.error(new NotFoundException("No " + type.id() + " statement items for " + ticker
                                + " " + period.label(), missing));
                    }
                    FinancialStatement st = new FinancialStatement();
                    st.setTicker(items.get(0).getTicker());
                    st.setStatement(type.id());
                    st.setPeriod(pinned.get().isLatest() ? items.get(0).getPeriod() : pinned.get().label());
                    st.setFrequency(period.getFrequency());
                    st.setLineItems(items);
                    st.setMissing(new ArrayList<>(missing));
                    st.setAsOf(period.getAsOf());
                    return Mono.just(st);
                });
    }

    /** 데이터 부재로 보는 오류. 원천 장애와 시간 초과는 제외 */
    private static boolean isDataGap(Throwable e) {
        if (!(e instanceof FinanceException fe)) return false;
        ErrorKind k = fe.getKind();
        return k == ErrorKind.NOT_FOUND || k == ErrorKind.UNDEFINED || k == ErrorKind.INSUFFICIENT_HISTORY
                || k == ErrorKind.VALIDATION_FAILED || k == ErrorKind.AMBIGUOUS_PERIOD;
    }

    private boolean dependsOnLive(String name) {
        Optional<Concept> c = Concept.of(name);
        if (c.isPresent()) return c.get().isLive();
        return registry.get(name)
                .map(d -> d.getInputs().stream().anyMatch(this::dependsOnLive))
                .orElse(false);
    }

    private static KpiSeries toSeries(KpiResult first, String metric, PeriodRequest latest, int limit,
                                      List<KpiResult> points, List<String> missing) {
        KpiSeries s = new KpiSeries();
        s.setTicker(first.getTicker());
        s.setMetric(metric);
        s.setFrequency(latest.getFrequency());
        s.setTtm(latest.isTtm());
        s.setLimit(limit);
        s.setPoints(points);
        s.setMissing(new ArrayList<>(missing));
        s.setAsOf(latest.getAsOf());
        return s;
    }

    /** 기본 항목 + 위상 순서의 파생 지표 */
    public List<MetricInfo> metrics() {
        List<MetricInfo> out = new ArrayList<>();
        for (Concept c : Concept.values()) {
            MetricInfo m = new MetricInfo();
            m.setName(c.id());
            m.setKind("base");
            m.setInputs(List.of());
            m.setUnit(c.unit());
            out.add(m);
        }
        for (KpiDefinition d : registry.inOrder()) {
            MetricInfo m = new MetricInfo();
            m.setName(d.getName());
            m.setKind("derived");
            m.setInputs(d.getInputs());
            m.setFormula(d.getFormula());
            m.setUnit(d.getUnit());
            out.add(m);
        }
        return out;
    }

    public List<SourceStatus> sourceStatus() {
        List<SourceStatus> out = new ArrayList<>();
        for (SourceAdapter a : sources.all()) {
            SourceHealth.Snapshot h = health.snapshot(a.id());
            SourceStatus s = new SourceStatus();
            s.setId(a.id());
            s.setTier(a.tier());
            s.setEnabled(sources.isActive(a));
            s.setDegraded(h.degraded);
            s.setConsecutiveFailures(h.consecutiveFailures);
            s.setLastSuccess(h.lastSuccess);
            s.setLastFailure(h.lastFailure);
            s.setLastError(h.lastError);
            s.setConcepts(new ArrayList<>(new TreeSet<>(a.supportedConcepts())));
            out.add(s);
        }
        return out;
    }
}
