package com.example.finsight.kpi;

import com.example.finsight.exception.FinanceException;
import com.example.finsight.exception.NotFoundException;
import com.example.finsight.exception.UndefinedMetricException;
import com.example.finsight.exception.ValidationFailedException;
import com.example.finsight.model.Concept;
import com.example.finsight.model.EntityRef;
import com.example.finsight.model.Frequency;
import com.example.finsight.period.PeriodRequest;
import com.example.finsight.router.FactQuery;
import com.example.finsight.router.SourceRouter;
import com.example.finsight.validation.FactValidator;
import com.example.finsight.validation.ValidationResult;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 요청 단위로 지표 DAG 를 평가한다. 같은 요청 안에서 각 노드는 한 번만 계산된다.
 */
@Component
public class CalculationEngine {

    private final KpiRegistry registry;
    private final SourceRouter router;
    private final FactValidator validator;

    public CalculationEngine(KpiRegistry registry, SourceRouter router, FactValidator validator) {
        this.registry = registry;
        this.router = router;
        this.validator = validator;
    }

    public Mono<EvaluationNode> evaluate(EntityRef entity, String metric, PeriodRequest period) {
        if (!registry.knows(metric)) {
            return Mono.error(new NotFoundException("Unknown metric: " + metric));
        }
        Context ctx = new Context(entity);
        return node(metric, period, ctx);
    }

    /** 같은 이름이라도 TTM 여부가 다르면 다른 노드 */
    private Mono<EvaluationNode> node(String name, PeriodRequest period, Context ctx) {
        String key = period.isTtm() ? name + "@ttm" : name;
        return ctx.memo.computeIfAbsent(key, k -> Mono.defer(() -> compute(name, period, ctx)).cache());
    }

    private Mono<EvaluationNode> compute(String name, PeriodRequest period, Context ctx) {
        Optional<Concept> concept = Concept.of(name);
        if (concept.isPresent()) {
            return router.route(new FactQuery(ctx.entity, concept.get(), period))
                    .map(rf -> EvaluationNode.base(name, rf));
        }
        KpiDefinition def = registry.get(name)
                .orElseThrow(() -> new NotFoundException("Unknown metric: " + name));
        return Flux.fromIterable(def.getInputs())
                .flatMapSequential(in -> node(in, inputPeriod(def, in, period), ctx)
                        .map(InputOutcome::ok)
                        .onErrorResume(e -> Mono.just(InputOutcome.failed(in, e))))
                .collectList()
                .flatMap(outcomes -> combine(def, outcomes));
    }

    private static PeriodRequest inputPeriod(KpiDefinition def, String input, PeriodRequest period) {
        if (period.getFrequency() == Frequency.Q && !period.isTtm() && def.isTrailing(input)) {
            return period.withTtm(true);
        }
        return period;
    }

    private Mono<EvaluationNode> combine(KpiDefinition def, List<InputOutcome> outcomes) {
        List<InputOutcome> failed = outcomes.stream().filter(o -> o.error != null).collect(Collectors.toList());
        if (!failed.isEmpty()) {
            // 데이터 없음/정의 불가 이외의 오류(장애, 모호한 기간 등)는 그대로 올린다
            for (InputOutcome o : failed) {
                if (!(o.error instanceof NotFoundException) && !(o.error instanceof UndefinedMetricException)) {
                    return Mono.error(o.error);
                }
            }
            if (failed.size() == outcomes.size() && failed.stream().allMatch(o -> o.error instanceof NotFoundException)) {
                List<String> diagnostics = new ArrayList<>();
                for (InputOutcome o : failed) {
                    diagnostics.add(o.input + ": " + o.error.getMessage());
                    if (o.error instanceof FinanceException fe) diagnostics.addAll(fe.getDiagnostics());
                }
                return Mono.error(new NotFoundException("No data for any input of " + def.getName(), diagnostics));
            }
            String missing = failed.stream().map(o -> o.input).collect(Collectors.joining(", "));
            List<String> diagnostics = failed.stream()
                    .map(o -> o.input + ": " + o.error.getMessage())
                    .collect(Collectors.toList());
            return Mono.error(new UndefinedMetricException(def.getName() + " is undefined: missing " + missing, diagnostics));
        }

        List<EvaluationNode> inputs = outcomes.stream().map(o -> o.node).collect(Collectors.toList());
        List<BigDecimal> values = inputs.stream().map(EvaluationNode::getValue).collect(Collectors.toList());
        BigDecimal value;
        try {
            value = def.apply(values);
        } catch (UndefinedMetricException e) {
            return Mono.error(e);
        }
        ValidationResult vr = validator.validateKpi(def.getName(), value);
        if (!vr.isValid()) {
            return Mono.error(new ValidationFailedException(vr.getReason()));
        }
        return Mono.just(EvaluationNode.derived(def, value, inputs));
    }

    private static final class Context {
        final EntityRef entity;
        final Map<String, Mono<EvaluationNode>> memo = new ConcurrentHashMap<>();

        Context(EntityRef entity) {
            this.entity = entity;
        }
    }

    private static final class InputOutcome {
        final String input;
        final EvaluationNode node;
        final Throwable error;

        private InputOutcome(String input, EvaluationNode node, Throwable error) {
            this.input = input;
            this.node = node;
            this.error = error;
        }

        static InputOutcome ok(EvaluationNode node) {
            return new InputOutcome(node.getName(), node, null);
        }

        static InputOutcome failed(String input, Throwable error) {
            return new InputOutcome(input, null, error);
        }
    }
}
