package com.example.finsight.kpi;

import com.example.finsight.model.Concept;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 지표 정의를 기동 시 한 번 검사(모르는 입력, 순환)하고 위상 정렬 순서를 보관한다.
 */
@Component
public class KpiRegistry {

    private static final Logger log = LoggerFactory.getLogger(KpiRegistry.class);

    private final Map<String, KpiDefinition> definitions;
    private final List<String> order;

    @Autowired
    public KpiRegistry() {
        this(KpiCatalog.definitions());
    }

    public KpiRegistry(List<KpiDefinition> defs) {
        Map<String, KpiDefinition> byName = new LinkedHashMap<>();
        for (KpiDefinition d : defs) {
            if (Concept.of(d.getName()).isPresent()) {
                throw new KpiRegistryException("KPI name shadows a base concept: " + d.getName());
            }
            if (byName.put(d.getName(), d) != null) {
                throw new KpiRegistryException("Duplicate KPI: " + d.getName());
            }
        }
        for (KpiDefinition d : byName.values()) {
            for (String in : d.getInputs()) {
                if (!byName.containsKey(in) && Concept.of(in).isEmpty()) {
                    throw new KpiRegistryException("KPI " + d.getName() + " references unknown input " + in);
                }
            }
        }
        this.definitions = Map.copyOf(byName);
        this.order = topologicalOrder(byName);
        log.info("KPI registry loaded: {}", order);
    }

    /** Kahn 알고리즘. 지표 간 간선만 본다(기본 항목은 항상 잎) */
    private static List<String> topologicalOrder(Map<String, KpiDefinition> byName) {
        Map<String, Integer> indegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (KpiDefinition d : byName.values()) {
            indegree.putIfAbsent(d.getName(), 0);
            for (String in : d.getInputs()) {
                if (!byName.containsKey(in)) continue;
                indegree.merge(d.getName(), 1, Integer::sum);
                dependents.computeIfAbsent(in, k -> new ArrayList<>()).add(d.getName());
            }
        }
        Deque<String> ready = new ArrayDeque<>();
        indegree.forEach((name, deg) -> {
            if (deg == 0) ready.add(name);
        });
        List<String> sorted = new ArrayList<>();
        while (!ready.isEmpty()) {
            String n = ready.poll();
            sorted.add(n);
            for (String dep : dependents.getOrDefault(n, List.of())) {
                if (indegree.merge(dep, -1, Integer::sum) == 0) ready.add(dep);
            }
        }
        if (sorted.size() != byName.size()) {
            List<String> cyclic = indegree.entrySet().stream()
                    .filter(e -> e.getValue() > 0)
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toList());
            throw new KpiRegistryException("KPI definitions contain a cycle among " + cyclic);
        }
        return List.copyOf(sorted);
    }

    public Optional<KpiDefinition> get(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean isKpi(String name) {
        return definitions.containsKey(name);
    }

    /** 지표 또는 기본 항목 이름이면 true */
    public boolean knows(String name) {
        return isKpi(name) || Concept.of(name).isPresent();
    }

    /** 입력이 항상 앞에 오는 순서 */
    public List<KpiDefinition> inOrder() {
        return order.stream().map(definitions::get).collect(Collectors.toList());
    }
}
