package com.example.finsight.source;

import com.example.finsight.config.FinanceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 기동 시 등록된 원천 목록. 요청 처리 중에는 바뀌지 않는다.
 */
@Component
public class SourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final List<SourceAdapter> adapters;
    private final Set<String> disabled;

    public SourceRegistry(List<SourceAdapter> adapters, FinanceProperties props) {
        List<SourceAdapter> sorted = new ArrayList<>(adapters);
        // 안정 정렬: 같은 tier 는 등록 순서 유지
        sorted.sort(Comparator.comparingInt(SourceAdapter::tier));
        this.adapters = List.copyOf(sorted);
        this.disabled = Set.copyOf(props.getRouter().getDisabledSources());
        for (SourceAdapter a : this.adapters) {
            log.info("Source {} (tier {}) enabled={} concepts={}", a.id(), a.tier(), isActive(a), a.supportedConcepts());
        }
    }

    public List<SourceAdapter> all() {
        return adapters;
    }

    public boolean isActive(SourceAdapter adapter) {
        return adapter.isEnabled() && !disabled.contains(adapter.id());
    }

    /** 활성 여부와 무관하게 항목을 지원하는 최상위 원천. 이 원천의 값만 폴백이 아니다 */
    public Optional<String> preferredFor(String concept) {
        return adapters.stream()
                .filter(a -> a.supports(concept))
                .map(SourceAdapter::id)
                .findFirst();
    }

    /** 항목을 지원하는 활성 원천(tier 순) */
    public List<SourceAdapter> chainFor(String concept) {
        return adapters.stream()
                .filter(this::isActive)
                .filter(a -> a.supports(concept))
                .collect(Collectors.toList());
    }
}
