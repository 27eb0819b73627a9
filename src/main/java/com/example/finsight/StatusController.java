package com.example.finsight;

import com.example.finsight.model.SourceStatus;
import com.example.finsight.service.FinanceCalcService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@Tag(name = "Status API", description = "원천 상태")
public class StatusController {

    private final FinanceCalcService calcSvc;

    public StatusController(FinanceCalcService calcSvc) {
        this.calcSvc = calcSvc;
    }

    @GetMapping("/v1/finance/status")
    @Operation(summary = "원천 상태 조회", description = "원천별 우선순위, 활성 여부, 연속 장애 횟수와 폴백 상태를 반환합니다")
    public Mono<List<SourceStatus>> status() {
        return Mono.just(calcSvc.sourceStatus());
    }
}
