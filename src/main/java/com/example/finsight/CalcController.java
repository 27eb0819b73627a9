package com.example.finsight;

import com.example.finsight.model.KpiResult;
import com.example.finsight.model.KpiSeries;
import com.example.finsight.model.MetricInfo;
import com.example.finsight.period.PeriodRequest;
import com.example.finsight.service.FinanceCalcService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

@RestController
@RequestMapping("/v1/finance/calc")
@Tag(name = "Finance Calc API", description = "원천 Fact 집계 및 KPI 계산")
public class CalcController {

    private static final int MAX_SERIES_LIMIT = 50;

    private final FinanceCalcService calcSvc;

    public CalcController(FinanceCalcService calcSvc) {
        this.calcSvc = calcSvc;
    }

    @GetMapping("/{ticker}/{metric}")
    @Operation(summary = "KPI 계산", description = "기본 항목(revenue 등) 또는 파생 지표(grossMargin 등)를 계산합니다. "
            + "SEC 공시 우선, 실패/검증 거부 시 하위 원천으로 폴백하며 출처와 신뢰도를 함께 돌려줍니다")
    public Mono<KpiResult> calc(
            @Parameter(description = "티커. 예) AAPL, MSFT") @PathVariable String ticker,
            @Parameter(description = "지표 이름. 예) revenue, grossProfit, grossMargin, ebitda, roe") @PathVariable String metric,
            @Parameter(description = "기간. latest | YYYY-Qn | YYYY (회계연도 기준)") @RequestParam(defaultValue = "latest") String period,
            @Parameter(description = "빈도 Q(분기) 또는 A(연간). 생략 시 period 형식에서 추론") @RequestParam(required = false) String freq,
            @Parameter(description = "최근 4개 분기 합산(TTM). 분기 빈도에서만 허용") @RequestParam(defaultValue = "false") boolean ttm,
            @Parameter(description = "기준일 YYYY-MM-DD. 이후 기말 값은 제외(기본: 오늘)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf,
            @Parameter(description = "요청 제한 시간(ms). 기본 15000") @RequestParam(required = false) Long deadlineMs) {
        LocalDate ref = asOf == null ? LocalDate.now(ZoneOffset.UTC) : asOf;
        PeriodRequest req = PeriodRequest.parse(period, freq, ttm, ref);
        if (deadlineMs != null && deadlineMs <= 0) {
            throw new IllegalArgumentException("deadlineMs must be positive");
        }
        String t = ticker.trim().toUpperCase();
        return calcSvc.compute(t, metric.trim(), req, deadlineMs == null ? null : Duration.ofMillis(deadlineMs));
    }

    @GetMapping("/{ticker}/{metric}/series")
    @Operation(summary = "KPI 시계열", description = "가장 최근 기간부터 limit 개 기간의 값을 출처와 함께 반환합니다. "
            + "값이 없는 기간은 missing 에 사유와 함께 남깁니다")
    public Mono<KpiSeries> series(
            @Parameter(description = "티커. 예) AAPL") @PathVariable String ticker,
            @Parameter(description = "지표 이름. 예) revenue, grossMargin") @PathVariable String metric,
            @Parameter(description = "빈도 Q(분기) 또는 A(연간)") @RequestParam(defaultValue = "Q") String freq,
            @Parameter(description = "기간 수(1~50)") @RequestParam(defaultValue = "12") int limit,
            @Parameter(description = "최근 4개 분기 합산(TTM). 분기 빈도에서만 허용") @RequestParam(defaultValue = "false") boolean ttm,
            @Parameter(description = "기준일 YYYY-MM-DD(기본: 오늘)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        if (limit < 1 || limit > MAX_SERIES_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_SERIES_LIMIT);
        }
        LocalDate ref = asOf == null ? LocalDate.now(ZoneOffset.UTC) : asOf;
        PeriodRequest latest = PeriodRequest.parse("latest", freq, ttm, ref);
        return calcSvc.series(ticker.trim().toUpperCase(), metric.trim(), latest, limit);
    }

    @GetMapping("/metrics")
    @Operation(summary = "지표 목록", description = "기본 항목과 파생 지표(입력, 식, 단위)를 계산 순서대로 반환합니다")
    public Mono<List<MetricInfo>> metrics() {
        return Mono.just(calcSvc.metrics());
    }
}
