package com.example.finsight;

import com.example.finsight.model.FinancialStatement;
import com.example.finsight.model.StatementType;
import com.example.finsight.period.PeriodRequest;
import com.example.finsight.service.FinanceCalcService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.ZoneOffset;

@RestController
@Tag(name = "Statement API", description = "재무제표 항목 조회")
public class StatementController {

    private final FinanceCalcService calcSvc;

    public StatementController(FinanceCalcService calcSvc) {
        this.calcSvc = calcSvc;
    }

    @GetMapping("/v1/finance/statements/{ticker}/{type}")
    @Operation(summary = "재무제표 조회", description = "손익(income), 재무상태(balance), 현금흐름(cashflow) 항목을 "
            + "한 기간 기준으로 출처와 함께 반환합니다")
    public Mono<FinancialStatement> statement(
            @Parameter(description = "티커. 예) AAPL") @PathVariable String ticker,
            @Parameter(description = "income | balance | cashflow") @PathVariable String type,
            @Parameter(description = "기간. latest | YYYY-Qn | YYYY") @RequestParam(defaultValue = "latest") String period,
            @Parameter(description = "빈도 Q(분기) 또는 A(연간). 생략 시 period 형식에서 추론") @RequestParam(required = false) String freq,
            @Parameter(description = "기준일 YYYY-MM-DD(기본: 오늘)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        StatementType st = StatementType.parse(type);
        LocalDate ref = asOf == null ? LocalDate.now(ZoneOffset.UTC) : asOf;
        PeriodRequest req = PeriodRequest.parse(period, freq, false, ref);
        return calcSvc.statement(ticker.trim().toUpperCase(), st, req);
    }
}
