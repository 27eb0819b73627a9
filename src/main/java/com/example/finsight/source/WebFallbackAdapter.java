package com.example.finsight.source;

import com.example.finsight.http.YahooApiClient;
import com.example.finsight.model.Concept;
import com.example.finsight.model.EntityRef;
import com.example.finsight.model.Fact;
import com.example.finsight.model.Frequency;
import com.example.finsight.period.PeriodRequest;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.finsight.util.JsonMaps.asDate;
import static com.example.finsight.util.JsonMaps.asDecimal;
import static com.example.finsight.util.JsonMaps.asListOfMap;
import static com.example.finsight.util.JsonMaps.asMap;
import static com.example.finsight.util.JsonMaps.asString;

/**
 * Yahoo fundamentals-timeseries 기반 최후 순위 원천.
 */
@Component
public class WebFallbackAdapter implements SourceAdapter {

    public static final String ID = "web-fallback";

    private static final Map<String, String> TYPES = new LinkedHashMap<>();

    static {
        TYPES.put("revenue", "TotalRevenue");
        TYPES.put("costOfRevenue", "CostOfRevenue");
        TYPES.put("operatingIncome", "OperatingIncome");
        TYPES.put("netIncome", "NetIncome");
        TYPES.put("depreciationAndAmortization", "ReconciledDepreciation");
        TYPES.put("operatingCashFlow", "OperatingCashFlow");
        TYPES.put("capitalExpenditure", "CapitalExpenditure");
        TYPES.put("epsDiluted", "DilutedEPS");
        TYPES.put("totalAssets", "TotalAssets");
        TYPES.put("totalLiabilities", "TotalLiabilitiesNetMinorityInterest");
        TYPES.put("stockholdersEquity", "StockholdersEquity");
        TYPES.put("sharesOutstanding", "OrdinarySharesNumber");
    }

    private final YahooApiClient yahoo;

    public WebFallbackAdapter(YahooApiClient yahoo) {
        this.yahoo = yahoo;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public int tier() {
        return 3;
    }

    @Override
    public Set<String> supportedConcepts() {
        return TYPES.keySet();
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public Mono<List<Fact>> fetch(EntityRef entity, String concept, PeriodRequest hint) {
        String type = TYPES.get(concept);
        if (type == null) {
            return Mono.error(SourceException.notFound(ID, "Unsupported concept " + concept));
        }
        Concept c = Concept.require(concept);
        LocalDate to = hint == null || hint.getAsOf() == null ? LocalDate.now() : hint.getAsOf();
        Instant until = to.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC);
        Instant from = until.minus(365L * 6, ChronoUnit.DAYS);
        return yahoo.getTimeseries(entity.getTicker(), List.of("quarterly" + type, "annual" + type), from, until)
                .map(body -> parse(entity, c, type, body))
                .flatMap(list -> list.isEmpty()
                        ? Mono.error(SourceException.notFound(ID, concept + " not reported for " + entity.getTicker()))
                        : Mono.just(list))
                .onErrorMap(e -> SourceErrors.classify(ID, e));
    }

    List<Fact> parse(EntityRef entity, Concept concept, String type, Map<String, Object> body) {
        Map<String, Object> ts = asMap(body.get("timeseries"));
        if (ts == null) throw SourceException.malformed(ID, "Response without 'timeseries'");
        List<Map<String, Object>> results = asListOfMap(ts.get("result"));

        List<Map<String, Object>> annualRows = new ArrayList<>();
        List<Map<String, Object>> quarterlyRows = new ArrayList<>();
        for (Map<String, Object> r : results) {
            annualRows.addAll(asListOfMap(r.get("annual" + type)));
            quarterlyRows.addAll(asListOfMap(r.get("quarterly" + type)));
        }

        List<LocalDate> annualEnds = new ArrayList<>();
        for (Map<String, Object> r : annualRows) {
            LocalDate d = asDate(r.get("asOfDate"));
            if (d != null) annualEnds.add(d);
        }
        FiscalCalendar calendar = FiscalCalendar.fromAnnualPeriodEnds(annualEnds);

        Instant now = Instant.now();
        String url = "https://finance.yahoo.com/quote/" + entity.getTicker() + "/financials";
        List<Fact> out = new ArrayList<>();
        for (Map<String, Object> r : annualRows) {
            Fact f = toFact(entity, concept, r, Frequency.A, calendar, url, now);
            if (f != null) out.add(f);
        }
        for (Map<String, Object> r : quarterlyRows) {
            Fact f = toFact(entity, concept, r, Frequency.Q, calendar, url, now);
            if (f != null) out.add(f);
        }
        return out;
    }

    private Fact toFact(EntityRef entity, Concept concept, Map<String, Object> row, Frequency freq,
                        FiscalCalendar calendar, String url, Instant now) {
        LocalDate end = asDate(row.get("asOfDate"));
        BigDecimal value = asDecimal(row.get("reportedValue"));
        if (end == null || value == null) return null;
        // Yahoo 는 설비투자를 현금 유출(음수)로 준다
        if (concept == Concept.CAPITAL_EXPENDITURE) value = value.abs();
        String currency = asString(row.get("currencyCode"));
        String unit = Concept.Units.USD.equals(concept.unit()) && currency != null ? currency : concept.unit();
        return Fact.builder()
                .entityId(entity.getId())
                .concept(concept.id())
                .periodEnd(end)
                .fiscalYear(calendar.fiscalYear(end))
                .fiscalQuarter(freq == Frequency.Q ? Integer.valueOf(calendar.fiscalQuarter(end)) : null)
                .frequency(freq)
                .value(value)
                .unit(unit)
                .sourceId(ID)
                .url(url)
                .retrievedAt(now)
                .build();
    }
}
