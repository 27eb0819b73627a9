package com.example.finsight.source;

import com.example.finsight.http.AlphaVantageClient;
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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.finsight.util.JsonMaps.asDate;
import static com.example.finsight.util.JsonMaps.asDecimal;
import static com.example.finsight.util.JsonMaps.asListOfMap;

/**
 * Alpha Vantage 재무제표 기반 원천(2순위). API 키가 없으면 비활성.
 */
@Component
public class MarketDataAdapter implements SourceAdapter {

    public static final String ID = "market-data";

    private static final class Field {
        final String function;
        final List<String> names;

        Field(String function, String... names) {
            this.function = function;
            this.names = List.of(names);
        }
    }

    private static final Map<String, Field> FIELDS = new LinkedHashMap<>();

    static {
        FIELDS.put("revenue", new Field("INCOME_STATEMENT", "totalRevenue"));
        FIELDS.put("costOfRevenue", new Field("INCOME_STATEMENT", "costOfRevenue", "costofGoodsAndServicesSold"));
        FIELDS.put("operatingIncome", new Field("INCOME_STATEMENT", "operatingIncome"));
        FIELDS.put("netIncome", new Field("INCOME_STATEMENT", "netIncome"));
        FIELDS.put("depreciationAndAmortization", new Field("INCOME_STATEMENT", "depreciationAndAmortization"));
        FIELDS.put("totalAssets", new Field("BALANCE_SHEET", "totalAssets"));
        FIELDS.put("totalLiabilities", new Field("BALANCE_SHEET", "totalLiabilities"));
        FIELDS.put("stockholdersEquity", new Field("BALANCE_SHEET", "totalShareholderEquity"));
        FIELDS.put("sharesOutstanding", new Field("BALANCE_SHEET", "commonStockSharesOutstanding"));
        FIELDS.put("operatingCashFlow", new Field("CASH_FLOW", "operatingCashflow"));
        FIELDS.put("capitalExpenditure", new Field("CASH_FLOW", "capitalExpenditures"));
    }

    private final AlphaVantageClient alpha;

    public MarketDataAdapter(AlphaVantageClient alpha) {
        this.alpha = alpha;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public int tier() {
        return 2;
    }

    @Override
    public Set<String> supportedConcepts() {
        return FIELDS.keySet();
    }

    @Override
    public boolean isEnabled() {
        return alpha.isEnabled();
    }

    @Override
    public Mono<List<Fact>> fetch(EntityRef entity, String concept, PeriodRequest hint) {
        Field field = FIELDS.get(concept);
        if (field == null) {
            return Mono.error(SourceException.notFound(ID, "Unsupported concept " + concept));
        }
        Concept c = Concept.require(concept);
        String symbol = entity.getTicker();
        return alpha.getStatement(field.function, symbol)
                .switchIfEmpty(Mono.error(new SourceException(ID, SourceException.Reason.UNAVAILABLE, "Alpha Vantage disabled")))
                .map(body -> parse(entity, c, field, body))
                .flatMap(list -> list.isEmpty()
                        ? Mono.error(SourceException.notFound(ID, concept + " not reported for " + symbol))
                        : Mono.just(list))
                .onErrorMap(e -> SourceErrors.classify(ID, e));
    }

    List<Fact> parse(EntityRef entity, Concept concept, Field field, Map<String, Object> body) {
        // 무료 키 한도 초과 시 200 응답에 Note/Information 만 온다
        if (body.containsKey("Note") || body.containsKey("Information")) {
            throw new SourceException(ID, SourceException.Reason.RATE_LIMITED, String.valueOf(
                    body.getOrDefault("Note", body.get("Information"))));
        }
        if (body.containsKey("Error Message")) {
            throw SourceException.notFound(ID, String.valueOf(body.get("Error Message")));
        }
        if (!body.containsKey("annualReports") && !body.containsKey("quarterlyReports")) {
            throw SourceException.malformed(ID, "Statement without reports");
        }
        List<Map<String, Object>> annual = asListOfMap(body.get("annualReports"));
        List<Map<String, Object>> quarterly = asListOfMap(body.get("quarterlyReports"));

        List<LocalDate> annualEnds = new ArrayList<>();
        for (Map<String, Object> r : annual) {
            LocalDate d = asDate(r.get("fiscalDateEnding"));
            if (d != null) annualEnds.add(d);
        }
        FiscalCalendar calendar = FiscalCalendar.fromAnnualPeriodEnds(annualEnds);

        Instant now = Instant.now();
        String url = "https://www.alphavantage.co/query?function=" + field.function + "&symbol=" + entity.getTicker();
        List<Fact> out = new ArrayList<>();
        for (Map<String, Object> r : annual) {
            Fact f = toFact(entity, concept, field, r, Frequency.A, calendar, url, now);
            if (f != null) out.add(f);
        }
        for (Map<String, Object> r : quarterly) {
            Fact f = toFact(entity, concept, field, r, Frequency.Q, calendar, url, now);
            if (f != null) out.add(f);
        }
        return out;
    }

    private Fact toFact(EntityRef entity, Concept concept, Field field, Map<String, Object> report,
                        Frequency freq, FiscalCalendar calendar, String url, Instant now) {
        LocalDate end = asDate(report.get("fiscalDateEnding"));
        if (end == null) return null;
        BigDecimal value = null;
        for (String name : field.names) {
            value = asDecimal(report.get(name));
            if (value != null) break;
        }
        if (value == null) return null;
        String currency = String.valueOf(report.getOrDefault("reportedCurrency", "USD"));
        String unit = Concept.Units.USD.equals(concept.unit()) ? currency : concept.unit();
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
