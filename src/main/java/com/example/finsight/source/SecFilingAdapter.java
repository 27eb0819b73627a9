package com.example.finsight.source;

import com.example.finsight.http.SecEdgarClient;
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
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
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
 * SEC EDGAR XBRL companyfacts 기반 원천(1순위).
 * <ul>
 *   <li>공시(accession)마다 기말일이 가장 늦은 항목만 남긴다. 비교용 전년도 수치는 버린다.</li>
 *   <li>분기 FLOW 는 80~100일, 연간은 350~380일 구간만 인정한다(YTD 누계 제외).</li>
 *   <li>10-K 에는 4분기 수치가 없으므로 FY - (Q1+Q2+Q3) 로 만든다.</li>
 *   <li>10-K 잔액(INSTANT)은 연간 값과 4분기 값으로 모두 낸다.</li>
 * </ul>
 */
@Component
public class SecFilingAdapter implements SourceAdapter {

    public static final String ID = "regulatory-filing";

    /** 항목별 XBRL 태그 후보(앞쪽이 우선) */
    private static final Map<String, List<String>> TAGS = new LinkedHashMap<>();

    static {
        TAGS.put("revenue", List.of(
                "us-gaap:RevenueFromContractWithCustomerExcludingAssessedTax",
                "us-gaap:Revenues",
                "us-gaap:SalesRevenueNet",
                "us-gaap:RevenueFromContractWithCustomerIncludingAssessedTax"));
        TAGS.put("costOfRevenue", List.of(
                "us-gaap:CostOfGoodsAndServicesSold",
                "us-gaap:CostOfRevenue",
                "us-gaap:CostOfGoodsSold",
                "us-gaap:CostOfGoodsAndServiceExcludingDepreciationDepletionAndAmortization"));
        TAGS.put("operatingIncome", List.of("us-gaap:OperatingIncomeLoss"));
        TAGS.put("netIncome", List.of("us-gaap:NetIncomeLoss", "us-gaap:ProfitLoss"));
        TAGS.put("depreciationAndAmortization", List.of(
                "us-gaap:DepreciationDepletionAndAmortization",
                "us-gaap:DepreciationAndAmortization",
                "us-gaap:DepreciationAmortizationAndAccretionNet"));
        TAGS.put("operatingCashFlow", List.of("us-gaap:NetCashProvidedByUsedInOperatingActivities"));
        TAGS.put("capitalExpenditure", List.of("us-gaap:PaymentsToAcquirePropertyPlantAndEquipment"));
        TAGS.put("epsDiluted", List.of("us-gaap:EarningsPerShareDiluted"));
        TAGS.put("totalAssets", List.of("us-gaap:Assets"));
        TAGS.put("totalLiabilities", List.of("us-gaap:Liabilities"));
        TAGS.put("stockholdersEquity", List.of(
                "us-gaap:StockholdersEquity",
                "us-gaap:StockholdersEquityIncludingPortionAttributableToNoncontrollingInterest"));
        TAGS.put("sharesOutstanding", List.of(
                "dei:EntityCommonStockSharesOutstanding",
                "us-gaap:CommonStockSharesOutstanding"));
    }

    private final SecEdgarClient sec;

    public SecFilingAdapter(SecEdgarClient sec) {
        this.sec = sec;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public int tier() {
        return 1;
    }

    @Override
    public Set<String> supportedConcepts() {
        return TAGS.keySet();
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public Mono<List<Fact>> fetch(EntityRef entity, String concept, PeriodRequest hint) {
        if (!entity.hasCik()) {
            return Mono.error(SourceException.notFound(ID, "No CIK for " + entity.getTicker()));
        }
        List<String> tags = TAGS.get(concept);
        if (tags == null) {
            return Mono.error(SourceException.notFound(ID, "Unsupported concept " + concept));
        }
        Concept c = Concept.require(concept);
        return sec.getCompanyFacts(entity.getCik())
                .switchIfEmpty(Mono.error(SourceException.notFound(ID, "Empty companyfacts for " + entity.getCik())))
                .map(body -> parse(entity, c, tags, body))
                .flatMap(list -> list.isEmpty()
                        ? Mono.error(SourceException.notFound(ID, concept + " not reported for " + entity.getTicker()))
                        : Mono.just(list))
                .onErrorMap(e -> SourceErrors.classify(ID, e));
    }

    List<Fact> parse(EntityRef entity, Concept concept, List<String> tags, Map<String, Object> body) {
        Map<String, Object> facts = asMap(body.get("facts"));
        if (facts == null) throw SourceException.malformed(ID, "companyfacts without 'facts'");

        List<SecRow> rows = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String tag : tags) {
            String[] parts = tag.split(":", 2);
            Map<String, Object> taxonomy = asMap(facts.get(parts[0]));
            Map<String, Object> node = taxonomy == null ? null : asMap(taxonomy.get(parts[1]));
            Map<String, Object> units = node == null ? null : asMap(node.get("units"));
            if (units == null) continue;
            List<Map<String, Object>> raw = asListOfMap(units.get(concept.unit()));

            Map<String, LocalDate> latestEnd = new HashMap<>();
            for (Map<String, Object> r : raw) {
                LocalDate end = asDate(r.get("end"));
                String accn = asString(r.get("accn"));
                if (end == null || accn == null) continue;
                latestEnd.merge(accn, end, (a, b) -> a.isAfter(b) ? a : b);
            }
            for (Map<String, Object> r : raw) {
                SecRow row = SecRow.of(r);
                if (row == null || !row.end.equals(latestEnd.get(row.accn))) continue;
                // 태그가 바뀌어도 같은 공시·같은 구간은 한 번만
                if (!seen.add(row.accn + "|" + row.start + "|" + row.end)) continue;
                rows.add(row);
            }
        }

        Instant now = Instant.now();
        List<Fact> out = new ArrayList<>();
        for (SecRow row : rows) {
            Fact f = toFact(entity, concept, row, now);
            if (f == null) continue;
            out.add(f);
            // 연말 잔액은 4분기 말 잔액
            if (row.start == null && f.getFrequency() == Frequency.A) {
                out.add(f.toBuilder().frequency(Frequency.Q).fiscalQuarter(4).build());
            }
        }
        if (concept.isFlow() && !Concept.Units.USD_PER_SHARE.equals(concept.unit())) {
            out.addAll(deriveFourthQuarters(out));
        }
        return out;
    }

    private Fact toFact(EntityRef entity, Concept concept, SecRow row, Instant now) {
        boolean annualForm = row.form != null && row.form.startsWith("10-K");
        Frequency freq;
        Integer quarter;
        if (row.start != null) {
            long days = ChronoUnit.DAYS.between(row.start, row.end);
            if (days >= 80 && days <= 100) {
                freq = Frequency.Q;
                quarter = annualForm ? Integer.valueOf(4) : quarterOf(row.fp);
            } else if (days >= 350 && days <= 380) {
                freq = Frequency.A;
                quarter = null;
            } else {
                return null;
            }
        } else {
            // INSTANT: 10-K 잔액은 연간 값으로, 10-Q 잔액은 해당 분기 값으로
            if (annualForm) {
                freq = Frequency.A;
                quarter = null;
            } else {
                freq = Frequency.Q;
                quarter = quarterOf(row.fp);
            }
        }
        if (freq == Frequency.Q && quarter == null) return null;
        return Fact.builder()
                .entityId(entity.getId())
                .concept(concept.id())
                .periodEnd(row.end)
                .fiscalYear(row.fy)
                .fiscalQuarter(quarter)
                .frequency(freq)
                .value(row.val)
                .unit(concept.unit())
                .sourceId(ID)
                .url(SecEdgarClient.filingUrl(entity.getCik(), row.accn))
                .form(row.form)
                .filed(row.filed)
                .retrievedAt(now)
                .build();
    }

    /** 같은 회계연도의 Q1~Q3 과 연간 값이 있고 Q4 가 없으면 Q4 = FY - (Q1+Q2+Q3) */
    private List<Fact> deriveFourthQuarters(List<Fact> facts) {
        Map<Integer, Fact> annual = new HashMap<>();
        Map<Integer, Map<Integer, Fact>> quarters = new HashMap<>();
        for (Fact f : facts) {
            if (f.getFiscalYear() == null) continue;
            if (f.getFrequency() == Frequency.A) {
                annual.merge(f.getFiscalYear(), f, SecFilingAdapter::laterFiled);
            } else {
                quarters.computeIfAbsent(f.getFiscalYear(), k -> new HashMap<>())
                        .merge(f.getFiscalQuarter(), f, SecFilingAdapter::laterFiled);
            }
        }
        List<Fact> derived = new ArrayList<>();
        for (Map.Entry<Integer, Fact> e : annual.entrySet()) {
            Map<Integer, Fact> q = quarters.getOrDefault(e.getKey(), Map.of());
            if (q.containsKey(4) || !q.containsKey(1) || !q.containsKey(2) || !q.containsKey(3)) continue;
            Fact fy = e.getValue();
            BigDecimal q4 = fy.getValue()
                    .subtract(q.get(1).getValue())
                    .subtract(q.get(2).getValue())
                    .subtract(q.get(3).getValue());
            derived.add(fy.toBuilder()
                    .frequency(Frequency.Q)
                    .fiscalQuarter(4)
                    .value(q4)
                    .build());
        }
        return derived;
    }

    private static Fact laterFiled(Fact a, Fact b) {
        if (a.getFiled() == null) return b;
        if (b.getFiled() == null) return a;
        return b.getFiled().isAfter(a.getFiled()) ? b : a;
    }

    private static Integer quarterOf(String fp) {
        if (fp == null) return null;
        if (fp.equals("Q1")) return 1;
        if (fp.equals("Q2")) return 2;
        if (fp.equals("Q3")) return 3;
        if (fp.equals("Q4") || fp.equals("FY")) return 4;
        return null;
    }

    private static final class SecRow {
        LocalDate start;
        LocalDate end;
        BigDecimal val;
        String accn;
        Integer fy;
        String fp;
        String form;
        LocalDate filed;

        static SecRow of(Map<String, Object> r) {
            SecRow row = new SecRow();
            row.end = asDate(r.get("end"));
            row.val = asDecimal(r.get("val"));
            row.accn = asString(r.get("accn"));
            if (row.end == null || row.val == null || row.accn == null) return null;
            row.start = asDate(r.get("start"));
            BigDecimal fy = asDecimal(r.get("fy"));
            row.fy = fy == null ? null : fy.intValue();
            row.fp = asString(r.get("fp"));
            row.form = asString(r.get("form"));
            row.filed = asDate(r.get("filed"));
            return row;
        }
    }
}
