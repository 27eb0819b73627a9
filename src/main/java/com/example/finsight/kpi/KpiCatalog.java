package com.example.finsight.kpi;

import com.example.finsight.exception.UndefinedMetricException;
import com.example.finsight.model.Concept;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Set;

/**
 * 기본 제공 지표 표.
 */
public final class KpiCatalog {

    static final MathContext MC = MathContext.DECIMAL64;

    private static final String USD = Concept.Units.USD;
    private static final String RATIO = Concept.Units.RATIO;

    private KpiCatalog() {}

    public static List<KpiDefinition> definitions() {
        return List.of(
                new KpiDefinition("grossProfit", List.of("revenue", "costOfRevenue"),
                        "revenue - costOfRevenue", USD, v -> v.get(0).subtract(v.get(1), MC)),
                new KpiDefinition("grossMargin", List.of("grossProfit", "revenue"),
                        "grossProfit / revenue", RATIO, v -> divide("grossMargin", v.get(0), v.get(1))),
                new KpiDefinition("operatingMargin", List.of("operatingIncome", "revenue"),
                        "operatingIncome / revenue", RATIO, v -> divide("operatingMargin", v.get(0), v.get(1))),
                new KpiDefinition("netMargin", List.of("netIncome", "revenue"),
                        "netIncome / revenue", RATIO, v -> divide("netMargin", v.get(0), v.get(1))),
                new KpiDefinition("ebitda", List.of("operatingIncome", "depreciationAndAmortization"),
                        "operatingIncome + depreciationAndAmortization", USD, v -> v.get(0).add(v.get(1), MC)),
                new KpiDefinition("ebitdaMargin", List.of("ebitda", "revenue"),
                        "ebitda / revenue", RATIO, v -> divide("ebitdaMargin", v.get(0), v.get(1))),
                new KpiDefinition("roe", List.of("netIncome", "stockholdersEquity"),
                        "netIncome / stockholdersEquity", RATIO, v -> divide("roe", v.get(0), v.get(1))),
                new KpiDefinition("roa", List.of("netIncome", "totalAssets"),
                        "netIncome / totalAssets", RATIO, v -> divide("roa", v.get(0), v.get(1))),
                new KpiDefinition("debtToEquity", List.of("totalLiabilities", "stockholdersEquity"),
                        "totalLiabilities / stockholdersEquity", RATIO, v -> divide("debtToEquity", v.get(0), v.get(1))),
                new KpiDefinition("freeCashFlow", List.of("operatingCashFlow", "capitalExpenditure"),
                        "operatingCashFlow - capitalExpenditure", USD, v -> v.get(0).subtract(v.get(1), MC)),
                new KpiDefinition("fcfMargin", List.of("freeCashFlow", "revenue"),
                        "freeCashFlow / revenue", RATIO, v -> divide("fcfMargin", v.get(0), v.get(1))),
                new KpiDefinition("marketCap", List.of("price", "sharesOutstanding"),
                        "price * sharesOutstanding", USD, v -> v.get(0).multiply(v.get(1), MC)),
                // 분기 순이익 하나로 나누면 연환산이 안 되므로 분기 요청에서도 TTM 순이익을 쓴다
                new KpiDefinition("peRatio", List.of("marketCap", "netIncome"), Set.of("netIncome"),
                        "marketCap / netIncome (TTM)", RATIO, v -> divide("peRatio", v.get(0), v.get(1))));
    }

    static BigDecimal divide(String metric, BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            throw new UndefinedMetricException(metric + " is undefined: division by zero");
        }
        return numerator.divide(denominator, MC);
    }
}
