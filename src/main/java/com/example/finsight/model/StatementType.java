package com.example.finsight.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 재무제표 종류별 항목(응답 순서 그대로).
 */
public enum StatementType {
    INCOME("income", List.of("revenue", "costOfRevenue", "grossProfit", "operatingIncome", "ebitda",
            "netIncome", "epsDiluted")),
    BALANCE("balance", List.of("totalAssets", "totalLiabilities", "stockholdersEquity", "sharesOutstanding")),
    CASHFLOW("cashflow", List.of("operatingCashFlow", "capitalExpenditure", "freeCashFlow",
            "depreciationAndAmortization"));

    private final String id;
    private final List<String> items;

    StatementType(String id, List<String> items) {
        this.id = id;
        this.items = items;
    }

    public String id() { return id; }
    public List<String> items() { return items; }

    /** @throws IllegalArgumentException 알 수 없는 종류 */
    public static StatementType parse(String raw) {
        String v = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.id.equals(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported statement: " + raw + " (income, balance, cashflow)"));
    }
}
