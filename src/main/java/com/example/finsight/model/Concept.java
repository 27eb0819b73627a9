package com.example.finsight.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 원천 데이터에서 직접 가져오는 기본 재무 항목.
 * FLOW 는 기간 합산(TTM) 대상, INSTANT 는 기말 잔액, LIVE 는 현재 시세 기준.
 */
public enum Concept {
    REVENUE("revenue", Kind.FLOW, false, Units.USD),
    COST_OF_REVENUE("costOfRevenue", Kind.FLOW, false, Units.USD),
    OPERATING_INCOME("operatingIncome", Kind.FLOW, true, Units.USD),
    NET_INCOME("netIncome", Kind.FLOW, true, Units.USD),
    DEPRECIATION_AND_AMORTIZATION("depreciationAndAmortization", Kind.FLOW, false, Units.USD),
    OPERATING_CASH_FLOW("operatingCashFlow", Kind.FLOW, true, Units.USD),
    CAPITAL_EXPENDITURE("capitalExpenditure", Kind.FLOW, false, Units.USD),
    EPS_DILUTED("epsDiluted", Kind.FLOW, true, Units.USD_PER_SHARE),
    TOTAL_ASSETS("totalAssets", Kind.INSTANT, false, Units.USD),
    TOTAL_LIABILITIES("totalLiabilities", Kind.INSTANT, false, Units.USD),
    STOCKHOLDERS_EQUITY("stockholdersEquity", Kind.INSTANT, true, Units.USD),
    SHARES_OUTSTANDING("sharesOutstanding", Kind.INSTANT, false, Units.SHARES),
    PRICE("price", Kind.LIVE, false, Units.USD_PER_SHARE);

    public enum Kind { FLOW, INSTANT, LIVE }

    public static final class Units {
        public static final String USD = "USD";
        public static final String SHARES = "shares";
        public static final String USD_PER_SHARE = "USD/shares";
        public static final String RATIO = "ratio";

        private Units() {}
    }

    private final String id;
    private final Kind kind;
    private final boolean signed;
    private final String unit;

    Concept(String id, Kind kind, boolean signed, String unit) {
        this.id = id;
        this.kind = kind;
        this.signed = signed;
        this.unit = unit;
    }

    public String id() { return id; }
    public Kind kind() { return kind; }
    public boolean isSigned() { return signed; }
    public String unit() { return unit; }
    public boolean isLive() { return kind == Kind.LIVE; }
    public boolean isFlow() { return kind == Kind.FLOW; }

    public static Optional<Concept> of(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values()).filter(c -> c.id.equals(id)).findFirst();
    }

    public static Concept require(String id) {
        return of(id).orElseThrow(() -> new IllegalArgumentException("Unknown concept: " + id));
    }
}
