package com.example.finsight.source;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 회계연도 말 월(fiscal year-end month)을 기준으로 분기 말 날짜에 회계연도/분기를 부여한다.
 * 52/53주 회계(기말이 월초 1주 이내로 넘어가는 경우)는 직전 월로 본다.
 */
public final class FiscalCalendar {

    private final int fiscalYearEndMonth;

    public FiscalCalendar(int fiscalYearEndMonth) {
        if (fiscalYearEndMonth < 1 || fiscalYearEndMonth > 12) {
            throw new IllegalArgumentException("month must be 1..12: " + fiscalYearEndMonth);
        }
        this.fiscalYearEndMonth = fiscalYearEndMonth;
    }

    /** 연간 기말일들에서 가장 많이 나온 월을 회계연도 말로 본다. 연간 자료가 없으면 12월 */
    public static FiscalCalendar fromAnnualPeriodEnds(Collection<LocalDate> annualEnds) {
        if (annualEnds == null || annualEnds.isEmpty()) return new FiscalCalendar(12);
        Map<Integer, Long> counts = annualEnds.stream()
                .map(d -> effectiveMonth(d).getMonthValue())
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        int month = counts.entrySet().stream()
                .max(Map.Entry.<Integer, Long>comparingByValue().thenComparing(Map.Entry.<Integer, Long>comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(12);
        return new FiscalCalendar(month);
    }

    public int getFiscalYearEndMonth() {
        return fiscalYearEndMonth;
    }

    public int fiscalYear(LocalDate periodEnd) {
        YearMonth ym = effectiveMonth(periodEnd);
        return ym.getMonthValue() <= fiscalYearEndMonth ? ym.getYear() : ym.getYear() + 1;
    }

    public int fiscalQuarter(LocalDate periodEnd) {
        int m = effectiveMonth(periodEnd).getMonthValue();
        int diff = (m - fiscalYearEndMonth + 12) % 12;
        return ((diff + 11) % 12) / 3 + 1;
    }

    private static YearMonth effectiveMonth(LocalDate d) {
        YearMonth ym = YearMonth.from(d);
        return d.getDayOfMonth() <= 7 ? ym.minusMonths(1) : ym;
    }
}
