package com.example.finsight.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FiscalCalendarTest {

    @Test
    @DisplayName("9월 결산(52/53주) 기업의 분기 번호")
    void septemberFiscalYear() {
        FiscalCalendar cal = FiscalCalendar.fromAnnualPeriodEnds(List.of(
                LocalDate.parse("2024-09-28"), LocalDate.parse("2023-09-30"), LocalDate.parse("2022-09-24")));
        assertEquals(9, cal.getFiscalYearEndMonth());

        assertEquals(2024, cal.fiscalYear(LocalDate.parse("2023-12-30")));
        assertEquals(1, cal.fiscalQuarter(LocalDate.parse("2023-12-30")));
        assertEquals(2, cal.fiscalQuarter(LocalDate.parse("2024-03-30")));
        assertEquals(3, cal.fiscalQuarter(LocalDate.parse("2024-06-29")));
        assertEquals(4, cal.fiscalQuarter(LocalDate.parse("2024-09-28")));
        assertEquals(2024, cal.fiscalYear(LocalDate.parse("2024-09-28")));
        // 10월 첫 주에 끝나는 회계연도는 9월로 본다
        assertEquals(2024, cal.fiscalYear(LocalDate.parse("2024-10-05")));
        assertEquals(4, cal.fiscalQuarter(LocalDate.parse("2024-10-05")));
    }

    @Test
    void calendarYearDefault() {
        FiscalCalendar cal = FiscalCalendar.fromAnnualPeriodEnds(List.of());
        assertEquals(12, cal.getFiscalYearEndMonth());
        assertEquals(1, cal.fiscalQuarter(LocalDate.parse("2024-03-31")));
        assertEquals(4, cal.fiscalQuarter(LocalDate.parse("2024-12-31")));
        assertEquals(2024, cal.fiscalYear(LocalDate.parse("2024-12-31")));
        assertThrows(IllegalArgumentException.class, () -> new FiscalCalendar(13));
    }
}
