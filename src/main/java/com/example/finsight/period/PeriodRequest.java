package com.example.finsight.period;

import com.example.finsight.model.Fact;
import com.example.finsight.model.Frequency;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 요청 기간: latest | YYYY-Qn | YYYY + 빈도 + TTM 여부 + asOf 상한.
 */
@Getter
@ToString
@EqualsAndHashCode
public class PeriodRequest {

    public enum Kind { LATEST, QUARTER, YEAR }

    private static final Pattern QUARTER = Pattern.compile("^(?:FY)?(\\d{4})-?Q([1-4])$");
    private static final Pattern YEAR = Pattern.compile("^(?:FY)?(\\d{4})$");

    private final Kind kind;
    private final Integer fiscalYear;
    private final Integer fiscalQuarter;
    private final Frequency frequency;
    private final boolean ttm;
    private final LocalDate asOf;

    private PeriodRequest(Kind kind, Integer fiscalYear, Integer fiscalQuarter, Frequency frequency, boolean ttm, LocalDate asOf) {
        this.kind = kind;
        this.fiscalYear = fiscalYear;
        this.fiscalQuarter = fiscalQuarter;
        this.frequency = frequency;
        this.ttm = ttm;
        this.asOf = asOf;
    }

    public static PeriodRequest latest(Frequency frequency, LocalDate asOf) {
        return new PeriodRequest(Kind.LATEST, null, null, frequency, false, asOf);
    }

    public static PeriodRequest quarter(int fiscalYear, int fiscalQuarter, LocalDate asOf) {
        return new PeriodRequest(Kind.QUARTER, fiscalYear, fiscalQuarter, Frequency.Q, false, asOf);
    }

    public static PeriodRequest year(int fiscalYear, LocalDate asOf) {
        return new PeriodRequest(Kind.YEAR, fiscalYear, null, Frequency.A, false, asOf);
    }

    /**
     * 쿼리 파라미터 해석. freq 가 비어 있으면 period 형식에서 추론한다.
     *
     * @throws IllegalArgumentException 형식이 잘못되었거나 period 와 freq 가 충돌할 때
     */
    public static PeriodRequest parse(String period, String freq, boolean ttm, LocalDate asOf) {
        if (asOf == null) throw new IllegalArgumentException("asOf is required");
        Frequency f = Frequency.parse(freq);
        String p = period == null || period.isBlank() ? "latest" : period.trim().toUpperCase(Locale.ROOT);

        PeriodRequest base;
        if ("LATEST".equals(p)) {
            base = latest(f == null ? Frequency.Q : f, asOf);
        } else {
            Matcher q = QUARTER.matcher(p);
            Matcher y = YEAR.matcher(p);
            if (q.matches()) {
                if (f == Frequency.A) throw new IllegalArgumentException("Quarter period " + period + " requires freq=Q");
                base = quarter(Integer.parseInt(q.group(1)), Integer.parseInt(q.group(2)), asOf);
            } else if (y.matches()) {
                if (f == Frequency.Q) throw new IllegalArgumentException("Year period " + period + " requires freq=A");
                base = year(Integer.parseInt(y.group(1)), asOf);
            } else {
                throw new IllegalArgumentException("Unsupported period: " + period + " (latest, YYYY-Qn or YYYY)");
            }
        }
        if (!ttm) return base;
        if (base.frequency == Frequency.A) throw new IllegalArgumentException("ttm=true is only supported for quarterly periods");
        return base.withTtm(true);
    }

    /** 계산 결과의 기간 표기(2024-Q4, 2024)를 같은 빈도의 명시적 요청으로. 회계 기간이 아니면 empty */
    public static Optional<PeriodRequest> ofLabel(String label, Frequency frequency, boolean ttm, LocalDate asOf) {
        if (label == null || frequency == null) return Optional.empty();
        Matcher q = QUARTER.matcher(label);
        if (frequency == Frequency.Q && q.matches()) {
            return Optional.of(new PeriodRequest(Kind.QUARTER, Integer.parseInt(q.group(1)),
                    Integer.parseInt(q.group(2)), Frequency.Q, ttm, asOf));
        }
        Matcher y = YEAR.matcher(label);
        if (frequency == Frequency.A && y.matches()) {
            return Optional.of(new PeriodRequest(Kind.YEAR, Integer.parseInt(y.group(1)), null, Frequency.A, false, asOf));
        }
        return Optional.empty();
    }

    /** 같은 빈도의 직전 기간 */
    public PeriodRequest previous() {
        if (kind == Kind.QUARTER) {
            return fiscalQuarter == 1
                    ? new PeriodRequest(Kind.QUARTER, fiscalYear - 1, 4, Frequency.Q, ttm, asOf)
                    : new PeriodRequest(Kind.QUARTER, fiscalYear, fiscalQuarter - 1, Frequency.Q, ttm, asOf);
        }
        if (kind == Kind.YEAR) {
            return new PeriodRequest(Kind.YEAR, fiscalYear - 1, null, Frequency.A, ttm, asOf);
        }
        throw new IllegalStateException("latest has no previous period");
    }

    public PeriodRequest withTtm(boolean value) {
        return new PeriodRequest(kind, fiscalYear, fiscalQuarter, frequency, value, asOf);
    }

    /** latest 요청이 확정된 뒤 같은 기간을 가리키는 명시적 요청 */
    public PeriodRequest pinnedTo(Fact resolved) {
        if (resolved.getFiscalYear() == null) return this;
        if (resolved.getFrequency() == Frequency.Q && resolved.getFiscalQuarter() != null) {
            return new PeriodRequest(Kind.QUARTER, resolved.getFiscalYear(), resolved.getFiscalQuarter(), Frequency.Q, ttm, asOf);
        }
        return new PeriodRequest(Kind.YEAR, resolved.getFiscalYear(), null, Frequency.A, ttm, asOf);
    }

    public boolean isLatest() {
        return kind == Kind.LATEST;
    }

    /** 캐시 키/메모이제이션에 쓰는 기간 토큰 */
    public String token() {
        return kind == Kind.LATEST ? "latest@" + asOf : label();
    }

    public String label() {
        if (kind == Kind.QUARTER) return fiscalYear + "-Q" + fiscalQuarter;
        if (kind == Kind.YEAR) return String.valueOf(fiscalYear);
        return "latest";
    }
}
