package com.example.finsight.exception;

import java.util.List;

/** 같은 기말일에 비슷한 크기의 서로 다른 값이 남아 기간을 확정할 수 없음 */
public class AmbiguousPeriodException extends FinanceException {
    public AmbiguousPeriodException(String message) {
        super(ErrorKind.AMBIGUOUS_PERIOD, message, List.of());
    }

    public AmbiguousPeriodException(String message, List<String> diagnostics) {
        super(ErrorKind.AMBIGUOUS_PERIOD, message, diagnostics);
    }
}
