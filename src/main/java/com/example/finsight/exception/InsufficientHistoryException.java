package com.example.finsight.exception;

import java.util.List;

/** TTM 계산에 필요한 연속 4개 분기가 없음 */
public class InsufficientHistoryException extends FinanceException {
    public InsufficientHistoryException(String message) {
        super(ErrorKind.INSUFFICIENT_HISTORY, message, List.of());
    }

    public InsufficientHistoryException(String message, List<String> diagnostics) {
        super(ErrorKind.INSUFFICIENT_HISTORY, message, diagnostics);
    }
}
