package com.example.finsight.exception;

import java.util.List;

/** 0 으로 나누기 등 수학적으로 정의되지 않는 지표 */
public class UndefinedMetricException extends FinanceException {
    public UndefinedMetricException(String message) {
        super(ErrorKind.UNDEFINED, message, List.of());
    }

    public UndefinedMetricException(String message, List<String> diagnostics) {
        super(ErrorKind.UNDEFINED, message, diagnostics);
    }
}
