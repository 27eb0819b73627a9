package com.example.finsight.exception;

import java.util.List;

/** 엔티티·지표·기간에 해당하는 데이터가 어느 원천에도 없음 */
public class NotFoundException extends FinanceException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message, List.of());
    }

    public NotFoundException(String message, List<String> diagnostics) {
        super(ErrorKind.NOT_FOUND, message, diagnostics);
    }
}
