package com.example.finsight.exception;

import java.util.List;

public class ValidationFailedException extends FinanceException {
    public ValidationFailedException(String message) {
        super(ErrorKind.VALIDATION_FAILED, message, List.of());
    }

    public ValidationFailedException(String message, List<String> diagnostics) {
        super(ErrorKind.VALIDATION_FAILED, message, diagnostics);
    }
}
