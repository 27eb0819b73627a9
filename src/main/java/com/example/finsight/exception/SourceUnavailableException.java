package com.example.finsight.exception;

import java.util.List;

public class SourceUnavailableException extends FinanceException {
    public SourceUnavailableException(String message) {
        super(ErrorKind.SOURCE_UNAVAILABLE, message, List.of());
    }

    public SourceUnavailableException(String message, List<String> diagnostics) {
        super(ErrorKind.SOURCE_UNAVAILABLE, message, diagnostics);
    }
}
