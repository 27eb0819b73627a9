package com.example.finsight.exception;

import java.util.List;

/**
 * 호출자에게 전달되는 계산 오류의 공통 부모. diagnostics 에는 원천별 실패 사유가 담긴다.
 */
public abstract class FinanceException extends RuntimeException {

    private final ErrorKind kind;
    private final List<String> diagnostics;

    protected FinanceException(ErrorKind kind, String message, List<String> diagnostics) {
        super(message);
        this.kind = kind;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    protected FinanceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.diagnostics = List.of();
    }

    public ErrorKind getKind() {
        return kind;
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }

    /** 메시지 뒤에 원천별 사유를 붙인 상세 문구 */
    public String detail() {
        if (diagnostics.isEmpty()) return getMessage();
        return getMessage() + " [" + String.join("; ", diagnostics) + "]";
    }
}
