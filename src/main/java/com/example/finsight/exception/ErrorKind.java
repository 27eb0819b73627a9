package com.example.finsight.exception;

import org.springframework.http.HttpStatus;

/**
 * 계산 실패 유형. type 은 problem details 의 type/title 로 그대로 노출된다.
 */
public enum ErrorKind {
    NOT_FOUND("NotFound", HttpStatus.NOT_FOUND),
    AMBIGUOUS_PERIOD("AmbiguousPeriod", HttpStatus.CONFLICT),
    VALIDATION_FAILED("ValidationFailed", HttpStatus.UNPROCESSABLE_ENTITY),
    INSUFFICIENT_HISTORY("InsufficientHistory", HttpStatus.UNPROCESSABLE_ENTITY),
    UNDEFINED("Undefined", HttpStatus.UNPROCESSABLE_ENTITY),
    SOURCE_UNAVAILABLE("SourceUnavailable", HttpStatus.SERVICE_UNAVAILABLE),
    DEADLINE_EXCEEDED("DeadlineExceeded", HttpStatus.GATEWAY_TIMEOUT),
    BAD_REQUEST("BadRequest", HttpStatus.BAD_REQUEST);

    private final String type;
    private final HttpStatus status;

    ErrorKind(String type, HttpStatus status) {
        this.type = type;
        this.status = status;
    }

    public String type() { return type; }
    public HttpStatus status() { return status; }
}
