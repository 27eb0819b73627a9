package com.example.finsight.exception;

public class DeadlineExceededException extends FinanceException {
    public DeadlineExceededException(String message, Throwable cause) {
        super(ErrorKind.DEADLINE_EXCEEDED, message, cause);
    }
}
