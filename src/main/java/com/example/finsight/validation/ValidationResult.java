package com.example.finsight.validation;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(true, null);

    private final boolean valid;
    private final String reason;

    private ValidationResult(boolean valid, String reason) {
        this.valid = valid;
        this.reason = reason;
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult reject(String reason) {
        return new ValidationResult(false, reason);
    }
}
