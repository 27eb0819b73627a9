package com.example.finsight.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String json() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 더 낮은 신뢰도를 반환 */
    public Confidence min(Confidence other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
