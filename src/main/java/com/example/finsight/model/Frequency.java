package com.example.finsight.model;

import java.util.Locale;

public enum Frequency {
    Q,
    A;

    public static Frequency parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String t = raw.trim().toUpperCase(Locale.ROOT);
        if (t.equals("Q") || t.equals("QUARTERLY")) return Q;
        if (t.equals("A") || t.equals("Y") || t.equals("FY") || t.equals("ANNUAL")) return A;
        throw new IllegalArgumentException("Unsupported frequency: " + raw);
    }
}
