package com.example.finsight.util;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Map&lt;String,Object&gt; 로 디코딩된 JSON 응답에서 안전하게 값을 꺼내는 헬퍼.
 * 형식이 맞지 않으면 null 을 반환한다.
 */
public final class JsonMaps {

    private JsonMaps() {}

    public static Map<String, Object> asMap(Object o) {
        if (!(o instanceof Map<?, ?> m)) return null;
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : m.entrySet()) {
            if (e.getKey() instanceof String key) {
                out.put(key, e.getValue());
            }
        }
        return out;
    }

    public static List<Map<String, Object>> asListOfMap(Object o) {
        if (!(o instanceof List<?> list)) return List.of();
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object item : list) {
            Map<String, Object> m = asMap(item);
            if (m != null) out.add(m);
        }
        return out;
    }

    public static String asString(Object o) {
        return (o == null) ? null : o.toString();
    }

    /** 숫자, 숫자 문자열, {raw: n} 형태를 모두 허용. "None" 같은 값은 null */
    public static BigDecimal asDecimal(Object value) {
        if (value == null) return null;
        if (value instanceof BigDecimal b) return b;
        if (value instanceof Integer || value instanceof Long) return BigDecimal.valueOf(((Number) value).longValue());
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            return BigDecimal.valueOf(d);
        }
        if (value instanceof String s) {
            String t = s.trim();
            if (t.isEmpty() || t.equalsIgnoreCase("None") || t.equals("-")) return null;
            try {
                return new BigDecimal(t);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        Map<String, Object> m = asMap(value);
        return m == null ? null : asDecimal(m.get("raw"));
    }

    public static LocalDate asDate(Object value) {
        if (value == null) return null;
        try {
            return LocalDate.parse(value.toString().trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
