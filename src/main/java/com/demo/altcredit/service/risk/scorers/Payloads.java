package com.demo.altcredit.service.risk.scorers;

import java.util.List;
import java.util.Map;

final class Payloads {
    private Payloads() {}

    static Double number(Map<String, Object> payload, String key) {
        Object v = payload.get(key);
        return v instanceof Number ? ((Number) v).doubleValue() : null;
    }

    static Boolean flag(Map<String, Object> payload, String key) {
        Object v = payload.get(key);
        return v instanceof Boolean ? (Boolean) v : null;
    }

    static String text(Map<String, Object> payload, String key) {
        Object v = payload.get(key);
        return v == null ? null : String.valueOf(v);
    }

    /** Size of a list field, or -1 when the field is absent. */
    static int size(Map<String, Object> payload, String key) {
        Object v = payload.get(key);
        return v instanceof List ? ((List<?>) v).size() : -1;
    }
}
