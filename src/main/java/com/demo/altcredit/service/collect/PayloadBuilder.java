package com.demo.altcredit.service.collect;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles a collector payload. Values added through {@link #putHeuristic} are listed under
 * {@value #HEURISTIC_FIELDS} so scorers can weight inferred fields accordingly.
 */
public final class PayloadBuilder {

    public static final String HEURISTIC_FIELDS = "heuristicFields";

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final List<String> heuristic = new ArrayList<>();

    public PayloadBuilder put(String key, Object value) {
        if (value != null) values.put(key, value);
        return this;
    }

    public PayloadBuilder putHeuristic(String key, Object value) {
        if (value != null) {
            values.put(key, value);
            heuristic.add(key);
        }
        return this;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> build() {
        Map<String, Object> out = new LinkedHashMap<>(values);
        if (!heuristic.isEmpty()) out.put(HEURISTIC_FIELDS, List.copyOf(heuristic));
        return out;
    }
}
