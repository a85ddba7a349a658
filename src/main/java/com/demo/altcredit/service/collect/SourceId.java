package com.demo.altcredit.service.collect;

import java.util.Arrays;
import java.util.Optional;

/** Signal categories, declared in registration order. */
public enum SourceId {
    DIGITAL_FOOTPRINT("digitalFootprint", "Digital footprint"),
    DEVICE_PROFILE("deviceProfile", "Device security"),
    LOCATION("location", "Location stability"),
    UTILITY("utility", "Payment and service behavior");

    private final String key;
    private final String label;

    SourceId(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String key() { return key; }

    public String label() { return label; }

    /** Accepts either the enum name or the camelCase key used by the scoring backend. */
    public static Optional<SourceId> fromKey(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.key.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
