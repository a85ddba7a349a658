package com.demo.altcredit.service.risk;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AssessmentBasis {
    REMOTE("remote"),
    LOCAL_FALLBACK("local-fallback");

    private final String wireName;

    AssessmentBasis(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
