package com.demo.altcredit.service.risk;

public enum RiskBand {
    LOW, MEDIUM, HIGH;

    public static RiskBand of(int score) {
        if (score >= 70) return HIGH;
        if (score >= 40) return MEDIUM;
        return LOW;
    }

    public static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
