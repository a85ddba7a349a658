package com.demo.altcredit.service.collect.device;

/** Position as the platform reports it. Must not outlive the coarsening step. */
public record RawPosition(
        double latitude,
        double longitude,
        Double accuracy,
        long timestamp,
        boolean mocked
) {}
