package com.demo.altcredit.service.collect.device;

/**
 * Current connection plus the device's own connectivity history. History fields are
 * nullable when the device keeps none.
 */
public record NetworkSnapshot(
        String type,
        boolean connected,
        boolean expensive,
        Integer signalStrength,
        Double wifiPercentage,
        Double cellularPercentage,
        Integer stabilityScore
) {}
