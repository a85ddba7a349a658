package com.demo.altcredit.service.collect.collectors;

import com.demo.altcredit.service.collect.device.RawPosition;

/** City-level position: two decimal places (~1 km) with an accuracy radius of at least 1000 m. */
public record CoarseLocation(double latitude, double longitude, double accuracy, long timestamp) {

    public static final double MIN_ACCURACY_METERS = 1000.0;

    public static CoarseLocation of(RawPosition raw) {
        double accuracy = raw.accuracy() == null ? MIN_ACCURACY_METERS : Math.max(raw.accuracy(), MIN_ACCURACY_METERS);
        return new CoarseLocation(round2(raw.latitude()), round2(raw.longitude()), accuracy, raw.timestamp());
    }

    static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
