package com.demo.altcredit.service.collect.collectors;

import java.util.EnumSet;
import java.util.Set;

public enum LocationPermissionState {
    UNKNOWN,
    REQUESTED,
    GRANTED,
    DENIED,
    BLOCKED;

    /** GRANTED may fall back to DENIED/BLOCKED and BLOCKED may become GRANTED through the device settings. */
    public boolean canMoveTo(LocationPermissionState next) {
        return allowedNext().contains(next);
    }

    private Set<LocationPermissionState> allowedNext() {
        switch (this) {
            case UNKNOWN:   return EnumSet.of(REQUESTED, GRANTED, BLOCKED);
            case REQUESTED: return EnumSet.of(GRANTED, DENIED, BLOCKED);
            case DENIED:    return EnumSet.of(REQUESTED, GRANTED, BLOCKED);
            case GRANTED:   return EnumSet.of(DENIED, BLOCKED);
            case BLOCKED:   return EnumSet.of(GRANTED);
            default:        return EnumSet.noneOf(LocationPermissionState.class);
        }
    }
}
