package com.demo.altcredit.service.collect.device;

/** What the platform reports for a location permission check or request. */
public enum PermissionStatus {
    GRANTED,
    DENIED,
    BLOCKED,
    UNAVAILABLE
}
