package com.demo.altcredit.service.collect;

public enum CollectionTrigger {
    /** Requested by the caller (presentation layer or API). */
    EXPLICIT,
    /** Started by the periodic refresher. */
    BACKGROUND
}
