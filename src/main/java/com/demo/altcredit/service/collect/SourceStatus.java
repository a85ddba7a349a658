package com.demo.altcredit.service.collect;

public enum SourceStatus {
    SUCCESS,
    PARTIAL,
    FAILED,
    PERMISSION_DENIED,
    TIMED_OUT,
    /** The collector has no real implementation on this platform; payload is empty, never canned. */
    NOT_IMPLEMENTED;

    /** Whether a result with this status carries data that can be scored. */
    public boolean scorable() {
        return this == SUCCESS || this == PARTIAL;
    }
}
