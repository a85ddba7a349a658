package com.demo.altcredit.service.collect;

public enum ErrorKind {
    PERMISSION_DENIED,
    /** Permanently denied; only an out-of-band settings change can lift it. */
    PERMISSION_BLOCKED,
    SOURCE_UNAVAILABLE,
    SOURCE_TIMEOUT,
    SERIALIZATION_FAILURE,
    BACKEND_UNREACHABLE,
    INTERNAL;

    public SourceStatus toStatus() {
        switch (this) {
            case PERMISSION_DENIED:
            case PERMISSION_BLOCKED:
                return SourceStatus.PERMISSION_DENIED;
            case SOURCE_TIMEOUT:
                return SourceStatus.TIMED_OUT;
            default:
                return SourceStatus.FAILED;
        }
    }
}
