package com.demo.altcredit.service.collect;

/**
 * Raised by providers and collectors; {@link AbstractSourceCollector} converts it into a
 * {@link SourceResult} so it never reaches the orchestrator.
 */
public class CollectionException extends RuntimeException {

    private final ErrorKind kind;

    public CollectionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CollectionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static CollectionException permissionDenied(String message) {
        return new CollectionException(ErrorKind.PERMISSION_DENIED, message);
    }

    public static CollectionException permissionBlocked(String message) {
        return new CollectionException(ErrorKind.PERMISSION_BLOCKED, message);
    }

    public static CollectionException unavailable(String message) {
        return new CollectionException(ErrorKind.SOURCE_UNAVAILABLE, message);
    }
}
