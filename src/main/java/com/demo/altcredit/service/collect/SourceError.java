package com.demo.altcredit.service.collect;

public record SourceError(ErrorKind kind, String message) {

    public static SourceError of(ErrorKind kind, String message) {
        return new SourceError(kind, message);
    }
}
