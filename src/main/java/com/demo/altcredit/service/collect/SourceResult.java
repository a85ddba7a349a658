package com.demo.altcredit.service.collect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one collector invocation. Payload holds JSON-compatible values only
 * (see {@link AbstractSourceCollector#normalize}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceResult(
        SourceId sourceId,
        SourceStatus status,
        Map<String, Object> payload,
        Instant collectedAt,
        SourceError error
) {

    public SourceResult {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static SourceResult success(SourceId id, Map<String, Object> payload, Instant at) {
        return new SourceResult(id, SourceStatus.SUCCESS, payload, at, null);
    }

    public static SourceResult partial(SourceId id, Map<String, Object> payload, SourceError error, Instant at) {
        return new SourceResult(id, SourceStatus.PARTIAL, payload, at, error);
    }

    public static SourceResult failure(SourceId id, SourceError error, Instant at) {
        return new SourceResult(id, error.kind().toStatus(), Map.of(), at, error);
    }

    public static SourceResult timedOut(SourceId id, String message, Instant at) {
        return new SourceResult(id, SourceStatus.TIMED_OUT, Map.of(), at,
                SourceError.of(ErrorKind.SOURCE_TIMEOUT, message));
    }

    public static SourceResult notImplemented(SourceId id, String message, Instant at) {
        return new SourceResult(id, SourceStatus.NOT_IMPLEMENTED, Map.of(), at,
                SourceError.of(ErrorKind.SOURCE_UNAVAILABLE, message));
    }

    public boolean succeeded() {
        return status == SourceStatus.SUCCESS;
    }
}
