package com.demo.altcredit.service.collect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything one collection cycle produced, keyed in collector registration order.
 * Instances are replaced as a whole; there are no setters.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompositeProfile(
        String cycleId,
        Map<SourceId, SourceResult> sources,
        Instant assembledAt,
        long collectionTimeMs,
        CollectionTrigger trigger
) {

    public CompositeProfile {
        sources = sources == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }

    public long countWithStatus(SourceStatus status) {
        return sources.values().stream().filter(r -> r.status() == status).count();
    }
}
