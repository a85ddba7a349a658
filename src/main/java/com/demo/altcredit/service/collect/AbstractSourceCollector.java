package com.demo.altcredit.service.collect;

import com.demo.altcredit.service.consent.ConsentState;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Consent check, failure containment and payload normalization shared by all collectors.
 * Subclasses only implement {@link #gather(PayloadBuilder, List)}.
 */
@Slf4j
public abstract class AbstractSourceCollector implements SourceCollector {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final SourceId id;
    private final ConsentState consent;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration timeout;

    protected AbstractSourceCollector(SourceId id, ConsentState consent, ObjectMapper objectMapper,
                                      Clock clock, Duration timeout) {
        this.id = id;
        this.consent = consent;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.timeout = timeout;
    }

    @Override
    public SourceId id() { return id; }

    @Override
    public Duration timeout() { return timeout; }

    protected Clock clock() { return clock; }

    @Override
    public final SourceResult collect() {
        if (!consent.hasConsent()) {
            return SourceResult.failure(id,
                    SourceError.of(ErrorKind.PERMISSION_DENIED, "Consent not granted"), clock.instant());
        }
        try {
            PayloadBuilder payload = new PayloadBuilder();
            List<String> failedSections = new ArrayList<>();
            gather(payload, failedSections);
            Instant at = clock.instant();

            if (payload.isEmpty() && !failedSections.isEmpty()) {
                return SourceResult.failure(id, SourceError.of(ErrorKind.SOURCE_UNAVAILABLE,
                        "No section available: " + String.join(", ", failedSections)), at);
            }
            Map<String, Object> normalized = normalize(payload.build());
            if (!failedSections.isEmpty()) {
                log.debug("{} collected partially, missing {}", id, failedSections);
                return SourceResult.partial(id, normalized, SourceError.of(ErrorKind.SOURCE_UNAVAILABLE,
                        "Unavailable sections: " + String.join(", ", failedSections)), at);
            }
            return SourceResult.success(id, normalized, at);
        } catch (CollectionException ex) {
            log.debug("{} collection failed ({}): {}", id, ex.getKind(), ex.getMessage());
            return SourceResult.failure(id, SourceError.of(ex.getKind(), ex.getMessage()), clock.instant());
        } catch (UnsupportedOperationException ex) {
            return SourceResult.notImplemented(id, ex.getMessage(), clock.instant());
        } catch (Exception ex) {
            log.warn("{} collector raised {}", id, ex.toString());
            return SourceResult.failure(id, SourceError.of(ErrorKind.INTERNAL, ex.toString()), clock.instant());
        }
    }

    /**
     * Fills {@code payload}. Sections that cannot be read are named in {@code failedSections};
     * a {@link CollectionException} thrown from here fails the whole source.
     */
    protected abstract void gather(PayloadBuilder payload, List<String> failedSections) throws Exception;

    /** Runs one payload section, recording its name instead of failing when a provider is unavailable. */
    protected void section(String name, List<String> failedSections, Runnable body) {
        try {
            body.run();
        } catch (CollectionException ex) {
            if (ex.getKind() != ErrorKind.SOURCE_UNAVAILABLE) throw ex;
            failedSections.add(name);
        }
    }

    /** Round-trips the payload through JSON so cached and reloaded results compare equal. */
    Map<String, Object> normalize(Map<String, Object> payload) {
        try {
            return objectMapper.readValue(objectMapper.writeValueAsBytes(payload), PAYLOAD_TYPE);
        } catch (IOException ex) {
            throw new CollectionException(ErrorKind.SERIALIZATION_FAILURE,
                    "Payload is not serializable: " + ex.getMessage(), ex);
        }
    }
}
