package com.demo.altcredit.service.session;

import com.demo.altcredit.config.CollectionProperties;
import com.demo.altcredit.service.consent.ConsentPrompt;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions by id for the HTTP adapter. Sessions opened here have no interactive prompt:
 * callers pass the user's answer with each consent request.
 * <p>
 * A session nobody touched for {@code altcredit.session.idle-timeout} is disposed by the
 * periodic sweep. Its consent and results stay persisted, so opening the same id again
 * resumes it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRegistry {

    private final CollectionSessionFactory factory;
    private final CollectionProperties props;
    private final Clock clock;
    private final Map<String, Tracked> sessions = new ConcurrentHashMap<>();

    public CollectionSession open() {
        return open(UUID.randomUUID().toString());
    }

    /** Opens {@code sessionId}, or returns it if already open; persisted state is restored. */
    public CollectionSession open(String sessionId) {
        Tracked t = sessions.computeIfAbsent(sessionId,
                id -> new Tracked(factory.create(id, ConsentPrompt.answered(false)).init(), clock.instant()));
        t.touch(clock.instant());
        return t.session;
    }

    public CollectionSession get(String sessionId) {
        Tracked t = sessions.get(sessionId);
        if (t == null) throw new SessionNotFoundException(sessionId);
        t.touch(clock.instant());
        return t.session;
    }

    public void close(String sessionId) {
        Tracked t = sessions.remove(sessionId);
        if (t == null) throw new SessionNotFoundException(sessionId);
        t.session.dispose();
    }

    public int size() {
        return sessions.size();
    }

    /** Disposes sessions idle longer than the configured timeout; returns how many went. */
    @Scheduled(fixedDelayString = "${altcredit.session.sweep-interval:PT5M}")
    public int evictIdle() {
        Duration idle = props.getSession().getIdleTimeout();
        if (idle == null || idle.isZero() || idle.isNegative()) return 0;
        Instant cutoff = clock.instant().minus(idle);

        List<Tracked> evicted = new ArrayList<>();
        for (String id : sessions.keySet()) {
            sessions.computeIfPresent(id, (k, t) -> {
                if (t.lastAccess.isAfter(cutoff)) return t;
                evicted.add(t);
                return null;
            });
        }
        evicted.forEach(t -> t.session.dispose());
        if (!evicted.isEmpty()) {
            log.info("Evicted {} idle sessions, {} remain", evicted.size(), sessions.size());
        }
        return evicted.size();
    }

    @PreDestroy
    public void closeAll() {
        sessions.values().forEach(t -> t.session.dispose());
        log.info("Closed {} sessions", sessions.size());
        sessions.clear();
    }

    private static final class Tracked {
        private final CollectionSession session;
        private volatile Instant lastAccess;

        private Tracked(CollectionSession session, Instant openedAt) {
            this.session = session;
            this.lastAccess = openedAt;
        }

        private void touch(Instant at) {
            lastAccess = at;
        }
    }
}
