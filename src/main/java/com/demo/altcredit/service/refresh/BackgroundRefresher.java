package com.demo.altcredit.service.refresh;

import com.demo.altcredit.service.collect.CollectionOrchestrator;
import com.demo.altcredit.service.collect.CollectionTrigger;
import com.demo.altcredit.service.consent.ConsentListener;
import com.demo.altcredit.service.consent.ConsentRecord;
import com.demo.altcredit.service.consent.ConsentState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Re-runs collection every {@code interval} while consent holds. Started by a consent grant,
 * stopped by revocation. A tick that finds a previous tick still running is skipped.
 * Each {@link #start()} opens a new schedule generation; ticks only change the state of the
 * generation they were scheduled under.
 */
@Slf4j
public class BackgroundRefresher implements ConsentListener {

    private final CollectionOrchestrator orchestrator;
    private final ConsentState consent;
    private final TaskScheduler scheduler;
    private final Duration interval;
    private final Clock clock;

    private final AtomicReference<RefresherState> state = new AtomicReference<>(RefresherState.STOPPED);
    private ScheduledFuture<?> timer;
    private long generation;

    public BackgroundRefresher(CollectionOrchestrator orchestrator, ConsentState consent, TaskScheduler scheduler,
                               Duration interval, Clock clock) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Refresh interval must be positive");
        }
        this.orchestrator = orchestrator;
        this.consent = consent;
        this.scheduler = scheduler;
        this.interval = interval;
        this.clock = clock;
    }

    public RefresherState state() {
        return state.get();
    }

    public synchronized void start() {
        if (!state.compareAndSet(RefresherState.STOPPED, RefresherState.SCHEDULED)) return;
        long token = ++generation;
        timer = scheduler.scheduleAtFixedRate(() -> tick(token), clock.instant().plus(interval), interval);
        log.info("Background refresh scheduled every {}", interval);
    }

    public synchronized void stop() {
        RefresherState previous = state.getAndSet(RefresherState.STOPPED);
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
        if (previous != RefresherState.STOPPED) log.info("Background refresh stopped");
    }

    /** One firing of the current schedule. Public so the schedule can be driven by hand. */
    public void tick() {
        long token;
        synchronized (this) {
            token = generation;
        }
        tick(token);
    }

    private void tick(long token) {
        synchronized (this) {
            if (token != generation || !state.compareAndSet(RefresherState.SCHEDULED, RefresherState.RUNNING)) {
                log.debug("Refresh tick skipped in state {}", state.get());
                return;
            }
        }
        try {
            if (!consent.hasConsent()) {
                log.debug("Refresh tick skipped: no consent");
                return;
            }
            orchestrator.collectAll(CollectionTrigger.BACKGROUND);
        } catch (RuntimeException ex) {
            log.warn("Background refresh failed: {}", ex.toString());
        } finally {
            synchronized (this) {
                if (token == generation) {
                    state.compareAndSet(RefresherState.RUNNING, RefresherState.SCHEDULED);
                }
            }
        }
    }

    @Override
    public void onConsentGranted(ConsentRecord record) {
        start();
    }

    @Override
    public void onConsentRevoked(ConsentRecord record) {
        stop();
    }
}
