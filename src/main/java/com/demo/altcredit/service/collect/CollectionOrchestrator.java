package com.demo.altcredit.service.collect;

import com.demo.altcredit.service.cache.ResultCache;
import com.demo.altcredit.service.consent.ConsentState;
import com.demo.altcredit.service.refresh.RefreshOverwritePolicy;
import com.demo.altcredit.service.risk.AssessmentBasis;
import com.demo.altcredit.service.risk.RiskAssessment;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fans out to every registered collector and fans the settled results into one
 * {@link CompositeProfile}. At most one cycle runs at a time; callers arriving while a
 * cycle is in flight join it. A cycle is bound to the consent epoch it started under: a
 * revocation detaches it, so it neither publishes nor takes joiners after a fresh grant.
 */
@Slf4j
public class CollectionOrchestrator {

    private final List<SourceCollector> collectors;
    private final ResultCache cache;
    private final ConsentState consent;
    private final Executor executor;
    private final Clock clock;
    private final RefreshOverwritePolicy overwritePolicy;

    private final AtomicReference<Cycle> inFlight = new AtomicReference<>();

    public CollectionOrchestrator(List<SourceCollector> collectors, ResultCache cache, ConsentState consent,
                                  Executor executor, Clock clock, RefreshOverwritePolicy overwritePolicy) {
        this.collectors = List.copyOf(collectors);
        this.cache = cache;
        this.consent = consent;
        this.executor = executor;
        this.clock = clock;
        this.overwritePolicy = overwritePolicy;
    }

    public List<SourceId> registeredSources() {
        return collectors.stream().map(SourceCollector::id).toList();
    }

    public CompositeProfile collectAll() {
        return collectAll(CollectionTrigger.EXPLICIT);
    }

    public CompositeProfile collectAll(CollectionTrigger trigger) {
        return collectAllAsync(trigger).join();
    }

    public CompletableFuture<CompositeProfile> collectAllAsync() {
        return collectAllAsync(CollectionTrigger.EXPLICIT);
    }

    public CompletableFuture<CompositeProfile> collectAllAsync(CollectionTrigger trigger) {
        while (true) {
            Cycle running = inFlight.get();
            long epoch = consent.epoch();
            if (running != null && running.epoch() == epoch) {
                log.debug("Collection cycle already in flight, joining it");
                return running.future();
            }
            Cycle cycle = new Cycle(new CompletableFuture<>(), epoch);
            if (inFlight.compareAndSet(running, cycle)) {
                if (running != null) {
                    log.info("Collection cycle from consent epoch {} detached after revocation", running.epoch());
                }
                runCycle(cycle, trigger);
                return cycle.future();
            }
        }
    }

    public boolean isCycleRunning() {
        return inFlight.get() != null;
    }

    private void runCycle(Cycle cycle, CollectionTrigger trigger) {
        String cycleId = UUID.randomUUID().toString();
        long started = System.nanoTime();
        log.info("Collection cycle {} started ({}, {} sources)", cycleId, trigger, collectors.size());

        List<CompletableFuture<SourceResult>> pending = new ArrayList<>(collectors.size());
        for (SourceCollector c : collectors) {
            pending.add(invoke(c));
        }

        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).whenComplete((ignored, err) -> {
            try {
                Map<SourceId, SourceResult> results = new LinkedHashMap<>();
                for (int i = 0; i < collectors.size(); i++) {
                    results.put(collectors.get(i).id(), pending.get(i).join());
                }
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
                CompositeProfile profile = new CompositeProfile(cycleId, results, clock.instant(), elapsedMs, trigger);
                publish(profile, cycle.epoch());
                log.info("Collection cycle {} finished in {}ms: {} success, {} partial, {} timed out",
                        cycleId, elapsedMs, profile.countWithStatus(SourceStatus.SUCCESS),
                        profile.countWithStatus(SourceStatus.PARTIAL), profile.countWithStatus(SourceStatus.TIMED_OUT));
                inFlight.compareAndSet(cycle, null);
                cycle.future().complete(profile);
            } catch (RuntimeException ex) {
                log.error("Collection cycle {} could not be assembled", cycleId, ex);
                inFlight.compareAndSet(cycle, null);
                cycle.future().completeExceptionally(ex);
            }
        });
    }

    private CompletableFuture<SourceResult> invoke(SourceCollector collector) {
        CompletableFuture<SourceResult> call;
        try {
            call = CompletableFuture.supplyAsync(collector::collect, executor);
        } catch (RuntimeException ex) {
            call = CompletableFuture.failedFuture(ex);
        }
        long timeoutMs = collector.timeout().toMillis();
        return call.orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(ex -> settleFailure(collector, ex, timeoutMs));
    }

    private SourceResult settleFailure(SourceCollector collector, Throwable ex, long timeoutMs) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            log.warn("{} did not settle within {}ms", collector.id(), timeoutMs);
            return SourceResult.timedOut(collector.id(), "No result within " + timeoutMs + "ms", clock.instant());
        }
        log.warn("{} could not be scheduled: {}", collector.id(), cause.toString());
        return SourceResult.failure(collector.id(), SourceError.of(ErrorKind.INTERNAL, cause.toString()), clock.instant());
    }

    private void publish(CompositeProfile profile, long epoch) {
        if (profile.trigger() == CollectionTrigger.BACKGROUND && overwritePolicy == RefreshOverwritePolicy.PRESERVE_REMOTE) {
            RiskAssessment held = cache.getAssessment();
            if (held != null && held.basis() == AssessmentBasis.REMOTE) {
                log.info("Cycle {} not cached: cache backs a remote assessment", profile.cycleId());
                return;
            }
        }
        if (!cache.setIf(() -> consent.heldSince(epoch), profile)) {
            log.info("Cycle {} discarded: consent withdrawn after it started", profile.cycleId());
        } else if (cache.isPersistencePending()) {
            log.warn("Cycle {} cached in memory only; persistence retried on next cycle", profile.cycleId());
        }
    }

    private record Cycle(CompletableFuture<CompositeProfile> future, long epoch) {}
}
