package com.demo.altcredit.service.session;

import com.demo.altcredit.service.cache.ResultCache;
import com.demo.altcredit.service.collect.CollectionOrchestrator;
import com.demo.altcredit.service.collect.CompositeProfile;
import com.demo.altcredit.service.collect.collectors.LocationCollector;
import com.demo.altcredit.service.collect.collectors.LocationPermissionState;
import com.demo.altcredit.service.collect.device.ReportedSignalProviders;
import com.demo.altcredit.service.collect.device.ReportedSignals;
import com.demo.altcredit.service.consent.ConsentGate;
import com.demo.altcredit.service.consent.ConsentPrompt;
import com.demo.altcredit.service.consent.ConsentPurpose;
import com.demo.altcredit.service.consent.ConsentRecord;
import com.demo.altcredit.service.refresh.BackgroundRefresher;
import com.demo.altcredit.service.refresh.RefresherState;
import com.demo.altcredit.service.risk.RiskAggregator;
import com.demo.altcredit.service.risk.RiskAssessment;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Everything that belongs to one user's collection session, passed by reference to whoever
 * drives it. Built by {@link CollectionSessionFactory}; call {@link #init()} before use and
 * {@link #dispose()} when done.
 */
@Slf4j
@Getter
public class CollectionSession implements AutoCloseable {

    private final String id;
    private final ReportedSignalProviders signals;
    private final ResultCache cache;
    private final ConsentGate consentGate;
    private final CollectionOrchestrator orchestrator;
    private final RiskAggregator aggregator;
    private final BackgroundRefresher refresher;
    private final LocationCollector locationCollector;

    private volatile boolean active;

    CollectionSession(String id, ReportedSignalProviders signals, ResultCache cache, ConsentGate consentGate,
                      CollectionOrchestrator orchestrator, RiskAggregator aggregator,
                      BackgroundRefresher refresher, LocationCollector locationCollector) {
        this.id = id;
        this.signals = signals;
        this.cache = cache;
        this.consentGate = consentGate;
        this.orchestrator = orchestrator;
        this.aggregator = aggregator;
        this.refresher = refresher;
        this.locationCollector = locationCollector;
    }

    public synchronized CollectionSession init() {
        if (active) return this;
        cache.load();
        consentGate.addListener(refresher);
        consentGate.init();
        active = true;
        log.debug("Session {} initialised", id);
        return this;
    }

    /** Stops background work. Consent and cached results stay persisted. */
    public synchronized void dispose() {
        if (!active) return;
        refresher.stop();
        consentGate.removeListener(refresher);
        signals.clear();
        active = false;
        log.debug("Session {} disposed", id);
    }

    @Override
    public void close() {
        dispose();
    }

    public void reportSignals(ReportedSignals reported) {
        signals.report(reported);
    }

    public CompletableFuture<Boolean> requestConsent(ConsentPurpose purpose, String explanation, boolean force,
                                                     ConsentPrompt via) {
        return consentGate.requestConsent(purpose, explanation, force, via);
    }

    public void revoke() {
        consentGate.revoke();
    }

    public boolean hasConsent() {
        return consentGate.hasConsent();
    }

    public ConsentRecord consent() {
        return consentGate.current();
    }

    public CompositeProfile collectAll() {
        return orchestrator.collectAll();
    }

    public CompositeProfile profile() {
        return cache.get();
    }

    /** Scores the cached profile and keeps the result as the session's latest assessment. */
    public RiskAssessment computeRisk() {
        long epoch = consentGate.epoch();
        RiskAssessment assessment = aggregator.computeRisk(cache.get());
        if (!cache.setAssessmentIf(() -> consentGate.heldSince(epoch), assessment)) {
            log.info("Session {}: assessment not cached, consent withdrawn", id);
        }
        return assessment;
    }

    public RiskAssessment lastAssessment() {
        return cache.getAssessment();
    }

    public RefresherState refresherState() {
        return refresher.state();
    }

    public LocationPermissionState locationPermission() {
        return locationCollector.permissionState();
    }
}
