package com.demo.altcredit.service.session;

import com.demo.altcredit.config.CollectionProperties;
import com.demo.altcredit.repository.KeyValueStore;
import com.demo.altcredit.service.cache.ResultCache;
import com.demo.altcredit.service.collect.CollectionOrchestrator;
import com.demo.altcredit.service.collect.SourceCollector;
import com.demo.altcredit.service.collect.collectors.DeviceProfileCollector;
import com.demo.altcredit.service.collect.collectors.DigitalFootprintCollector;
import com.demo.altcredit.service.collect.collectors.LocationCollector;
import com.demo.altcredit.service.collect.collectors.UtilityCollector;
import com.demo.altcredit.service.collect.device.ReportedSignalProviders;
import com.demo.altcredit.service.consent.ConsentGate;
import com.demo.altcredit.service.consent.ConsentPrompt;
import com.demo.altcredit.service.refresh.BackgroundRefresher;
import com.demo.altcredit.service.risk.InsightGenerator;
import com.demo.altcredit.service.risk.RiskAggregator;
import com.demo.altcredit.service.risk.ScoringBackendClient;
import com.demo.altcredit.service.risk.WeightTable;
import com.demo.altcredit.service.risk.scorers.BehaviorPatternScorer;
import com.demo.altcredit.service.risk.scorers.DeviceSecurityScorer;
import com.demo.altcredit.service.risk.scorers.DigitalFootprintScorer;
import com.demo.altcredit.service.risk.scorers.LocationStabilityScorer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/** Wires the per-session object graph from the shared infrastructure beans. */
@Component
public class CollectionSessionFactory {

    private final CollectionProperties props;
    private final ObjectMapper objectMapper;
    private final KeyValueStore store;
    private final ScoringBackendClient backend;
    private final TaskScheduler refreshScheduler;
    private final Executor collectorExecutor;
    private final Clock clock;
    private final WeightTable weights;

    public CollectionSessionFactory(CollectionProperties props,
                                    ObjectMapper objectMapper,
                                    KeyValueStore store,
                                    ScoringBackendClient backend,
                                    @Qualifier("refreshTaskScheduler") TaskScheduler refreshScheduler,
                                    @Qualifier("collectorExecutor") Executor collectorExecutor,
                                    Clock clock) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.store = store;
        this.backend = backend;
        this.refreshScheduler = refreshScheduler;
        this.collectorExecutor = collectorExecutor;
        this.clock = clock;
        this.weights = new WeightTable(props.getRisk().getWeights());
    }

    /** Builds an uninitialised session; the caller runs {@link CollectionSession#init()}. */
    public CollectionSession create(String sessionId, ConsentPrompt prompt) {
        var c = props.getCollector();
        ReportedSignalProviders signals = new ReportedSignalProviders();
        ResultCache cache = new ResultCache(store, objectMapper, props.getStore().getKeyPrefix(), sessionId);
        ConsentGate gate = new ConsentGate(cache, prompt, clock);

        LocationCollector location = new LocationCollector(gate, objectMapper, clock, c.getLocationTimeout(),
                signals, c.getLocationPurpose());
        List<SourceCollector> collectors = List.of(
                new DigitalFootprintCollector(gate, objectMapper, clock, c.getDefaultTimeout(), signals, signals),
                new DeviceProfileCollector(gate, objectMapper, clock, c.getDefaultTimeout(), signals),
                location,
                new UtilityCollector(gate, objectMapper, clock, c.getDefaultTimeout(), signals, signals));

        CollectionOrchestrator orchestrator = new CollectionOrchestrator(collectors, cache, gate, collectorExecutor,
                clock, props.getRefresh().getOverwritePolicy());
        RiskAggregator aggregator = new RiskAggregator(
                List.of(new DigitalFootprintScorer(), new DeviceSecurityScorer(),
                        new LocationStabilityScorer(), new BehaviorPatternScorer()),
                weights, new InsightGenerator(), backend, clock);
        BackgroundRefresher refresher = new BackgroundRefresher(orchestrator, gate, refreshScheduler,
                props.getRefresh().getInterval(), clock);

        return new CollectionSession(sessionId, signals, cache, gate, orchestrator, aggregator, refresher, location);
    }
}
