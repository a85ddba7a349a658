package com.demo.altcredit.service.collect;

import java.time.Duration;

public interface SourceCollector {

    SourceId id();

    /** Upper bound the orchestrator waits for {@link #collect()} before recording a timeout. */
    Duration timeout();

    /** Never throws; every failure is encoded in the returned result. */
    SourceResult collect();
}
