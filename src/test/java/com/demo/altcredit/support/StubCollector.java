package com.demo.altcredit.support;

import com.demo.altcredit.service.collect.SourceCollector;
import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.collect.SourceResult;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** Collector with a canned payload that can be held on a latch to simulate a slow source. */
public class StubCollector implements SourceCollector {

    private final SourceId id;
    private final Map<String, Object> payload;
    private final Duration timeout;
    private final CountDownLatch release;
    private final CountDownLatch started = new CountDownLatch(1);
    private final AtomicInteger calls = new AtomicInteger();

    public StubCollector(SourceId id, Map<String, Object> payload) {
        this(id, payload, Duration.ofSeconds(5), null);
    }

    public StubCollector(SourceId id, Map<String, Object> payload, Duration timeout, CountDownLatch release) {
        this.id = id;
        this.payload = payload;
        this.timeout = timeout;
        this.release = release;
    }

    @Override
    public SourceId id() { return id; }

    @Override
    public Duration timeout() { return timeout; }

    @Override
    public SourceResult collect() {
        calls.incrementAndGet();
        started.countDown();
        if (release != null) {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return SourceResult.success(id, payload, TestFixtures.NOW);
    }

    public boolean awaitStarted() throws InterruptedException {
        return started.await(5, TimeUnit.SECONDS);
    }

    public int calls() {
        return calls.get();
    }
}
