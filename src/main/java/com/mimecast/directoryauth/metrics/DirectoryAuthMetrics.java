package com.mimecast.directoryauth.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

/**
 * Micrometer meters for the directory connection pool and node assignment.
 *
 * <p>One instance per backend, registered on the registry it is given.
 */
public class DirectoryAuthMetrics {

    private final MeterRegistry registry;

    private final Counter connectionsCreated;
    private final Counter connectionsDiscarded;
    private final Counter poolFull;
    private final Counter assignmentSuccess;
    private final Counter assignmentFailure;
    private final Counter bookkeepingFailure;

    /**
     * Constructs metrics on a private in-memory registry.
     */
    public DirectoryAuthMetrics() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Constructs metrics on the given registry.
     *
     * @param registry Meter registry.
     */
    public DirectoryAuthMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.connectionsCreated = Counter.builder("directory.pool.connections.created")
                .description("Number of directory connections opened by the pool")
                .register(registry);
        this.connectionsDiscarded = Counter.builder("directory.pool.connections.discarded")
                .description("Number of directory connections dropped from the pool")
                .register(registry);
        this.poolFull = Counter.builder("directory.pool.full")
                .description("Number of acquisitions that found the pool full")
                .register(registry);
        this.assignmentSuccess = Counter.builder("node.assignment")
                .description("Number of node assignments")
                .tag("result", "success")
                .register(registry);
        this.assignmentFailure = Counter.builder("node.assignment")
                .description("Number of node assignments")
                .tag("result", "failure")
                .register(registry);
        this.bookkeepingFailure = Counter.builder("node.bookkeeping.failures")
                .description("Number of node capacity updates that failed after assignment")
                .register(registry);
    }

    /**
     * Registers pool gauges.
     *
     * @param pool   Pool name tag.
     * @param size   Supplier of the entry count.
     * @param active Supplier of the checked out count.
     */
    public void registerPool(String pool, Supplier<Number> size, Supplier<Number> active) {
        Gauge.builder("directory.pool.connections", size)
                .description("Directory connections held by the pool")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("directory.pool.active", active)
                .description("Directory connections currently checked out")
                .tag("pool", pool)
                .register(registry);
    }

    public void connectionCreated() {
        connectionsCreated.increment();
    }

    public void connectionDiscarded() {
        connectionsDiscarded.increment();
    }

    public void poolFull() {
        poolFull.increment();
    }

    public void assignmentSucceeded() {
        assignmentSuccess.increment();
    }

    public void assignmentFailed() {
        assignmentFailure.increment();
    }

    public void bookkeepingFailed() {
        bookkeepingFailure.increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
