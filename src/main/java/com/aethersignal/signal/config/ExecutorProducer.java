/* (C)2026 */
package com.aethersignal.signal.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the executor that fans batch fusion and query evidence lookups out
 * across worker threads.
 *
 * <p>Per-pair computation shares no mutable state, so the pool size only bounds CPU use
 * and concurrent evidence lookups.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String BATCH_EXECUTOR = "signal-batch-executor";

    @ConfigProperty(name = "signal.batch.max-async", defaultValue = "4")
    int maxAsync;

    @ConfigProperty(name = "signal.batch.max-queued", defaultValue = "1000")
    int maxQueued;

    @Produces
    @Named(BATCH_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createBatchExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }
}
