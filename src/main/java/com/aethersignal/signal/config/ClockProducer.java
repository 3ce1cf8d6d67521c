/* (C)2026 */
package com.aethersignal.signal.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Publishes the clock used for recency and novelty scoring. Tests construct services with
 * {@link Clock#fixed} instead.
 */
@ApplicationScoped
public class ClockProducer {

    @Produces
    @Singleton
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
