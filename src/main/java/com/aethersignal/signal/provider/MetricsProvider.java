/* (C)2026 */
package com.aethersignal.signal.provider;

import com.aethersignal.signal.model.SignalEvidence;
import com.aethersignal.signal.model.SignalQuerySpec;
import java.util.Optional;

/**
 * Evidence supplier for query routing: the only data-access seam of the engine.
 *
 * <p>Implementations return {@link Optional#empty()} when no matching cases exist and
 * must not throw for that case. Any exception is treated by the router as an
 * unavailable candidate.
 */
public interface MetricsProvider {

    Optional<SignalEvidence> evidence(String drug, String event, SignalQuerySpec spec);
}
