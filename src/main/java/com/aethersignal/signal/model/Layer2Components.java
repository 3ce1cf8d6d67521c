/* (C)2026 */
package com.aethersignal.signal.model;

/**
 * Multi-source factors, each in [0, 1].
 */
public record Layer2Components(
        double frequency, double severity, double burst, double novelty, double consensus, double mechanism) {}
