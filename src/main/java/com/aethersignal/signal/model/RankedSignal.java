/* (C)2026 */
package com.aethersignal.signal.model;

/**
 * Query result entry: a fused score with a short explanation of what drove it.
 */
public record RankedSignal(CompleteFusionResult result, String explanation) {

    public double fusionScore() {
        return result.fusionScore();
    }
}
