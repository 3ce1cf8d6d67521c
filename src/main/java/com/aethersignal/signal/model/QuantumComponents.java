/* (C)2026 */
package com.aethersignal.signal.model;

/**
 * Breakdown of the quantum-inspired layers.
 *
 * <p>The tunneling bonus is reported on its own and never folded silently into another
 * term. {@code layer2} is {@code null} when no multi-source evidence was present.
 */
public record QuantumComponents(
        double rarity,
        double seriousness,
        double recency,
        double countNormalized,
        double baseScore,
        double interactionRareSerious,
        double interactionRareRecent,
        double interactionSeriousRecent,
        double interactionAllThree,
        boolean tunnelingEligible,
        int elevatedFactors,
        double tunnelingBonus,
        Layer2Components layer2) {

    /** Base score plus interactions and tunneling, clipped to [0, 1]. */
    public double layer1Score() {
        return Math.max(0.0, Math.min(1.0, baseScore + interactionTotal() + tunnelingBonus));
    }

    public double interactionTotal() {
        return interactionRareSerious + interactionRareRecent + interactionSeriousRecent + interactionAllThree;
    }

    public QuantumComponents withLayer2(Layer2Components components) {
        return new QuantumComponents(
                rarity,
                seriousness,
                recency,
                countNormalized,
                baseScore,
                interactionRareSerious,
                interactionRareRecent,
                interactionSeriousRecent,
                interactionAllThree,
                tunnelingEligible,
                elevatedFactors,
                tunnelingBonus,
                components);
    }
}
