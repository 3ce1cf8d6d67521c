/* (C)2026 */
package com.aethersignal.signal.enumeration;

import com.aethersignal.signal.config.DisproportionalityThresholds;

/**
 * Named disproportionality threshold sets.
 *
 * <p>{@link #STANDARD} follows the common MHRA / WHO-UMC criteria. {@link #STRICT} trades
 * sensitivity for fewer false positives; {@link #SENSITIVE} the reverse.
 */
public enum ThresholdPreset
{
    STANDARD(new DisproportionalityThresholds(2.0, 1.0, 1.0, 0.0, 3, 2.0)),
    STRICT(new DisproportionalityThresholds(3.0, 2.0, 1.5, 0.5, 5, 4.0)),
    SENSITIVE(new DisproportionalityThresholds(1.5, 1.0, 1.0, 0.0, 2, 1.0));

    private final DisproportionalityThresholds thresholds;

    ThresholdPreset(DisproportionalityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public DisproportionalityThresholds thresholds() {
        return thresholds;
    }
}
