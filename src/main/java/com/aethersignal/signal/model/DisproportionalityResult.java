/* (C)2026 */
package com.aethersignal.signal.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Classical disproportionality statistics for one drug-event pair.
 *
 * @param fisherPValue two-tailed Fisher exact p-value, only computed for small counts
 */
public record DisproportionalityResult(
        String drug,
        String event,
        ContingencyTable table,
        double expectedCount,
        RatioEstimate prr,
        RatioEstimate ror,
        InformationComponent ic,
        double chiSquare,
        double chiSquarePValue,
        Double fisherPValue) {

    public static final String PRR = "PRR";
    public static final String ROR = "ROR";
    public static final String IC = "IC";

    public boolean isSignal() {
        return prr.signal() || ror.signal() || ic.signal();
    }

    /** Names of the methods that flagged the pair, always in PRR, ROR, IC order. */
    public List<String> flaggedMethods() {
        List<String> methods = new ArrayList<>(3);
        if (prr.signal()) methods.add(PRR);
        if (ror.signal()) methods.add(ROR);
        if (ic.signal()) methods.add(IC);
        return List.copyOf(methods);
    }

    public int flaggedCount() {
        return (prr.signal() ? 1 : 0) + (ror.signal() ? 1 : 0) + (ic.signal() ? 1 : 0);
    }
}
