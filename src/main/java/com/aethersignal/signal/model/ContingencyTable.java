/* (C)2026 */
package com.aethersignal.signal.model;

import com.aethersignal.signal.exception.ValidationException;

/**
 * 2x2 report counts for one drug-event pair.
 *
 * <pre>
 *              event   no event
 *   drug        n11      n10
 *   no drug     n01      n00
 * </pre>
 *
 * <p>All cells are non-negative. Marginals are derived on access.
 */
public record ContingencyTable(long n11, long n10, long n01, long n00) {

    public ContingencyTable {
        if (n11 < 0) throw ValidationException.negativeCount("n11", n11);
        if (n10 < 0) throw ValidationException.negativeCount("n10", n10);
        if (n01 < 0) throw ValidationException.negativeCount("n01", n01);
        if (n00 < 0) throw ValidationException.negativeCount("n00", n00);
    }

    public long total() {
        return n11 + n10 + n01 + n00;
    }

    /** Reports mentioning the drug: n11 + n10. */
    public long drugTotal() {
        return n11 + n10;
    }

    /** Reports mentioning the event: n11 + n01. */
    public long eventTotal() {
        return n11 + n01;
    }

    /** Reports without the drug: n01 + n00. */
    public long otherDrugTotal() {
        return n01 + n00;
    }

    public long noEventTotal() {
        return n10 + n00;
    }

    /**
     * Count expected under independence, {@code drugTotal * eventTotal / total}; 0 for an
     * empty table.
     */
    public double expected() {
        long total = total();
        return total == 0 ? 0.0 : (double) drugTotal() * eventTotal() / total;
    }

    public boolean hasAllCellsPositive() {
        return n11 > 0 && n10 > 0 && n01 > 0 && n00 > 0;
    }
}
