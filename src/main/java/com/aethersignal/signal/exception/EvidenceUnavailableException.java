/* (C)2026 */
package com.aethersignal.signal.exception;

/**
 * Raised at the evidence boundary when a candidate's evidence could not be fetched
 * (provider failure or timeout).
 *
 * <p>The query router converts it into a skipped candidate; it only reaches a client
 * when thrown outside of a batch.
 */
public class EvidenceUnavailableException extends ApiException {

    private final String drug;
    private final String event;

    public EvidenceUnavailableException(String drug, String event, Throwable cause) {
        super(String.format("Evidence unavailable for %s / %s", drug, event), cause);
        this.drug = drug;
        this.event = event;
    }

    public String getDrug() {
        return drug;
    }

    public String getEvent() {
        return event;
    }
}
