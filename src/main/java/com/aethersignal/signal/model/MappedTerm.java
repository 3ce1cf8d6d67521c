/* (C)2026 */
package com.aethersignal.signal.model;

/**
 * Canonical term chosen for a free-text reaction.
 *
 * @param confidence match confidence in [0, 1]
 */
public record MappedTerm(String input, String preferredTerm, double confidence) {}
