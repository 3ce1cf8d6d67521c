/* (C)2026 */
package com.aethersignal.signal.provider;

import com.aethersignal.signal.model.MappedTerm;
import java.util.Optional;

/**
 * Maps a free-text reaction to at most one canonical term. No match is not an error.
 */
public interface TerminologyNormalizer {

    Optional<MappedTerm> map(String term);
}
