package com.keystone.core.conflict;

import com.keystone.core.model.ConflictRecord;

import java.util.Map;
import java.util.Optional;

/**
 * Asks a role to pick one of the conflicting candidates.
 */
public interface ConflictArbiter {

    /**
     * @param acceptedOutputId one of the candidate output IDs
     * @param rationale        why it was chosen
     */
    record Vote(String acceptedOutputId, String rationale) {}

    /**
     * @param role       the deciding role (an authority, or one participant of a consensus)
     * @param record     the conflict
     * @param candidates output ID to content
     * @return the role's vote, or empty when it declines to decide
     */
    Optional<Vote> decide(String role, ConflictRecord record, Map<String, String> candidates);
}
