package com.courtster.pairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A constraint the engine could not honour for a generation call. Reported alongside
 * the round rather than thrown: the round is still valid, just not what was asked for.
 *
 * @param kind   which fallback happened
 * @param detail human-readable explanation
 */
public record Degradation(
    @JsonProperty("kind") Kind kind,
    @JsonProperty("detail") String detail
) {

    public enum Kind {
        /** Fewer than four eligible players for a requested court. */
        INSUFFICIENT_PLAYERS,
        /** Partner data missing, asymmetric or pointing off the court; players were grouped by rating. */
        FIXED_PARTNER_FALLBACK,
        /** Requested gender composition impossible with the available players. */
        COMPOSITION_FALLBACK
    }
}
