package com.courtster.pairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tournament format, which decides the grouping strategy used for every round.
 */
public enum TournamentFormat {
    /** Re-pair each round by rating, similar players share a court. */
    @JsonProperty("mexicano") MEXICANO,
    /** Round-robin style, spreads opponents as evenly as possible. */
    @JsonProperty("americano") AMERICANO,
    /** Registered partner pairs stay together, only opponents rotate. */
    @JsonProperty("fixed_partner") FIXED_PARTNER,
    /** Mexicano with one man and one woman on every team. */
    @JsonProperty("mixed_mexicano") MIXED_MEXICANO;

    /**
     * Parses a CLI or config value such as {@code "fixed_partner"} or {@code "fixed-partner"}.
     */
    public static TournamentFormat parse(String value) {
        return TournamentFormat.valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
