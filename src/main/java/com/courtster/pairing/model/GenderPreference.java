package com.courtster.pairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How player gender shapes match composition.
 */
public enum GenderPreference {
    /** Gender is ignored. */
    @JsonProperty("any") ANY,
    /** Every team should be one man and one woman. */
    @JsonProperty("mixed_only") MIXED_ONLY,
    /** Each match independently draws mixed, men's or women's doubles, mostly mixed. */
    @JsonProperty("randomized_modes") RANDOMIZED_MODES;

    public static GenderPreference parse(String value) {
        return GenderPreference.valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
