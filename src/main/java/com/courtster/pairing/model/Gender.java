package com.courtster.pairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Player gender as used by mixed-doubles composition rules.
 * {@link #UNSPECIFIED} players may fill either slot of a mixed team.
 */
public enum Gender {
    @JsonProperty("male") MALE,
    @JsonProperty("female") FEMALE,
    @JsonProperty("unspecified") UNSPECIFIED
}
