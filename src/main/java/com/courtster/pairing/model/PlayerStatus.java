package com.courtster.pairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Attendance status of a player. Advisory only: the engine schedules every
 * player it was given, callers filter by status before constructing it.
 */
public enum PlayerStatus {
    @JsonProperty("active") ACTIVE,
    @JsonProperty("late") LATE,
    @JsonProperty("no_show") NO_SHOW,
    @JsonProperty("departed") DEPARTED,
    @JsonProperty("inactive") INACTIVE
}
