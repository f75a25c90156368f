package com.courtster.pairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Round engine configuration.
 *
 * @param courts           number of courts available per round
 * @param format           tournament format, fixes the grouping strategy
 * @param genderPreference match composition policy
 */
public record EngineConfig(
    @JsonProperty("courts") int courts,
    @JsonProperty("format") TournamentFormat format,
    @JsonProperty("genderPreference") GenderPreference genderPreference
) {

    public EngineConfig {
        if (format == null) {
            format = TournamentFormat.MEXICANO;
        }
        if (genderPreference == null) {
            genderPreference = GenderPreference.ANY;
        }
    }

    /**
     * Mexicano on the given number of courts, gender ignored.
     */
    public static EngineConfig of(int courts) {
        return new EngineConfig(courts, TournamentFormat.MEXICANO, GenderPreference.ANY);
    }

    public static EngineConfig of(int courts, TournamentFormat format) {
        return new EngineConfig(courts, format, GenderPreference.ANY);
    }
}
