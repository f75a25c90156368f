package com.courtster.pairing.runner;

import com.courtster.pairing.model.EngineConfig;
import com.courtster.pairing.model.GenderPreference;
import com.courtster.pairing.model.Player;
import com.courtster.pairing.model.TournamentFormat;
import com.courtster.pairing.scoring.ScoringRule;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Simulation settings parsed from CLI args.
 *
 * @param seed random seed, or null for a different run every time
 */
public record SimulationConfig(
    @JsonProperty("name") String name,
    @JsonProperty("rounds") int rounds,
    @JsonProperty("courts") int courts,
    @JsonProperty("format") TournamentFormat format,
    @JsonProperty("genderPreference") GenderPreference genderPreference,
    @JsonProperty("scoring") ScoringRule scoring,
    @JsonProperty("players") List<Player> players,
    @JsonProperty("seed") Long seed
) {

    public EngineConfig engineConfig() {
        return new EngineConfig(courts, format, genderPreference);
    }
}
