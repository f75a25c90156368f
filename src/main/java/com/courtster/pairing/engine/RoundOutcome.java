package com.courtster.pairing.engine;

import com.courtster.pairing.model.Degradation;
import com.courtster.pairing.model.Player;
import com.courtster.pairing.model.Round;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * Result of a generation call.
 *
 * @param round        the generated round
 * @param roster       every player after this call's counter updates
 * @param degradations fallbacks taken while generating, empty when everything was honoured
 */
public record RoundOutcome(
    @JsonProperty("round") Round round,
    @JsonProperty("roster") ImmutableList<Player> roster,
    @JsonProperty("degradations") ImmutableList<Degradation> degradations
) {

    public boolean degraded() {
        return !degradations.isEmpty();
    }

    public boolean degradedBy(Degradation.Kind kind) {
        return degradations.stream().anyMatch(d -> d.kind() == kind);
    }
}
