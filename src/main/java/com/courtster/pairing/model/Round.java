package com.courtster.pairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One generation unit: matches, one per court at most, plus the players left off court.
 *
 * @param number         round number, 1-based
 * @param matches        matches in court order
 * @param sittingPlayers eligible players not placed in any match
 */
public record Round(
    @JsonProperty("number") int number,
    @JsonProperty("matches") ImmutableList<Match> matches,
    @JsonProperty("sittingPlayers") ImmutableList<Player> sittingPlayers
) {

    public Round {
        if (number < 1) {
            throw new IllegalArgumentException("Round numbers start at 1, got " + number);
        }
        matches = matches == null ? ImmutableList.of() : matches;
        sittingPlayers = sittingPlayers == null ? ImmutableList.of() : sittingPlayers;
    }

    public List<String> participantIds() {
        return matches.stream().flatMap(m -> m.playerIds().stream()).toList();
    }

    public List<String> sittingIds() {
        return sittingPlayers.stream().map(Player::id).toList();
    }
}
