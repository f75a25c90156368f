package com.courtster.pairing.selection;

import com.courtster.pairing.model.Player;
import com.google.common.collect.ImmutableList;

/**
 * Who plays and who sits for one generation call.
 *
 * @param roundNumber round being generated
 * @param eligible    every player considered this call
 * @param playing     players to be grouped into matches, {@code 4 * matchCount} of them
 * @param sitting     the rest of the eligible pool
 * @param matchCount  matches to fill
 */
public record Selection(
    int roundNumber,
    ImmutableList<Player> eligible,
    ImmutableList<Player> playing,
    ImmutableList<Player> sitting,
    int matchCount
) {}
