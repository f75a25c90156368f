package com.courtster.pairing.engine;

import com.courtster.pairing.model.Match;
import com.courtster.pairing.strategy.TeamPairing;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Places pairings on courts.
 */
public final class CourtAssigner {

    private CourtAssigner() {}

    /**
     * Whole-round mode: pairing {@code i} goes to court {@code i + 1}, in the order given.
     */
    public static ImmutableList<Match> assignSequential(List<TeamPairing> pairings) {
        ImmutableList.Builder<Match> matches = ImmutableList.builder();
        for (int i = 0; i < pairings.size(); i++) {
            matches.add(assignCourt(i + 1, pairings.get(i)));
        }
        return matches.build();
    }

    /**
     * Per-court mode: the pairing goes to the named court.
     */
    public static Match assignCourt(int court, TeamPairing pairing) {
        return Match.scheduled(court, pairing.team1(), pairing.team2());
    }
}
