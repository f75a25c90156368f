package com.courtster.pairing.engine;

import com.courtster.pairing.gender.Composition;
import com.courtster.pairing.model.Match;
import com.courtster.pairing.model.Player;
import com.courtster.pairing.strategy.TeamPairing;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CourtAssignerTest {

    @Test
    void assignSequential_numbersCourtsFromOne() {
        List<TeamPairing> pairings = createPairings(3);

        List<Match> matches = CourtAssigner.assignSequential(pairings);

        assertEquals(List.of(1, 2, 3), matches.stream().map(Match::court).toList());
        assertEquals(pairings.get(1).team1(), matches.get(1).team1(), "Order must be preserved");
        assertEquals(3, matches.stream().map(Match::id).collect(Collectors.toSet()).size());
    }

    @Test
    void assignSequential_emptyGivesNoMatches() {
        assertTrue(CourtAssigner.assignSequential(List.of()).isEmpty());
    }

    @Test
    void assignCourt_usesRequestedCourt() {
        Match match = CourtAssigner.assignCourt(4, createPairings(1).get(0));

        assertEquals(4, match.court());
        assertFalse(match.hasScores());
        assertEquals(Set.of("p0", "p1", "p2", "p3"), Set.copyOf(match.playerIds()));
    }

    private List<TeamPairing> createPairings(int count) {
        List<TeamPairing> pairings = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int base = i * 4;
            pairings.add(TeamPairing.of(
                Player.of("p" + base, "P" + base, 5.0),
                Player.of("p" + (base + 1), "P" + (base + 1), 5.0),
                Player.of("p" + (base + 2), "P" + (base + 2), 5.0),
                Player.of("p" + (base + 3), "P" + (base + 3), 5.0),
                Composition.ANY));
        }
        return pairings;
    }
}
