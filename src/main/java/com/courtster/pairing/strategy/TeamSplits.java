package com.courtster.pairing.strategy;

import com.courtster.pairing.gender.Composition;
import com.courtster.pairing.history.PairHistory;
import com.courtster.pairing.model.Player;

import java.util.ArrayList;
import java.util.List;

/**
 * The three ways to split four players into two teams, and the history measures
 * strategies rank them by.
 */
final class TeamSplits {

    private TeamSplits() {}

    /**
     * Splits of {@code [a, b, c, d]} in the order a+d/b+c, a+c/b+d, a+b/c+d, keeping only those
     * the composition allows. For a group sorted by rating the first split pairs highest with lowest.
     */
    static List<TeamPairing> of(List<Player> group, Composition composition) {
        Player a = group.get(0);
        Player b = group.get(1);
        Player c = group.get(2);
        Player d = group.get(3);
        List<TeamPairing> all = List.of(
            TeamPairing.of(a, d, b, c, composition),
            TeamPairing.of(a, c, b, d, composition),
            TeamPairing.of(a, b, c, d, composition)
        );
        List<TeamPairing> allowed = new ArrayList<>();
        for (TeamPairing split : all) {
            if (composition.allowsTeam(split.team1().get(0), split.team1().get(1))
                    && composition.allowsTeam(split.team2().get(0), split.team2().get(1))) {
                allowed.add(split);
            }
        }
        return allowed.isEmpty() ? all : allowed;
    }

    static int partnerCount(TeamPairing split, PairHistory history) {
        return history.partnerCount(split.team1().get(0).id(), split.team1().get(1).id())
            + history.partnerCount(split.team2().get(0).id(), split.team2().get(1).id());
    }

    static int opponentCount(TeamPairing split, PairHistory history) {
        int total = 0;
        for (Player x : split.team1()) {
            for (Player y : split.team2()) {
                total += history.opponentCount(x.id(), y.id());
            }
        }
        return total;
    }

    /**
     * Whether either team repeats its members' most recent partnership.
     */
    static boolean repeatsLastPartners(TeamPairing split, PairHistory history) {
        return history.wereLastPartners(split.team1().get(0).id(), split.team1().get(1).id())
            || history.wereLastPartners(split.team2().get(0).id(), split.team2().get(1).id());
    }
}
