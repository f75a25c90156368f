package com.courtster.pairing.strategy;

import com.courtster.pairing.gender.Composition;
import com.courtster.pairing.history.PairHistory;
import com.courtster.pairing.model.Player;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Americano grouping: spreads opponents evenly instead of clustering by skill.
 *
 * <p>Groups are built greedily from a shuffled pool. Each group starts from the next
 * player and adds whoever has met the partial group least often (as partner or
 * opponent). Each group is then split to minimise repeated opponents, then repeated
 * partners, then at random.
 */
public class OpponentRotationStrategy implements GroupingStrategy {

    @Override
    public List<TeamPairing> group(List<Player> players, List<Composition> plan, GroupingContext context) {
        PairHistory history = context.history();
        List<Player> shuffled = new ArrayList<>(players);
        Collections.shuffle(shuffled, context.random());

        List<Groups.Formed> groups = Groups.form(shuffled, plan, (group, candidates) -> {
            if (group.isEmpty()) {
                return candidates.get(0);
            }
            return candidates.stream()
                .min(Comparator.comparingInt(c -> encounters(c, group, history)))
                .orElseThrow();
        }, context);

        List<TeamPairing> pairings = new ArrayList<>();
        for (Groups.Formed g : groups) {
            List<TeamPairing> options = new ArrayList<>(TeamSplits.of(g.players(), g.composition()));
            Collections.shuffle(options, context.random());
            pairings.add(options.stream()
                .min(Comparator.comparingInt((TeamPairing o) -> TeamSplits.opponentCount(o, history))
                    .thenComparingInt(o -> TeamSplits.partnerCount(o, history)))
                .orElseThrow());
        }
        return pairings;
    }

    private static int encounters(Player candidate, List<Player> group, PairHistory history) {
        int total = 0;
        for (Player member : group) {
            total += history.opponentCount(candidate.id(), member.id())
                + history.partnerCount(candidate.id(), member.id());
        }
        return total;
    }
}
