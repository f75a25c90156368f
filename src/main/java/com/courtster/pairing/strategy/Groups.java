package com.courtster.pairing.strategy;

import com.courtster.pairing.gender.Composition;
import com.courtster.pairing.model.Degradation;
import com.courtster.pairing.model.Player;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Greedy formation of groups of four under per-match gender compositions.
 */
final class Groups {

    /** A group of four and the composition it actually satisfies. */
    record Formed(ImmutableList<Player> players, Composition composition) {}

    private Groups() {}

    /**
     * Fills one group per planned composition from {@code ordered}. For each seat, {@code next}
     * picks among the remaining players the composition still admits. A group that cannot be
     * completed under its composition is topped up from anyone left and downgraded to ANY.
     *
     * @param ordered players in the strategy's preference order
     * @param plan    composition per group
     * @param next    chooses the next member given the partial group and the admissible candidates
     * @param context receives a degradation for every downgraded group
     */
    static List<Formed> form(List<Player> ordered, List<Composition> plan,
                             BiFunction<List<Player>, List<Player>, Player> next,
                             GroupingContext context) {
        List<Player> remaining = new ArrayList<>(ordered);
        List<Formed> groups = new ArrayList<>();

        for (int i = 0; i < plan.size(); i++) {
            Composition composition = plan.get(i);
            List<Player> group = new ArrayList<>();
            while (group.size() < 4) {
                List<Player> admissible = remaining.stream()
                    .filter(p -> composition.admits(group, p))
                    .toList();
                if (admissible.isEmpty()) {
                    break;
                }
                Player chosen = next.apply(group, admissible);
                group.add(chosen);
                remaining.remove(chosen);
            }

            Composition actual = composition;
            if (group.size() < 4) {
                actual = Composition.ANY;
                while (group.size() < 4) {
                    Player chosen = next.apply(group, List.copyOf(remaining));
                    group.add(chosen);
                    remaining.remove(chosen);
                }
                // Court numbers are not known yet
                context.report(Degradation.Kind.COMPOSITION_FALLBACK,
                    String.format("Could not complete a %s group, %s were placed without gender rules",
                        composition.name().toLowerCase(),
                        group.stream().map(Player::name).collect(Collectors.joining(", "))));
            }
            groups.add(new Formed(ImmutableList.copyOf(group), actual));
        }
        return groups;
    }
}
