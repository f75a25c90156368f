package com.courtster.pairing.strategy;

import com.courtster.pairing.gender.Composition;
import com.courtster.pairing.model.Degradation;
import com.courtster.pairing.model.GenderPreference;
import com.courtster.pairing.model.Player;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fixed-partner grouping: registered partner pairs are atomic teams and only opponents rotate.
 *
 * <p>A pair is valid when both players are in the pool and each names the other as partner.
 * Valid pairs meet the pair they have opposed least (random among equals), strongest pairs
 * on the lowest courts. Players without a valid pair, plus one pair when their number is
 * odd, are grouped by rating instead and a {@link Degradation.Kind#FIXED_PARTNER_FALLBACK}
 * is reported.
 */
public class FixedPartnerStrategy implements GroupingStrategy {

    private final SkillClusteringStrategy fallback = new SkillClusteringStrategy();

    @Override
    public List<List<Player>> units(List<Player> eligible) {
        List<List<Player>> pairs = validPairs(eligible);
        List<String> paired = pairs.stream().flatMap(List::stream).map(Player::id).toList();
        List<List<Player>> units = new ArrayList<>(pairs);
        for (Player p : eligible) {
            if (!paired.contains(p.id())) {
                units.add(List.of(p));
            }
        }
        return units;
    }

    /**
     * Partners are bound, so gender rules cannot reshape teams.
     */
    @Override
    public GenderPreference effectivePreference(GenderPreference configured) {
        return GenderPreference.ANY;
    }

    @Override
    public List<TeamPairing> group(List<Player> players, List<Composition> plan, GroupingContext context) {
        List<List<Player>> pairs = new ArrayList<>(validPairs(players));
        Collections.shuffle(pairs, context.random());
        pairs.sort(Comparator.comparingDouble(FixedPartnerStrategy::averageRating).reversed());

        List<Player> orphans = new ArrayList<>(players);
        if (pairs.size() % 2 == 1) {
            pairs.remove(pairs.size() - 1);
        }
        for (List<Player> pair : pairs) {
            orphans.removeAll(pair);
        }

        List<TeamPairing> pairings = new ArrayList<>();
        while (!pairs.isEmpty()) {
            List<Player> first = pairs.remove(0);
            List<List<Player>> candidates = new ArrayList<>(pairs);
            Collections.shuffle(candidates, context.random());
            List<Player> opponent = candidates.stream()
                .min(Comparator.comparingInt(other -> timesOpposed(first, other, context)))
                .orElseThrow();
            pairs.remove(opponent);
            pairings.add(new TeamPairing(ImmutableList.copyOf(first), ImmutableList.copyOf(opponent), Composition.ANY));
        }
        pairings.sort(Comparator.comparingDouble(TeamPairing::averageRating).reversed());

        if (!orphans.isEmpty()) {
            context.report(Degradation.Kind.FIXED_PARTNER_FALLBACK,
                "No valid partner pairing for " + orphans.stream().map(Player::name).collect(Collectors.joining(", "))
                    + "; grouped by rating");
            pairings.addAll(fallback.group(orphans, plan.subList(pairings.size(), plan.size()), context));
        }
        return pairings;
    }

    /**
     * Symmetric partner pairs with both members in {@code pool}, each listed once.
     */
    static List<List<Player>> validPairs(List<Player> pool) {
        Map<String, Player> byId = new HashMap<>();
        for (Player p : pool) {
            byId.put(p.id(), p);
        }
        List<List<Player>> pairs = new ArrayList<>();
        for (Player p : pool) {
            Player partner = p.partner().map(byId::get).orElse(null);
            if (partner != null
                    && !partner.id().equals(p.id())
                    && p.id().equals(partner.partnerId())
                    && p.id().compareTo(partner.id()) < 0) {
                pairs.add(List.of(p, partner));
            }
        }
        return pairs;
    }

    private static int timesOpposed(List<Player> a, List<Player> b, GroupingContext context) {
        int total = 0;
        for (Player x : a) {
            for (Player y : b) {
                total += context.history().opponentCount(x.id(), y.id());
            }
        }
        return total;
    }

    private static double averageRating(List<Player> pair) {
        return pair.stream().mapToDouble(Player::rating).average().orElse(0);
    }
}
