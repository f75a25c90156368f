package com.courtster.pairing.strategy;

import com.courtster.pairing.gender.Composition;
import com.courtster.pairing.history.PairHistory;
import com.courtster.pairing.model.Player;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Mexicano grouping: players sorted by rating fill courts top-down, so court 1 holds
 * the four strongest, court 2 the next four, and so on.
 *
 * <p>Inside each group the highest-rated player partners the lowest. Another split is
 * taken only to avoid repeating a player's previous partnership, and only if its team
 * rating gap stays within {@link #MAX_TEAM_GAP} (or the best available gap). When no
 * split avoids the repeat, the repeat is allowed.
 */
public class SkillClusteringStrategy implements GroupingStrategy {

    static final double MAX_TEAM_GAP = 2.0;
    private static final double EPSILON = 1e-9;

    @Override
    public List<TeamPairing> group(List<Player> players, List<Composition> plan, GroupingContext context) {
        List<Player> ordered = byRatingDescending(players, context.random());
        List<Groups.Formed> groups = Groups.form(ordered, plan, (group, candidates) -> candidates.get(0), context);

        List<TeamPairing> pairings = new ArrayList<>();
        for (Groups.Formed g : groups) {
            pairings.add(split(g, context.history()));
        }
        // Strongest group on court 1, whatever order the plan formed them in
        pairings.sort(Comparator.comparingDouble(TeamPairing::averageRating).reversed());
        return pairings;
    }

    /**
     * Chooses the teams for one group of four.
     */
    TeamPairing split(Groups.Formed group, PairHistory history) {
        List<Player> sorted = new ArrayList<>(group.players());
        sorted.sort(Comparator.comparingDouble(Player::rating).reversed());
        List<TeamPairing> options = TeamSplits.of(sorted, group.composition());

        double bestGap = options.stream().mapToDouble(TeamPairing::ratingGap).min().orElse(0);
        double limit = Math.max(bestGap, MAX_TEAM_GAP) + EPSILON;

        return options.stream()
            .filter(o -> o.ratingGap() <= limit)
            .min(Comparator.comparing((TeamPairing o) -> TeamSplits.repeatsLastPartners(o, history))
                .thenComparingDouble(TeamPairing::ratingGap)
                .thenComparingInt(o -> TeamSplits.partnerCount(o, history)))
            .orElse(options.get(0));
    }

    /**
     * Rating order with random tie-breaks.
     */
    static List<Player> byRatingDescending(List<Player> players, Random random) {
        List<Player> ordered = new ArrayList<>(players);
        Collections.shuffle(ordered, random);
        ordered.sort(Comparator.comparingDouble(Player::rating).reversed());
        return ordered;
    }
}
