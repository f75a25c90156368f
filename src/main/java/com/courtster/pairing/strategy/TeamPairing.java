package com.courtster.pairing.strategy;

import com.courtster.pairing.gender.Composition;
import com.courtster.pairing.model.Player;
import com.google.common.collect.ImmutableList;

/**
 * Two teams of two, not yet placed on a court.
 */
public record TeamPairing(ImmutableList<Player> team1, ImmutableList<Player> team2, Composition composition) {

    public static TeamPairing of(Player a, Player b, Player c, Player d, Composition composition) {
        return new TeamPairing(ImmutableList.of(a, b), ImmutableList.of(c, d), composition);
    }

    public ImmutableList<Player> players() {
        return ImmutableList.<Player>builder().addAll(team1).addAll(team2).build();
    }

    public double averageRating() {
        return players().stream().mapToDouble(Player::rating).average().orElse(0);
    }

    /**
     * Difference between the two teams' average ratings.
     */
    public double ratingGap() {
        double t1 = (team1.get(0).rating() + team1.get(1).rating()) / 2.0;
        double t2 = (team2.get(0).rating() + team2.get(1).rating()) / 2.0;
        return Math.abs(t1 - t2);
    }
}
