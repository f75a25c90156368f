package com.courtster.pairing.gender;

import com.courtster.pairing.model.Player;

/**
 * Men, women and unspecified players in a pool.
 */
public record GenderCounts(int male, int female, int unspecified) {

    public static GenderCounts of(Iterable<Player> players) {
        int m = 0;
        int f = 0;
        int u = 0;
        for (Player p : players) {
            switch (p.gender()) {
                case MALE -> m++;
                case FEMALE -> f++;
                case UNSPECIFIED -> u++;
            }
        }
        return new GenderCounts(m, f, u);
    }

    public int total() {
        return male + female + unspecified;
    }

    GenderCounts minus(int m, int f, int u) {
        return new GenderCounts(male - m, female - f, unspecified - u);
    }
}
