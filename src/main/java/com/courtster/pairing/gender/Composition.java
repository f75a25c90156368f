package com.courtster.pairing.gender;

import com.courtster.pairing.model.Gender;
import com.courtster.pairing.model.Player;

import java.util.List;

/**
 * Gender make-up of one match. Unspecified players count as wildcards everywhere.
 */
public enum Composition {
    /** No constraint. */
    ANY,
    /** Each team one man and one woman. */
    MIXED,
    /** Men's doubles. */
    MALE,
    /** Women's doubles. */
    FEMALE;

    /**
     * Whether {@code candidate} may join a partly formed group of this composition.
     */
    public boolean admits(List<Player> group, Player candidate) {
        Gender g = candidate.gender();
        return switch (this) {
            case ANY -> true;
            case MIXED -> g == Gender.UNSPECIFIED || count(group, g) < 2;
            case MALE -> g != Gender.FEMALE;
            case FEMALE -> g != Gender.MALE;
        };
    }

    /**
     * Whether two players may form a team under this composition.
     */
    public boolean allowsTeam(Player a, Player b) {
        return switch (this) {
            case ANY -> true;
            case MIXED -> a.gender() == Gender.UNSPECIFIED || a.gender() != b.gender();
            case MALE -> a.gender() != Gender.FEMALE && b.gender() != Gender.FEMALE;
            case FEMALE -> a.gender() != Gender.MALE && b.gender() != Gender.MALE;
        };
    }

    /**
     * Whether a pool with these counts can still supply one group of this composition.
     */
    public boolean feasible(GenderCounts counts) {
        return switch (this) {
            case ANY -> counts.total() >= 4;
            case MIXED -> Math.min(counts.male(), 2) + Math.min(counts.female(), 2) + counts.unspecified() >= 4;
            case MALE -> counts.male() + counts.unspecified() >= 4;
            case FEMALE -> counts.female() + counts.unspecified() >= 4;
        };
    }

    /**
     * Counts left after reserving one group of this composition, gendered players first.
     */
    public GenderCounts reserve(GenderCounts counts) {
        switch (this) {
            case MIXED -> {
                int m = Math.min(counts.male(), 2);
                int f = Math.min(counts.female(), 2);
                return counts.minus(m, f, 4 - m - f);
            }
            case MALE -> {
                int m = Math.min(counts.male(), 4);
                return counts.minus(m, 0, 4 - m);
            }
            case FEMALE -> {
                int f = Math.min(counts.female(), 4);
                return counts.minus(0, f, 4 - f);
            }
            default -> {
                // Take from the largest group first to keep the rest balanced
                GenderCounts left = counts;
                for (int i = 0; i < 4; i++) {
                    if (left.male() >= left.female() && left.male() >= left.unspecified() && left.male() > 0) {
                        left = left.minus(1, 0, 0);
                    } else if (left.female() >= left.unspecified() && left.female() > 0) {
                        left = left.minus(0, 1, 0);
                    } else {
                        left = left.minus(0, 0, 1);
                    }
                }
                return left;
            }
        }
    }

    private static int count(List<Player> group, Gender gender) {
        int n = 0;
        for (Player p : group) {
            if (p.gender() == gender) {
                n++;
            }
        }
        return n;
    }
}
