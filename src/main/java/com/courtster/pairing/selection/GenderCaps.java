package com.courtster.pairing.selection;

import com.courtster.pairing.model.Gender;
import com.courtster.pairing.model.Player;

/**
 * Upper bounds on how many men and women may be picked to play.
 * Unspecified players are never capped.
 */
public record GenderCaps(int male, int female) {

    public static final GenderCaps NONE = new GenderCaps(Integer.MAX_VALUE, Integer.MAX_VALUE);

    boolean admits(Player p, int malesTaken, int femalesTaken) {
        return switch (p.gender()) {
            case MALE -> malesTaken < male;
            case FEMALE -> femalesTaken < female;
            case UNSPECIFIED -> true;
        };
    }

    static int count(Iterable<Player> players, Gender gender) {
        int n = 0;
        for (Player p : players) {
            if (p.gender() == gender) {
                n++;
            }
        }
        return n;
    }
}
