package com.courtster.pairing.strategy;

import com.courtster.pairing.gender.Composition;
import com.courtster.pairing.model.GenderPreference;
import com.courtster.pairing.model.Player;

import java.util.List;

/**
 * Turns the players picked for a call into 2-vs-2 pairings, one per match.
 * One implementation per tournament format, chosen once when the engine is built.
 */
public interface GroupingStrategy {

    /**
     * Groups players into matches.
     *
     * @param players players to place, exactly {@code 4 * plan.size()}
     * @param plan    gender composition wanted for each match, in court order
     * @param context pair history, randomness and the degradation sink
     * @return one pairing per planned match, in court order
     */
    List<TeamPairing> group(List<Player> players, List<Composition> plan, GroupingContext context);

    /**
     * Splits an eligible pool into units that should play or sit together.
     * Every player is its own unit unless the format binds players.
     */
    default List<List<Player>> units(List<Player> eligible) {
        return eligible.stream().map(List::of).toList();
    }

    /**
     * Gender policy actually applied for this format, given the configured one.
     */
    default GenderPreference effectivePreference(GenderPreference configured) {
        return configured;
    }
}
