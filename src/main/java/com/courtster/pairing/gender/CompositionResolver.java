package com.courtster.pairing.gender;

import com.courtster.pairing.model.Degradation;
import com.courtster.pairing.model.GenderPreference;
import com.courtster.pairing.model.Player;
import com.courtster.pairing.selection.GenderCaps;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Chooses the gender composition of each match to be filled, against what the pool
 * can actually supply.
 *
 * <p>Matches are planned in court order, each one reserving its players from the
 * remaining counts. Infeasible compositions are never drawn: {@code mixed_only} falls
 * back to {@link Composition#ANY} and {@code randomized_modes} only draws among the
 * feasible options, using ANY when none is.
 */
public class CompositionResolver {

    static final int MIXED_WEIGHT = 8;
    static final int SINGLE_GENDER_WEIGHT = 1;

    private final GenderPreference preference;
    private final Random random;

    public CompositionResolver(GenderPreference preference, Random random) {
        this.preference = preference;
        this.random = random;
    }

    /**
     * Plans one composition per match.
     *
     * @param pool         eligible players
     * @param matchCount   matches to fill
     * @param degradations receives a {@link Degradation.Kind#COMPOSITION_FALLBACK} per match that
     *                     could not get the requested composition
     * @return compositions in court order
     */
    public List<Composition> plan(List<Player> pool, int matchCount, List<Degradation> degradations) {
        List<Composition> plan = new ArrayList<>();
        GenderCounts left = GenderCounts.of(pool);
        for (int i = 0; i < matchCount; i++) {
            Composition c = switch (preference) {
                case ANY -> Composition.ANY;
                case MIXED_ONLY -> Composition.MIXED.feasible(left) ? Composition.MIXED : Composition.ANY;
                case RANDOMIZED_MODES -> draw(left);
            };
            if (c == Composition.ANY && preference != GenderPreference.ANY) {
                degradations.add(new Degradation(Degradation.Kind.COMPOSITION_FALLBACK,
                    String.format("Match %d: no gendered composition possible with %d men, %d women, %d unspecified",
                        i + 1, left.male(), left.female(), left.unspecified())));
            }
            plan.add(c);
            left = c.reserve(left);
        }
        return plan;
    }

    /**
     * Upper bounds on men and women on court so that the planned compositions stay possible.
     */
    public static GenderCaps caps(List<Composition> plan) {
        int male = 0;
        int female = 0;
        for (Composition c : plan) {
            switch (c) {
                case ANY -> {
                    male += 4;
                    female += 4;
                }
                case MIXED -> {
                    male += 2;
                    female += 2;
                }
                case MALE -> male += 4;
                case FEMALE -> female += 4;
            }
        }
        return new GenderCaps(male, female);
    }

    private Composition draw(GenderCounts left) {
        List<Composition> options = new ArrayList<>();
        List<Integer> weights = new ArrayList<>();
        if (Composition.MIXED.feasible(left)) {
            options.add(Composition.MIXED);
            weights.add(MIXED_WEIGHT);
        }
        if (Composition.MALE.feasible(left)) {
            options.add(Composition.MALE);
            weights.add(SINGLE_GENDER_WEIGHT);
        }
        if (Composition.FEMALE.feasible(left)) {
            options.add(Composition.FEMALE);
            weights.add(SINGLE_GENDER_WEIGHT);
        }
        if (options.isEmpty()) {
            return Composition.ANY;
        }

        int total = weights.stream().mapToInt(Integer::intValue).sum();
        int roll = random.nextInt(total);
        for (int i = 0; i < options.size(); i++) {
            roll -= weights.get(i);
            if (roll < 0) {
                return options.get(i);
            }
        }
        return options.get(options.size() - 1);
    }
}
