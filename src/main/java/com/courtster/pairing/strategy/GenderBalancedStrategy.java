package com.courtster.pairing.strategy;

import com.courtster.pairing.model.GenderPreference;

/**
 * Mixed Mexicano: rating-clustered like Mexicano, but every team should pair a man with a
 * woman. Unless the configuration already asks for randomized modes, gender is treated as
 * {@code mixed_only}; unspecified players fill either slot.
 */
public class GenderBalancedStrategy extends SkillClusteringStrategy {

    @Override
    public GenderPreference effectivePreference(GenderPreference configured) {
        return configured == GenderPreference.ANY ? GenderPreference.MIXED_ONLY : configured;
    }
}
