package com.courtster.pairing.strategy;

import com.courtster.pairing.model.TournamentFormat;

/**
 * Picks the grouping strategy for a tournament format.
 */
public final class GroupingStrategies {

    private GroupingStrategies() {}

    public static GroupingStrategy forFormat(TournamentFormat format) {
        return switch (format) {
            case MEXICANO -> new SkillClusteringStrategy();
            case AMERICANO -> new OpponentRotationStrategy();
            case FIXED_PARTNER -> new FixedPartnerStrategy();
            case MIXED_MEXICANO -> new GenderBalancedStrategy();
        };
    }
}
