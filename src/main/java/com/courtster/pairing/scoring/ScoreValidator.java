package com.courtster.pairing.scoring;

/**
 * Checks entered scores against a {@link ScoringRule}.
 */
public final class ScoreValidator {

    private ScoreValidator() {
        // Utility class
    }

    /**
     * @throws InvalidScoreException naming the broken rule
     */
    public static void validate(ScoringRule rule, int team1Score, int team2Score) throws InvalidScoreException {
        if (team1Score < 0 || team2Score < 0) {
            throw new InvalidScoreException(rule,
                String.format("Scores cannot be negative: %d-%d", team1Score, team2Score));
        }
        int sum = team1Score + team2Score;
        switch (rule.mode()) {
            case POINTS -> {
                if (sum != rule.target()) {
                    throw new InvalidScoreException(rule,
                        String.format("Points must add up to %d, got %d-%d", rule.target(), team1Score, team2Score));
                }
            }
            case TOTAL_GAMES -> {
                if (sum != rule.target()) {
                    throw new InvalidScoreException(rule,
                        String.format("Games must add up to %d, got %d-%d", rule.target(), team1Score, team2Score));
                }
            }
            case FIRST_TO -> {
                int high = Math.max(team1Score, team2Score);
                int low = Math.min(team1Score, team2Score);
                if (high < rule.target()) {
                    throw new InvalidScoreException(rule,
                        String.format("The winner must reach %d, got %d-%d", rule.target(), team1Score, team2Score));
                }
                if (high == rule.target()) {
                    if (low >= rule.target()) {
                        throw new InvalidScoreException(rule,
                            String.format("Only one team can reach %d, got %d-%d", rule.target(), team1Score, team2Score));
                    }
                } else if (rule.winBy() == 1) {
                    throw new InvalidScoreException(rule,
                        String.format("The match ends at %d, got %d-%d", rule.target(), team1Score, team2Score));
                } else if (high - low < rule.winBy()) {
                    throw new InvalidScoreException(rule,
                        String.format("Past %d the winner must lead by %d, got %d-%d",
                            rule.target(), rule.winBy(), team1Score, team2Score));
                }
            }
        }
    }

    public static boolean isValid(ScoringRule rule, int team1Score, int team2Score) {
        try {
            validate(rule, team1Score, team2Score);
            return true;
        } catch (InvalidScoreException e) {
            return false;
        }
    }
}
