package com.courtster.pairing.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How a match is scored, used to validate entered results.
 *
 * @param mode   scoring mode
 * @param target points or games the mode is built around
 * @param winBy  lead needed to win past the target in {@link Mode#FIRST_TO}; 1 means the
 *               target ends the match
 */
public record ScoringRule(
    @JsonProperty("mode") Mode mode,
    @JsonProperty("target") int target,
    @JsonProperty("winBy") int winBy
) {

    public enum Mode {
        /** A fixed number of points is played; both scores add up to it. */
        @JsonProperty("points") POINTS,
        /** First team to reach the target wins, extended by deuce when a win-by margin is set. */
        @JsonProperty("first_to") FIRST_TO,
        /** A fixed number of games is played; both scores add up to it. */
        @JsonProperty("total_games") TOTAL_GAMES
    }

    public ScoringRule {
        if (mode == null) {
            throw new IllegalArgumentException("Scoring mode is required");
        }
        if (target < 1) {
            throw new IllegalArgumentException("Scoring target must be positive, got " + target);
        }
        if (winBy < 1) {
            throw new IllegalArgumentException("Win-by margin must be positive, got " + winBy);
        }
        if (winBy > 1 && mode != Mode.FIRST_TO) {
            throw new IllegalArgumentException("Only first_to scoring takes a win-by margin");
        }
    }

    public ScoringRule(Mode mode, int target) {
        this(mode, target, 1);
    }

    public static ScoringRule points(int total) {
        return new ScoringRule(Mode.POINTS, total);
    }

    public static ScoringRule firstTo(int games) {
        return new ScoringRule(Mode.FIRST_TO, games);
    }

    /**
     * First to {@code target}, or past it by deuce until one side leads by {@code winBy}.
     */
    public static ScoringRule firstTo(int target, int winBy) {
        return new ScoringRule(Mode.FIRST_TO, target, winBy);
    }

    public static ScoringRule totalGames(int games) {
        return new ScoringRule(Mode.TOTAL_GAMES, games);
    }

    /**
     * Parses {@code mode:target[:winBy]}, e.g. {@code points:21}, {@code first_to:6},
     * {@code first_to:15:2} or {@code total_games:8}.
     *
     * @throws IllegalArgumentException if the value is malformed
     */
    public static ScoringRule parse(String value) {
        String[] parts = value.split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("Invalid scoring rule: " + value + " (expected mode:target[:winBy])");
        }
        Mode mode;
        try {
            mode = Mode.valueOf(parts[0].trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scoring mode in: " + value, e);
        }
        try {
            int target = Integer.parseInt(parts[1].trim());
            int winBy = parts.length == 3 ? Integer.parseInt(parts[2].trim()) : 1;
            return new ScoringRule(mode, target, winBy);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in scoring rule: " + value, e);
        }
    }

    @Override
    public String toString() {
        String base = mode.name().toLowerCase() + ":" + target;
        return winBy > 1 ? base + ":" + winBy : base;
    }
}
