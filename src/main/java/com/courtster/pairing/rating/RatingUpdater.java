package com.courtster.pairing.rating;

import com.courtster.pairing.model.Player;
import de.gesundkrank.jskills.GameInfo;
import de.gesundkrank.jskills.IPlayer;
import de.gesundkrank.jskills.ITeam;
import de.gesundkrank.jskills.Rating;
import de.gesundkrank.jskills.Team;
import de.gesundkrank.jskills.TrueSkillCalculator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Two-team TrueSkill rating updates using JSkills.
 * Each doubles team is a 2-player JSkills team; a player's {@code rating} is the TrueSkill
 * mean and {@code ratingDeviation} its standard deviation.
 *
 * <p>A decisive result never lowers a winner's mean or raises a loser's. Equal scores are
 * submitted as a draw.
 */
public class RatingUpdater {

    static final double DRAW_PROBABILITY = 0.1;
    private static final int MAX_WARNINGS = 5;

    private final GameInfo gameInfo;

    // Track convergence failures for logging
    private int convergenceFailures = 0;

    public RatingUpdater(GameInfo gameInfo) {
        this.gameInfo = gameInfo;
    }

    /**
     * Game parameters scaled to a roster whose default rating is {@code defaultRating}:
     * sigma = mu/3, beta = sigma/2, tau = sigma/100.
     */
    public static GameInfo gameInfoFor(double defaultRating) {
        double sigma = defaultRating / 3.0;
        return new GameInfo(defaultRating, sigma, sigma / 2.0, sigma / 100.0, DRAW_PROBABILITY);
    }

    public static RatingUpdater withDefaults() {
        return new RatingUpdater(gameInfoFor(Player.DEFAULT_RATING));
    }

    /**
     * Computes new ratings for the four players of a scored match.
     *
     * @param team1      first team
     * @param team2      second team
     * @param team1Score first team's score
     * @param team2Score second team's score
     * @return new rating per player id; the current ratings if TrueSkill fails
     */
    public Map<String, Rating> update(List<Player> team1, List<Player> team2, int team1Score, int team2Score) {
        Map<String, Rating> result = new HashMap<>();
        Map<String, de.gesundkrank.jskills.Player<String>> jPlayers = new HashMap<>();
        List<ITeam> teams = new ArrayList<>();
        for (List<Player> side : List.of(team1, team2)) {
            Team team = new Team();
            for (Player p : side) {
                de.gesundkrank.jskills.Player<String> jp = new de.gesundkrank.jskills.Player<>(p.id());
                jPlayers.put(p.id(), jp);
                Rating current = new Rating(p.rating(), p.ratingDeviation());
                result.put(p.id(), current);
                team.addPlayer(jp, current);
            }
            teams.add(team);
        }

        // 1-based ranks, equal ranks for a draw
        int[] ranks = {
            team1Score >= team2Score ? 1 : 2,
            team2Score >= team1Score ? 1 : 2
        };

        try {
            Map<IPlayer, Rating> newRatings = TrueSkillCalculator.calculateNewRatings(gameInfo, teams, ranks);
            for (Map.Entry<String, de.gesundkrank.jskills.Player<String>> e : jPlayers.entrySet()) {
                Rating updated = newRatings.get(e.getValue());
                if (updated != null) {
                    result.put(e.getKey(), monotonic(result.get(e.getKey()), updated,
                        winnerDirection(e.getKey(), team1, team1Score, team2Score)));
                }
            }
        } catch (RuntimeException e) {
            // Keep existing ratings and continue
            convergenceFailures++;
            if (convergenceFailures <= MAX_WARNINGS) {
                System.err.println("Warning: TrueSkill failed to converge, keeping existing ratings: " + e.getMessage());
            } else if (convergenceFailures == MAX_WARNINGS + 1) {
                System.err.println("Warning: Suppressing further TrueSkill convergence warnings...");
            }
        }
        return result;
    }

    // +1 for a winner, -1 for a loser, 0 for a draw
    private static int winnerDirection(String playerId, List<Player> team1, int team1Score, int team2Score) {
        boolean onTeam1 = team1.stream().anyMatch(p -> p.id().equals(playerId));
        int sign = Integer.signum(team1Score - team2Score);
        return onTeam1 ? sign : -sign;
    }

    private static Rating monotonic(Rating before, Rating after, int direction) {
        if (direction > 0 && after.getMean() < before.getMean()
                || direction < 0 && after.getMean() > before.getMean()) {
            return new Rating(before.getMean(), after.getStandardDeviation());
        }
        return after;
    }

    /**
     * Number of matches where TrueSkill failed and ratings were left unchanged.
     */
    public int convergenceFailures() {
        return convergenceFailures;
    }

    /**
     * Conservative display rating: mu - 3*sigma.
     */
    public static double conservativeRating(Player player) {
        return player.rating() - 3.0 * player.ratingDeviation();
    }
}
