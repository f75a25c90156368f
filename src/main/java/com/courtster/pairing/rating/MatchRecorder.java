package com.courtster.pairing.rating;

import com.courtster.pairing.model.Match;
import com.courtster.pairing.model.Player;
import com.courtster.pairing.roster.Roster;
import com.google.common.collect.ImmutableList;
import de.gesundkrank.jskills.Rating;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds completed matches into the roster: win/loss/tie record, points, streaks,
 * TrueSkill ratings, and partner/opponent history.
 *
 * <p>Each match id is processed at most once. Scores are assumed to be legal for the
 * tournament's scoring rule; only their presence is checked here.
 */
public class MatchRecorder {
    private final Roster roster;
    private final RatingUpdater ratingUpdater;
    private final Set<String> recordedMatchIds = new HashSet<>();

    public MatchRecorder(Roster roster, RatingUpdater ratingUpdater) {
        this.roster = roster;
        this.ratingUpdater = ratingUpdater;
    }

    /**
     * Applies one scored match.
     *
     * @param match a match carrying both scores
     * @return roster snapshot after the update
     * @throws IllegalArgumentException if a score is missing or a player is not on the roster
     * @throws IllegalStateException    if this match was already recorded
     */
    public ImmutableList<Player> record(Match match) {
        if (!match.hasScores()) {
            throw new IllegalArgumentException("Match on court " + match.court() + " has no scores");
        }
        if (recordedMatchIds.contains(match.id())) {
            throw new IllegalStateException("Match " + match.id() + " was already recorded");
        }

        // Current state, not the snapshot taken when the match was scheduled
        List<Player> team1 = match.team1Ids().stream().map(roster::get).toList();
        List<Player> team2 = match.team2Ids().stream().map(roster::get).toList();
        int score1 = match.team1Score();
        int score2 = match.team2Score();

        Map<String, Rating> ratings = ratingUpdater.update(team1, team2, score1, score2);
        for (Player p : team1) {
            roster.update(p.id(), current -> withResult(current, score1, score2, ratings.get(p.id())));
        }
        for (Player p : team2) {
            roster.update(p.id(), current -> withResult(current, score2, score1, ratings.get(p.id())));
        }
        roster.history().recordMatch(match.team1Ids(), match.team2Ids());
        recordedMatchIds.add(match.id());
        return roster.snapshot();
    }

    /**
     * Rebuilds pair history from a persisted match without touching player stats,
     * which persisted players already carry. Unscored or already seen matches are ignored.
     */
    public void replay(Match match) {
        if (match.hasScores() && recordedMatchIds.add(match.id())) {
            roster.history().recordMatch(match.team1Ids(), match.team2Ids());
        }
    }

    public boolean isRecorded(String matchId) {
        return recordedMatchIds.contains(matchId);
    }

    static Player withResult(Player p, int ownScore, int otherScore, Rating rating) {
        Player.Builder b = p.toBuilder()
            .totalPoints(p.totalPoints() + ownScore)
            .rating(rating.getMean())
            .ratingDeviation(rating.getStandardDeviation());

        if (ownScore > otherScore) {
            int streak = p.currentStreak() > 0 ? p.currentStreak() + 1 : 1;
            b.wins(p.wins() + 1)
                .currentStreak(streak)
                .longestWinStreak(Math.max(p.longestWinStreak(), streak));
        } else if (ownScore < otherScore) {
            int streak = p.currentStreak() < 0 ? p.currentStreak() - 1 : -1;
            b.losses(p.losses() + 1).currentStreak(streak);
        } else {
            b.ties(p.ties() + 1).currentStreak(0);
        }
        return b.build();
    }
}
