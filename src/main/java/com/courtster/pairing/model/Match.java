package com.courtster.pairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One court's contest in a round: two teams of two.
 * Scores are null until entered; {@link #withScores(int, int)} returns the completed copy.
 *
 * @param id         unique match id, used to record a result exactly once
 * @param court      court number, 1-based
 * @param team1      first team, exactly two players
 * @param team2      second team, exactly two players
 * @param team1Score first team's score, or null
 * @param team2Score second team's score, or null
 * @param completed  whether the score has been entered
 */
public record Match(
    @JsonProperty("id") String id,
    @JsonProperty("court") int court,
    @JsonProperty("team1") ImmutableList<Player> team1,
    @JsonProperty("team2") ImmutableList<Player> team2,
    @JsonProperty("team1Score") Integer team1Score,
    @JsonProperty("team2Score") Integer team2Score,
    @JsonProperty("completed") boolean completed
) {

    public Match {
        Objects.requireNonNull(id, "id");
        if (court < 1) {
            throw new IllegalArgumentException("Court numbers start at 1, got " + court);
        }
        if (team1 == null || team1.size() != 2 || team2 == null || team2.size() != 2) {
            throw new IllegalArgumentException("Each team needs exactly 2 players");
        }
        Set<String> ids = new HashSet<>();
        for (Player p : team1) {
            ids.add(p.id());
        }
        for (Player p : team2) {
            ids.add(p.id());
        }
        if (ids.size() != 4) {
            throw new IllegalArgumentException("A match needs 4 distinct players, got " + ids);
        }
    }

    /**
     * A new, unscored match with a generated id.
     */
    public static Match scheduled(int court, List<Player> team1, List<Player> team2) {
        return new Match(UUID.randomUUID().toString(), court,
            ImmutableList.copyOf(team1), ImmutableList.copyOf(team2), null, null, false);
    }

    public Match withScores(int team1Score, int team2Score) {
        return new Match(id, court, team1, team2, team1Score, team2Score, true);
    }

    public boolean hasScores() {
        return team1Score != null && team2Score != null;
    }

    public ImmutableList<Player> players() {
        return ImmutableList.<Player>builder().addAll(team1).addAll(team2).build();
    }

    public List<String> team1Ids() {
        return team1.stream().map(Player::id).toList();
    }

    public List<String> team2Ids() {
        return team2.stream().map(Player::id).toList();
    }

    public List<String> playerIds() {
        return players().stream().map(Player::id).toList();
    }

    public boolean involves(String playerId) {
        return playerIds().contains(playerId);
    }
}
