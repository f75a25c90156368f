package com.courtster.pairing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * One tournament participant. Immutable: the engine replaces a player with an
 * updated copy whenever counters, record or rating change.
 *
 * @param id                 stable unique identifier
 * @param name               display name
 * @param rating             skill estimate (TrueSkill mean), updated after every scored match
 * @param ratingDeviation    uncertainty of the rating (TrueSkill sigma)
 * @param playCount          rounds played
 * @param sitCount           rounds sat out
 * @param consecutivePlays   rounds played in a row, reset by a sit
 * @param consecutiveSits    rounds sat in a row, reset by a play
 * @param totalPoints        sum of own team's scores
 * @param wins               matches won
 * @param losses             matches lost
 * @param ties               matches drawn
 * @param currentStreak      positive for consecutive wins, negative for consecutive losses
 * @param longestWinStreak   best win streak so far
 * @param status             attendance status, advisory
 * @param gender             gender for composition rules
 * @param partnerId          fixed partner's id, or null
 * @param skipRounds         round numbers this player is excluded from
 * @param compensationPoints credit for sitting, consumed by standings only
 */
public record Player(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("rating") double rating,
    @JsonProperty("ratingDeviation") double ratingDeviation,
    @JsonProperty("playCount") int playCount,
    @JsonProperty("sitCount") int sitCount,
    @JsonProperty("consecutivePlays") int consecutivePlays,
    @JsonProperty("consecutiveSits") int consecutiveSits,
    @JsonProperty("totalPoints") int totalPoints,
    @JsonProperty("wins") int wins,
    @JsonProperty("losses") int losses,
    @JsonProperty("ties") int ties,
    @JsonProperty("currentStreak") int currentStreak,
    @JsonProperty("longestWinStreak") int longestWinStreak,
    @JsonProperty("status") PlayerStatus status,
    @JsonProperty("gender") Gender gender,
    @JsonProperty("partnerId") String partnerId,
    @JsonProperty("skipRounds") ImmutableSet<Integer> skipRounds,
    @JsonProperty("compensationPoints") int compensationPoints
) {

    public static final double DEFAULT_RATING = 5.0;
    public static final double DEFAULT_DEVIATION = DEFAULT_RATING / 3.0;

    public Player {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        if (ratingDeviation <= 0) {
            ratingDeviation = DEFAULT_DEVIATION;
        }
        if (status == null) {
            status = PlayerStatus.ACTIVE;
        }
        if (gender == null) {
            gender = Gender.UNSPECIFIED;
        }
        skipRounds = skipRounds == null ? ImmutableSet.of() : skipRounds;
    }

    /**
     * A fresh player with no history.
     */
    public static Player of(String id, String name, double rating) {
        return builder(id, name).rating(rating).build();
    }

    public static Player of(String id, String name, double rating, Gender gender) {
        return builder(id, name).rating(rating).gender(gender).build();
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public Optional<String> partner() {
        return Optional.ofNullable(partnerId);
    }

    public boolean skips(int roundNumber) {
        return skipRounds.contains(roundNumber);
    }

    public int matchesPlayed() {
        return wins + losses + ties;
    }

    /**
     * Copy with play counters advanced for one more round on court.
     */
    public Player withPlayed() {
        return toBuilder()
            .playCount(playCount + 1)
            .consecutivePlays(consecutivePlays + 1)
            .consecutiveSits(0)
            .build();
    }

    /**
     * Copy with sit counters advanced for one more round off court.
     */
    public Player withSat() {
        return toBuilder()
            .sitCount(sitCount + 1)
            .consecutiveSits(consecutiveSits + 1)
            .consecutivePlays(0)
            .build();
    }

    public static final class Builder {
        private final String id;
        private final String name;
        private double rating = DEFAULT_RATING;
        private double ratingDeviation = DEFAULT_DEVIATION;
        private int playCount;
        private int sitCount;
        private int consecutivePlays;
        private int consecutiveSits;
        private int totalPoints;
        private int wins;
        private int losses;
        private int ties;
        private int currentStreak;
        private int longestWinStreak;
        private PlayerStatus status = PlayerStatus.ACTIVE;
        private Gender gender = Gender.UNSPECIFIED;
        private String partnerId;
        private ImmutableSet<Integer> skipRounds = ImmutableSet.of();
        private int compensationPoints;

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        private Builder(Player p) {
            this.id = p.id;
            this.name = p.name;
            this.rating = p.rating;
            this.ratingDeviation = p.ratingDeviation;
            this.playCount = p.playCount;
            this.sitCount = p.sitCount;
            this.consecutivePlays = p.consecutivePlays;
            this.consecutiveSits = p.consecutiveSits;
            this.totalPoints = p.totalPoints;
            this.wins = p.wins;
            this.losses = p.losses;
            this.ties = p.ties;
            this.currentStreak = p.currentStreak;
            this.longestWinStreak = p.longestWinStreak;
            this.status = p.status;
            this.gender = p.gender;
            this.partnerId = p.partnerId;
            this.skipRounds = p.skipRounds;
            this.compensationPoints = p.compensationPoints;
        }

        public Builder rating(double rating) {
            this.rating = rating;
            return this;
        }

        public Builder ratingDeviation(double ratingDeviation) {
            this.ratingDeviation = ratingDeviation;
            return this;
        }

        public Builder playCount(int playCount) {
            this.playCount = playCount;
            return this;
        }

        public Builder sitCount(int sitCount) {
            this.sitCount = sitCount;
            return this;
        }

        public Builder consecutivePlays(int consecutivePlays) {
            this.consecutivePlays = consecutivePlays;
            return this;
        }

        public Builder consecutiveSits(int consecutiveSits) {
            this.consecutiveSits = consecutiveSits;
            return this;
        }

        public Builder totalPoints(int totalPoints) {
            this.totalPoints = totalPoints;
            return this;
        }

        public Builder wins(int wins) {
            this.wins = wins;
            return this;
        }

        public Builder losses(int losses) {
            this.losses = losses;
            return this;
        }

        public Builder ties(int ties) {
            this.ties = ties;
            return this;
        }

        public Builder currentStreak(int currentStreak) {
            this.currentStreak = currentStreak;
            return this;
        }

        public Builder longestWinStreak(int longestWinStreak) {
            this.longestWinStreak = longestWinStreak;
            return this;
        }

        public Builder status(PlayerStatus status) {
            this.status = status;
            return this;
        }

        public Builder gender(Gender gender) {
            this.gender = gender;
            return this;
        }

        public Builder partnerId(String partnerId) {
            this.partnerId = partnerId;
            return this;
        }

        public Builder skipRounds(Collection<Integer> skipRounds) {
            this.skipRounds = ImmutableSet.copyOf(skipRounds);
            return this;
        }

        public Builder compensationPoints(int compensationPoints) {
            this.compensationPoints = compensationPoints;
            return this;
        }

        public Player build() {
            return new Player(id, name, rating, ratingDeviation, playCount, sitCount,
                consecutivePlays, consecutiveSits, totalPoints, wins, losses, ties,
                currentStreak, longestWinStreak, status, gender, partnerId, skipRounds,
                compensationPoints);
        }
    }
}
