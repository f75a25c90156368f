package com.courtster.pairing.engine;

import com.courtster.pairing.gender.Composition;
import com.courtster.pairing.history.PairHistory;
import com.courtster.pairing.model.Degradation;
import com.courtster.pairing.model.EngineConfig;
import com.courtster.pairing.model.Gender;
import com.courtster.pairing.model.GenderPreference;
import com.courtster.pairing.model.Match;
import com.courtster.pairing.model.Player;
import com.courtster.pairing.model.Round;
import com.courtster.pairing.model.TournamentFormat;
import com.courtster.pairing.rating.RatingUpdater;
import com.courtster.pairing.strategy.GroupingContext;
import com.courtster.pairing.strategy.SkillClusteringStrategy;
import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class RoundEngineTest {

    // Construction

    @Test
    void constructor_rejectsFewerThan4Players() {
        assertThrows(ConfigurationException.class,
            () -> new RoundEngine(createPlayers(3), EngineConfig.of(1)));
    }

    @Test
    void constructor_acceptsExactly4Players() {
        RoundEngine engine = new RoundEngine(createPlayers(4), EngineConfig.of(1), new Random(1));

        assertEquals(4, engine.roster().size());
    }

    @Test
    void constructor_rejectsZeroCourts() {
        assertThrows(ConfigurationException.class,
            () -> new RoundEngine(createPlayers(8), EngineConfig.of(0)));
    }

    @Test
    void constructor_rejectsDuplicateIds() {
        List<Player> players = createPlayers(4);
        players.add(Player.of("player0", "Again", 5.0));

        assertThrows(ConfigurationException.class, () -> new RoundEngine(players, EngineConfig.of(1)));
    }

    // Whole rounds

    @Test
    void generateRound_fourPlayersOneMatch() {
        RoundEngine engine = new RoundEngine(createPlayers(4), EngineConfig.of(1), new Random(1));

        RoundOutcome outcome = engine.generateRound(1);

        assertEquals(1, outcome.round().matches().size());
        assertTrue(outcome.round().sittingPlayers().isEmpty());
        assertFalse(outcome.degraded());
    }

    @Test
    void generateRound_eightPlayersTwoCourtsNobodySits() {
        RoundEngine engine = new RoundEngine(createPlayers(8), EngineConfig.of(2), new Random(2));

        Round round = engine.generateRound(1).round();

        assertEquals(2, round.matches().size());
        assertEquals(List.of(1, 2), round.matches().stream().map(Match::court).toList());
        assertTrue(round.sittingPlayers().isEmpty());
    }

    @Test
    void generateRound_partitionsEligiblePlayers() {
        RoundEngine engine = new RoundEngine(createPlayers(11), EngineConfig.of(2), new Random(3));

        for (int r = 1; r <= 6; r++) {
            Round round = engine.generateRound(r).round();
            List<String> all = new ArrayList<>(round.participantIds());
            all.addAll(round.sittingIds());

            assertEquals(11, all.size(), "Every player appears once in round " + r);
            assertEquals(11, new HashSet<>(all).size(), "No player appears twice in round " + r);
            assertEquals(3, round.sittingPlayers().size());
        }
    }

    @Test
    void generateRound_playCountsStayWithinOne() {
        RoundEngine engine = new RoundEngine(createPlayers(10), EngineConfig.of(2), new Random(4));

        for (int r = 1; r <= 10; r++) {
            List<Player> roster = engine.generateRound(r).roster();
            int max = roster.stream().mapToInt(Player::playCount).max().orElseThrow();
            int min = roster.stream().mapToInt(Player::playCount).min().orElseThrow();
            assertTrue(max - min <= 1, "Play counts drifted apart in round " + r + ": " + min + ".." + max);
        }
    }

    @Test
    void generateRound_outcomeRosterReflectsCounters() {
        RoundEngine engine = new RoundEngine(createPlayers(5), EngineConfig.of(1), new Random(5));

        RoundOutcome outcome = engine.generateRound(1);

        String sitter = outcome.round().sittingIds().get(0);
        for (Player p : outcome.roster()) {
            if (p.id().equals(sitter)) {
                assertEquals(1, p.sitCount());
                assertEquals(0, p.playCount());
            } else {
                assertEquals(1, p.playCount());
                assertEquals(0, p.sitCount());
            }
        }
        assertEquals(outcome.roster(), engine.roster());
    }

    @Test
    void generateRound_skippingPlayerIsNeitherPlayingNorSitting() {
        List<Player> players = createPlayers(9);
        players.set(0, players.get(0).toBuilder().skipRounds(List.of(1)).build());
        RoundEngine engine = new RoundEngine(players, EngineConfig.of(2), new Random(6));

        RoundOutcome outcome = engine.generateRound(1);

        assertFalse(outcome.round().participantIds().contains("player0"));
        assertFalse(outcome.round().sittingIds().contains("player0"));
        assertEquals(0, engine.player("player0").sitCount());
        assertEquals(0, engine.player("player0").playCount());
        assertEquals(2, outcome.round().matches().size());
    }

    @Test
    void generateRound_tooFewForAllCourtsIsReported() {
        RoundEngine engine = new RoundEngine(createPlayers(6), EngineConfig.of(2), new Random(7));

        RoundOutcome outcome = engine.generateRound(1);

        assertEquals(1, outcome.round().matches().size());
        assertEquals(2, outcome.round().sittingPlayers().size());
        assertTrue(outcome.degradedBy(Degradation.Kind.INSUFFICIENT_PLAYERS));
    }

    @Test
    void generateRound_nobodyEligibleGivesEmptyRound() {
        List<Player> players = createPlayers(4);
        players.set(2, players.get(2).toBuilder().skipRounds(List.of(1)).build());
        RoundEngine engine = new RoundEngine(players, EngineConfig.of(1), new Random(8));

        RoundOutcome outcome = engine.generateRound(1);

        assertTrue(outcome.round().matches().isEmpty());
        assertEquals(3, outcome.round().sittingPlayers().size());
        assertTrue(outcome.degradedBy(Degradation.Kind.INSUFFICIENT_PLAYERS));
    }

    @Test
    void generateRound_rejectsRoundZero() {
        RoundEngine engine = new RoundEngine(createPlayers(4), EngineConfig.of(1));

        assertThrows(IllegalArgumentException.class, () -> engine.generateRound(0));
    }

    // Formats

    @Test
    void mexicano_strongestPlayersOnCourtOne() {
        List<Player> players = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            players.add(Player.of("p" + i, "P" + i, 1.0 + i));
        }
        RoundEngine engine = new RoundEngine(players, EngineConfig.of(2), new Random(9));

        Match court1 = engine.generateRound(1).round().matches().get(0);

        assertEquals(Set.of("p4", "p5", "p6", "p7"), Set.copyOf(court1.playerIds()));
    }

    @Test
    void mexicano_consecutiveRoundsChangePartners() {
        List<Player> players = List.of(
            Player.of("a", "A", 5.0), Player.of("b", "B", 4.5),
            Player.of("c", "C", 4.0), Player.of("d", "D", 3.5));
        RoundEngine engine = new RoundEngine(players, EngineConfig.of(1), new Random(10));

        Set<Set<String>> previous = teams(engine.generateRound(1).round());
        for (int r = 2; r <= 5; r++) {
            Set<Set<String>> current = teams(engine.generateRound(r).round());
            assertNotEquals(previous, current, "Round " + r + " repeated the previous partnerships");
            previous = current;
        }
    }

    @Test
    void americano_repeatsOpponentsLessThanRandomAssignment() {
        int seeds = 20;
        int engineTotal = 0;
        int randomTotal = 0;
        for (int seed = 1; seed <= seeds; seed++) {
            RoundEngine engine = new RoundEngine(createPlayers(12),
                EngineConfig.of(3, TournamentFormat.AMERICANO), new Random(seed));
            for (int r = 1; r <= 11; r++) {
                for (Match m : engine.generateRound(r).round().matches()) {
                    engine.recordResult(m.withScores(21, 15));
                }
            }
            engineTotal += engine.history().maxOpponentCount();
            randomTotal += randomAssignmentMaxOpponents(createPlayers(12), 11, new Random(seed));
        }

        assertTrue(engineTotal < randomTotal,
            "Americano should repeat opponents less than random groups: "
                + (double) engineTotal / seeds + " vs " + (double) randomTotal / seeds);
    }

    @Test
    void fixedPartner_teamsAreRegisteredPairs() {
        RoundEngine engine = new RoundEngine(createPartneredPlayers(5),
            EngineConfig.of(2, TournamentFormat.FIXED_PARTNER), new Random(12));

        for (int r = 1; r <= 5; r++) {
            RoundOutcome outcome = engine.generateRound(r);
            for (Match m : outcome.round().matches()) {
                assertEquals(m.team1().get(0).partnerId(), m.team1().get(1).id());
                assertEquals(m.team2().get(0).partnerId(), m.team2().get(1).id());
            }
            List<Player> sitting = outcome.round().sittingPlayers();
            assertEquals(2, sitting.size());
            assertEquals(sitting.get(0).partnerId(), sitting.get(1).id(), "Partners sit out together");
            assertFalse(outcome.degraded());
        }
    }

    @Test
    void fixedPartner_withoutPartnersFallsBack() {
        RoundEngine engine = new RoundEngine(createPlayers(8),
            EngineConfig.of(2, TournamentFormat.FIXED_PARTNER), new Random(13));

        RoundOutcome outcome = engine.generateRound(1);

        assertEquals(2, outcome.round().matches().size());
        assertTrue(outcome.degradedBy(Degradation.Kind.FIXED_PARTNER_FALLBACK));
    }

    @Test
    void mixedMexicano_everyTeamIsMixed() {
        RoundEngine engine = new RoundEngine(createGenderedPlayers(4, 4),
            EngineConfig.of(2, TournamentFormat.MIXED_MEXICANO), new Random(14));

        for (int r = 1; r <= 4; r++) {
            RoundOutcome outcome = engine.generateRound(r);
            for (Match m : outcome.round().matches()) {
                assertNotEquals(m.team1().get(0).gender(), m.team1().get(1).gender());
                assertNotEquals(m.team2().get(0).gender(), m.team2().get(1).gender());
            }
            assertFalse(outcome.degraded());
        }
    }

    @Test
    void mixedOnly_reportsFallbackWhenWomenRunOut() {
        RoundEngine engine = new RoundEngine(createGenderedPlayers(6, 2),
            new EngineConfig(2, TournamentFormat.MEXICANO, GenderPreference.MIXED_ONLY), new Random(15));

        RoundOutcome outcome = engine.generateRound(1);

        assertEquals(2, outcome.round().matches().size());
        assertTrue(outcome.degradedBy(Degradation.Kind.COMPOSITION_FALLBACK));
        Match court1 = outcome.round().matches().get(0);
        assertNotEquals(court1.team1().get(0).gender(), court1.team1().get(1).gender());
    }

    @Test
    void mixedOnly_withNoWomenPlaysMenOnlyMatches() {
        RoundEngine engine = new RoundEngine(createGenderedPlayers(8, 0),
            new EngineConfig(2, TournamentFormat.MEXICANO, GenderPreference.MIXED_ONLY), new Random(23));

        for (int r = 1; r <= 3; r++) {
            RoundOutcome outcome = engine.generateRound(r);

            assertEquals(2, outcome.round().matches().size());
            for (Match m : outcome.round().matches()) {
                assertTrue(m.players().stream().allMatch(p -> p.gender() == Gender.MALE));
            }
            assertTrue(outcome.degradedBy(Degradation.Kind.COMPOSITION_FALLBACK));
        }
    }

    @Test
    void mixedOnly_sitCountsStayWithinOneWhenOneGenderIsScarce() {
        for (int seed = 1; seed <= 30; seed++) {
            RoundEngine engine = new RoundEngine(createGenderedPlayers(7, 3),
                new EngineConfig(2, TournamentFormat.MEXICANO, GenderPreference.MIXED_ONLY), new Random(seed));

            for (int r = 1; r <= 10; r++) {
                List<Player> roster = engine.generateRound(r).roster();
                int max = roster.stream().mapToInt(Player::sitCount).max().orElseThrow();
                int min = roster.stream().mapToInt(Player::sitCount).min().orElseThrow();
                assertTrue(max - min <= 1,
                    "Seed " + seed + ", round " + r + ": sit counts " + min + ".." + max);
            }
        }
    }

    @Test
    void mexicanoRandomizedModes_strongerGroupsOnLowerCourts() {
        List<Player> players = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            players.add(Player.of("m" + i, "M" + i, 2.0 + i * 0.1, Gender.MALE));
            players.add(Player.of("f" + i, "F" + i, 8.0 + i * 0.1, Gender.FEMALE));
        }

        for (int seed = 1; seed <= 50; seed++) {
            RoundEngine engine = new RoundEngine(players,
                new EngineConfig(3, TournamentFormat.MEXICANO, GenderPreference.RANDOMIZED_MODES), new Random(seed));
            List<Match> matches = engine.generateRound(1).round().matches();

            for (int k = 0; k + 1 < matches.size(); k++) {
                assertTrue(averageRating(matches.get(k)) >= averageRating(matches.get(k + 1)) - 1e-9,
                    "Seed " + seed + ": court " + (k + 1) + " averages " + averageRating(matches.get(k))
                        + " but court " + (k + 2) + " averages " + averageRating(matches.get(k + 1)));
            }
        }
    }

    @Test
    void generateRound_passesPlanToStrategy() {
        SkillClusteringStrategy strategy = spy(new SkillClusteringStrategy());
        RoundEngine engine = new RoundEngine(createPlayers(9), EngineConfig.of(2), new Random(16),
            strategy, RatingUpdater.withDefaults());

        engine.generateRound(1);

        verify(strategy).group(argThat(players -> players.size() == 8),
            eq(List.of(Composition.ANY, Composition.ANY)), any(GroupingContext.class));
    }

    // Per-court

    @Test
    void generateRoundForCourt_courtsDrawDisjointPlayers() {
        RoundEngine engine = new RoundEngine(createPlayers(8), EngineConfig.of(2), new Random(17));

        RoundOutcome first = engine.generateRoundForCourt(1, 1, List.of());
        RoundOutcome second = engine.generateRoundForCourt(2, 1, first.round().participantIds());

        assertEquals(1, first.round().matches().get(0).court());
        assertEquals(2, second.round().matches().get(0).court());
        Set<String> overlap = new HashSet<>(first.round().participantIds());
        overlap.retainAll(second.round().participantIds());
        assertTrue(overlap.isEmpty(), "Players on two courts at once: " + overlap);
        for (Player p : engine.roster()) {
            assertEquals(1, p.playCount(), p.id());
            assertEquals(0, p.sitCount(), p.id());
        }
    }

    @Test
    void generateRoundForCourt_unpickedPlayersAreNotChargedASit() {
        RoundEngine engine = new RoundEngine(createPlayers(8), EngineConfig.of(2), new Random(18));

        RoundOutcome outcome = engine.generateRoundForCourt(1, 1, List.of());

        assertEquals(4, outcome.round().sittingPlayers().size());
        for (Player p : outcome.roster()) {
            assertEquals(0, p.sitCount(), p.id());
        }
    }

    @Test
    void generateRoundForCourt_playCountsStayWithinOneAcrossRounds() {
        RoundEngine engine = new RoundEngine(createPlayers(10), EngineConfig.of(2), new Random(24));

        for (int r = 1; r <= 12; r++) {
            RoundOutcome first = engine.generateRoundForCourt(1, r, List.of());
            RoundOutcome second = engine.generateRoundForCourt(2, r, first.round().participantIds());

            List<Player> roster = second.roster();
            int max = roster.stream().mapToInt(Player::playCount).max().orElseThrow();
            int min = roster.stream().mapToInt(Player::playCount).min().orElseThrow();
            assertTrue(max - min <= 1, "Play counts drifted apart in round " + r + ": " + min + ".." + max);
            assertTrue(roster.stream().allMatch(p -> p.sitCount() == 0), "Single-court calls charge no sits");
        }
    }

    @Test
    void generateRoundForCourt_tooFewEligibleGivesNoMatch() {
        RoundEngine engine = new RoundEngine(createPlayers(5), EngineConfig.of(2), new Random(19));

        RoundOutcome outcome = engine.generateRoundForCourt(2, 1, List.of("player0", "player1"));

        assertTrue(outcome.round().matches().isEmpty());
        assertTrue(outcome.degradedBy(Degradation.Kind.INSUFFICIENT_PLAYERS));
    }

    @Test
    void generateRoundForCourt_rejectsUnknownCourt() {
        RoundEngine engine = new RoundEngine(createPlayers(8), EngineConfig.of(2));

        assertThrows(IllegalArgumentException.class, () -> engine.generateRoundForCourt(3, 1, List.of()));
        assertThrows(IllegalArgumentException.class, () -> engine.generateRoundForCourt(0, 1, List.of()));
    }

    // Results

    @Test
    void recordResult_updatesRecordsAndHistory() {
        RoundEngine engine = new RoundEngine(createPlayers(4), EngineConfig.of(1), new Random(20));
        Match match = engine.generateRound(1).round().matches().get(0);

        List<Player> roster = engine.recordResult(match.withScores(21, 12));

        for (Player p : roster) {
            boolean team1 = match.team1Ids().contains(p.id());
            assertEquals(team1 ? 1 : 0, p.wins(), p.id());
            assertEquals(team1 ? 0 : 1, p.losses(), p.id());
            assertEquals(team1 ? 21 : 12, p.totalPoints(), p.id());
        }
        assertEquals(1, engine.history().partnerCount(match.team1Ids().get(0), match.team1Ids().get(1)));
        assertEquals(1, engine.history().opponentCount(match.team1Ids().get(0), match.team2Ids().get(0)));
    }

    @Test
    void recordResult_rejectsDuplicateAndUnscored() {
        RoundEngine engine = new RoundEngine(createPlayers(4), EngineConfig.of(1), new Random(21));
        Match match = engine.generateRound(1).round().matches().get(0);

        assertThrows(IllegalArgumentException.class, () -> engine.recordResult(match));
        engine.recordResult(match.withScores(21, 19));
        assertThrows(IllegalStateException.class, () -> engine.recordResult(match.withScores(21, 19)));
        assertEquals(1, engine.history().maxPartnerCount(), "History must count the match once");
    }

    @Test
    void restore_rebuildsHistoryFromScoredRounds() {
        EngineConfig config = EngineConfig.of(2);
        RoundEngine original = new RoundEngine(createPlayers(9), config, new Random(22));
        List<Round> rounds = new ArrayList<>();
        for (int r = 1; r <= 3; r++) {
            Round round = original.generateRound(r).round();
            List<Match> scored = new ArrayList<>();
            for (Match m : round.matches()) {
                Match done = m.withScores(21, 10 + r);
                original.recordResult(done);
                scored.add(done);
            }
            rounds.add(new Round(r, ImmutableList.copyOf(scored), round.sittingPlayers()));
        }

        RoundEngine restored = RoundEngine.restore(original.roster(), config, rounds);

        assertEquals(original.history().partnerCounts(), restored.history().partnerCounts());
        assertEquals(original.history().opponentCounts(), restored.history().opponentCounts());
        assertEquals(original.roster(), restored.roster(), "Player stats are taken as given");
    }

    private static double averageRating(Match match) {
        return match.players().stream().mapToDouble(Player::rating).average().orElse(0);
    }

    /**
     * Max times any pair opposed each other when groups of four are drawn at random.
     */
    private static int randomAssignmentMaxOpponents(List<Player> players, int rounds, Random random) {
        PairHistory history = new PairHistory();
        List<String> ids = new ArrayList<>(players.stream().map(Player::id).toList());
        for (int r = 0; r < rounds; r++) {
            Collections.shuffle(ids, random);
            for (int i = 0; i + 3 < ids.size(); i += 4) {
                history.recordMatch(ids.subList(i, i + 2), ids.subList(i + 2, i + 4));
            }
        }
        return history.maxOpponentCount();
    }

    private static Set<Set<String>> teams(Round round) {
        Set<Set<String>> teams = new HashSet<>();
        for (Match m : round.matches()) {
            teams.add(Set.copyOf(m.team1Ids()));
            teams.add(Set.copyOf(m.team2Ids()));
        }
        return teams;
    }

    private List<Player> createPlayers(int count) {
        List<Player> players = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            players.add(Player.of("player" + i, "Player" + i, 5.0));
        }
        return players;
    }

    private List<Player> createPartneredPlayers(int pairs) {
        List<Player> players = new ArrayList<>();
        for (int i = 0; i < pairs; i++) {
            players.add(Player.builder("p" + i + "a", "P" + i + "A").rating(3.0 + i).partnerId("p" + i + "b").build());
            players.add(Player.builder("p" + i + "b", "P" + i + "B").rating(3.0 + i).partnerId("p" + i + "a").build());
        }
        return players;
    }

    private List<Player> createGenderedPlayers(int men, int women) {
        List<Player> players = new ArrayList<>();
        for (int i = 0; i < men; i++) {
            players.add(Player.of("m" + i, "M" + i, 4.0 + i * 0.5, Gender.MALE));
        }
        for (int i = 0; i < women; i++) {
            players.add(Player.of("f" + i, "F" + i, 4.2 + i * 0.5, Gender.FEMALE));
        }
        return players;
    }
}
