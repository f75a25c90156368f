package com.courtster.pairing.engine;

import com.courtster.pairing.gender.Composition;
import com.courtster.pairing.gender.CompositionResolver;
import com.courtster.pairing.history.PairHistory;
import com.courtster.pairing.model.Degradation;
import com.courtster.pairing.model.EngineConfig;
import com.courtster.pairing.model.Match;
import com.courtster.pairing.model.Player;
import com.courtster.pairing.model.Round;
import com.courtster.pairing.rating.MatchRecorder;
import com.courtster.pairing.rating.RatingUpdater;
import com.courtster.pairing.roster.Roster;
import com.courtster.pairing.selection.CandidateSelector;
import com.courtster.pairing.selection.Selection;
import com.courtster.pairing.strategy.GroupingContext;
import com.courtster.pairing.strategy.GroupingStrategies;
import com.courtster.pairing.strategy.GroupingStrategy;
import com.courtster.pairing.strategy.TeamPairing;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;

/**
 * Generates rounds of doubles matches and folds results back into the roster.
 *
 * <p>The engine copies the players it is given and owns them from then on. Every
 * generation call returns the round together with the updated roster and any fallbacks
 * taken; {@link #recordResult(Match)} returns the roster after the result is applied.
 *
 * <p>Two ways to schedule:
 * <ul>
 *   <li>{@link #generateRound(int)} fills every court at once</li>
 *   <li>{@link #generateRoundForCourt(int, int, Collection)} fills one court, so courts can
 *       progress independently. The caller passes the ids already on other courts in the same
 *       round; the engine keeps no memory of court occupancy between calls.</li>
 * </ul>
 *
 * <p>Not thread-safe: generation and result recording read and write the same counters.
 */
public class RoundEngine {

    static final int PLAYERS_PER_MATCH = 4;

    private final EngineConfig config;
    private final Roster roster;
    private final Random random;
    private final GroupingStrategy strategy;
    private final CandidateSelector selector;
    private final CompositionResolver resolver;
    private final MatchRecorder recorder;

    /**
     * @throws ConfigurationException with fewer than 4 players, duplicate ids or no courts
     */
    public RoundEngine(Collection<Player> players, EngineConfig config) {
        this(players, config, new Random());
    }

    public RoundEngine(Collection<Player> players, EngineConfig config, Random random) {
        this(players, config, random, GroupingStrategies.forFormat(config.format()), RatingUpdater.withDefaults());
    }

    RoundEngine(Collection<Player> players, EngineConfig config, Random random,
                GroupingStrategy strategy, RatingUpdater ratingUpdater) {
        if (players.size() < PLAYERS_PER_MATCH) {
            throw new ConfigurationException(
                "Need at least " + PLAYERS_PER_MATCH + " players for a doubles match, got " + players.size());
        }
        if (config.courts() < 1) {
            throw new ConfigurationException("Need at least one court, got " + config.courts());
        }
        try {
            this.roster = new Roster(players);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage());
        }
        this.config = config;
        this.random = random;
        this.strategy = strategy;
        this.selector = new CandidateSelector(roster, random);
        this.resolver = new CompositionResolver(strategy.effectivePreference(config.genderPreference()), random);
        this.recorder = new MatchRecorder(roster, ratingUpdater);
    }

    /**
     * Rebuilds an engine after a restart. Pair history is replayed from the completed
     * matches of {@code rounds}; player stats are taken as-is from {@code players}.
     */
    public static RoundEngine restore(Collection<Player> players, EngineConfig config, List<Round> rounds) {
        RoundEngine engine = new RoundEngine(players, config);
        engine.replay(rounds);
        return engine;
    }

    void replay(List<Round> rounds) {
        PairHistory history = roster.history();
        for (Round round : rounds) {
            for (Match match : round.matches()) {
                recorder.replay(match);
                history.recordScheduledTeam(match.team1Ids().get(0), match.team1Ids().get(1));
                history.recordScheduledTeam(match.team2Ids().get(0), match.team2Ids().get(1));
            }
        }
    }

    /**
     * Generates all matches of a round, court numbers assigned in order from 1.
     *
     * @param roundNumber round to generate, 1-based
     */
    public RoundOutcome generateRound(int roundNumber) {
        checkRoundNumber(roundNumber);
        List<Degradation> degradations = new ArrayList<>();

        ImmutableList<Player> eligible = selector.eligible(roundNumber, List.of());
        int matchCount = CandidateSelector.matchCount(eligible.size(), config.courts());
        if (matchCount < config.courts()) {
            degradations.add(new Degradation(Degradation.Kind.INSUFFICIENT_PLAYERS,
                String.format("Round %d: %d eligible players fill %d of %d courts",
                    roundNumber, eligible.size(), matchCount, config.courts())));
        }

        List<Composition> plan = resolver.plan(eligible, matchCount, degradations);
        Selection selection = selector.selectRound(roundNumber, eligible, matchCount,
            strategy::units, CompositionResolver.caps(plan));

        ImmutableList<Match> matches = matchCount == 0
            ? ImmutableList.of()
            : CourtAssigner.assignSequential(group(selection, plan, degradations));

        selector.applyRound(selection);
        rememberPartners(matches);
        Round round = new Round(roundNumber, matches, selection.sitting());
        return new RoundOutcome(round, roster.snapshot(), ImmutableList.copyOf(degradations));
    }

    /**
     * Generates one match for one court. Returns a round with no match when fewer than
     * four eligible players remain.
     *
     * @param court             court to fill
     * @param roundNumber       that court's round number
     * @param excludedPlayerIds players currently committed to other courts
     */
    public RoundOutcome generateRoundForCourt(int court, int roundNumber, Collection<String> excludedPlayerIds) {
        checkRoundNumber(roundNumber);
        if (court < 1 || court > config.courts()) {
            throw new IllegalArgumentException("Court must be between 1 and " + config.courts() + ", got " + court);
        }
        List<Degradation> degradations = new ArrayList<>();

        ImmutableList<Player> eligible = selector.eligible(roundNumber, excludedPlayerIds);
        if (eligible.size() < PLAYERS_PER_MATCH) {
            degradations.add(new Degradation(Degradation.Kind.INSUFFICIENT_PLAYERS,
                String.format("Court %d, round %d: only %d eligible players", court, roundNumber, eligible.size())));
        }

        int matchCount = CandidateSelector.matchCount(eligible.size(), 1);
        List<Composition> plan = resolver.plan(eligible, matchCount, degradations);
        Selection selection = selector.selectCourt(roundNumber, eligible,
            strategy::units, CompositionResolver.caps(plan));

        ImmutableList<Match> matches = matchCount == 0
            ? ImmutableList.of()
            : ImmutableList.of(CourtAssigner.assignCourt(court, group(selection, plan, degradations).get(0)));

        selector.applyCourt(selection);
        rememberPartners(matches);
        Round round = new Round(roundNumber, matches, selection.sitting());
        return new RoundOutcome(round, roster.snapshot(), ImmutableList.copyOf(degradations));
    }

    /**
     * Applies a scored match to ratings, records and pair history.
     *
     * @return roster after the update
     * @throws IllegalArgumentException if the match has no scores or names unknown players
     * @throws IllegalStateException    if the match was already recorded
     */
    public ImmutableList<Player> recordResult(Match match) {
        return recorder.record(match);
    }

    public ImmutableList<Player> roster() {
        return roster.snapshot();
    }

    public Player player(String id) {
        return roster.get(id);
    }

    /**
     * Live partner/opponent history. Read it, do not write to it.
     */
    public PairHistory history() {
        return roster.history();
    }

    public EngineConfig config() {
        return config;
    }

    private List<TeamPairing> group(Selection selection, List<Composition> plan, List<Degradation> degradations) {
        GroupingContext context = new GroupingContext(roster.history(), random, degradations);
        return strategy.group(selection.playing(), plan, context);
    }

    private void rememberPartners(List<Match> matches) {
        for (Match m : matches) {
            roster.history().recordScheduledTeam(m.team1().get(0).id(), m.team1().get(1).id());
            roster.history().recordScheduledTeam(m.team2().get(0).id(), m.team2().get(1).id());
        }
    }

    private static void checkRoundNumber(int roundNumber) {
        if (roundNumber < 1) {
            throw new IllegalArgumentException("Round numbers start at 1, got " + roundNumber);
        }
    }
}
