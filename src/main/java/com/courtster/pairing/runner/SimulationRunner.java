package com.courtster.pairing.runner;

import com.courtster.pairing.engine.RoundEngine;
import com.courtster.pairing.engine.RoundOutcome;
import com.courtster.pairing.model.Degradation;
import com.courtster.pairing.model.Gender;
import com.courtster.pairing.model.GenderPreference;
import com.courtster.pairing.model.Match;
import com.courtster.pairing.model.Player;
import com.courtster.pairing.model.Round;
import com.courtster.pairing.model.TournamentFormat;
import com.courtster.pairing.scoring.InvalidScoreException;
import com.courtster.pairing.scoring.ScoreValidator;
import com.courtster.pairing.scoring.ScoringRule;
import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Main entry point for the pairing simulation CLI. Runs a whole tournament with
 * random results, so formats and gender settings can be tried out offline.
 *
 * <p>Invocation:
 * <pre>
 * java -jar courtster-pairing.jar \
 *   --name club-night --rounds 7 --courts 2 \
 *   --format mexicano --scoring points:21 \
 *   --output ./data \
 *   --player Alice=6.5:female \
 *   --player Bob=5.0:male \
 *   --player Carol=4.2:female \
 *   --player Dan=3.8
 * </pre>
 */
public class SimulationRunner {

    public static void main(String[] args) {
        SimulationConfig config;
        try {
            config = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            System.exit(1);
            return;
        }
        Path outputDir = parseOutputDir(args).resolve(config.name());

        try {
            runSimulation(config, outputDir);
        } catch (Exception e) {
            System.err.println("Simulation failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Plays every round: generate, score at random, record, write.
     *
     * @return final standings
     */
    static List<Player> runSimulation(SimulationConfig config, Path outputDir)
            throws IOException, InvalidScoreException {
        Random random = config.seed() == null ? new Random() : new Random(config.seed());
        RoundEngine engine = new RoundEngine(config.players(), config.engineConfig(), random);

        RoundFileWriter writer = new RoundFileWriter(outputDir);
        int stale = writer.clearRounds();
        if (stale > 0) {
            System.out.printf("Removed %d round files from an earlier run%n", stale);
        }
        writer.writeTournamentMetadata(config);

        for (int round = 1; round <= config.rounds(); round++) {
            System.out.printf("Starting round %d/%d%n", round, config.rounds());
            RoundOutcome outcome = engine.generateRound(round);
            for (Degradation d : outcome.degradations()) {
                System.out.printf("  Note: %s%n", d.detail());
            }

            List<Match> scored = new ArrayList<>();
            for (Match match : outcome.round().matches()) {
                int[] score = simulateScore(config.scoring(), match, random);
                ScoreValidator.validate(config.scoring(), score[0], score[1]);
                Match completed = match.withScores(score[0], score[1]);
                engine.recordResult(completed);
                scored.add(completed);
                System.out.printf("  Court %d: %s & %s %d-%d %s & %s%n", completed.court(),
                    completed.team1().get(0).name(), completed.team1().get(1).name(),
                    score[0], score[1],
                    completed.team2().get(0).name(), completed.team2().get(1).name());
            }

            Round played = new Round(round, ImmutableList.copyOf(scored), outcome.round().sittingPlayers());
            writer.writeRound(new RoundOutcome(played, engine.roster(), outcome.degradations()));
            System.out.printf("Round %d complete (%d matches, %d sitting)%n",
                round, scored.size(), played.sittingPlayers().size());
        }

        List<Player> standings = standings(engine.roster());
        writer.writeStandings(standings);
        System.out.printf("Simulation complete! Results written to %s%n", outputDir);
        for (int i = 0; i < standings.size(); i++) {
            Player p = standings.get(i);
            System.out.printf("  %2d. %-20s %d-%d-%d  %4d pts  rating %.2f%n",
                i + 1, p.name(), p.wins(), p.losses(), p.ties(), p.totalPoints(), p.rating());
        }
        return standings;
    }

    /**
     * Most wins first, then most points, then name.
     */
    static List<Player> standings(List<Player> roster) {
        List<Player> sorted = new ArrayList<>(roster);
        sorted.sort(Comparator.comparingInt(Player::wins).reversed()
            .thenComparing(Comparator.comparingInt(Player::totalPoints).reversed())
            .thenComparing(Player::name));
        return sorted;
    }

    /**
     * Random legal score for a match. The stronger team is more likely to win each
     * point or game, by a logistic curve over the team rating difference.
     */
    static int[] simulateScore(ScoringRule rule, Match match, Random random) {
        double team1 = match.team1().stream().mapToDouble(Player::rating).average().orElse(0);
        double team2 = match.team2().stream().mapToDouble(Player::rating).average().orElse(0);
        double pTeam1 = 1.0 / (1.0 + Math.exp(team2 - team1));

        return switch (rule.mode()) {
            case POINTS, TOTAL_GAMES -> {
                int s1 = 0;
                for (int i = 0; i < rule.target(); i++) {
                    if (random.nextDouble() < pTeam1) {
                        s1++;
                    }
                }
                yield new int[] {s1, rule.target() - s1};
            }
            case FIRST_TO -> {
                int loser = random.nextInt(rule.target());
                yield random.nextDouble() < pTeam1
                    ? new int[] {rule.target(), loser}
                    : new int[] {loser, rule.target()};
            }
        };
    }

    /**
     * Parses CLI arguments into a SimulationConfig.
     *
     * @throws IllegalArgumentException if required arguments are missing or malformed
     */
    static SimulationConfig parseArgs(String[] args) {
        String name = null;
        Integer rounds = null;
        int courts = 1;
        TournamentFormat format = TournamentFormat.MEXICANO;
        GenderPreference gender = GenderPreference.ANY;
        ScoringRule scoring = ScoringRule.points(21);
        Long seed = null;
        Map<String, Player> players = new LinkedHashMap<>();
        List<String[]> partners = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--name" -> name = value(args, ++i);
                case "--rounds" -> rounds = Integer.parseInt(value(args, ++i));
                case "--courts" -> courts = Integer.parseInt(value(args, ++i));
                case "--format" -> format = TournamentFormat.parse(value(args, ++i));
                case "--gender" -> gender = GenderPreference.parse(value(args, ++i));
                case "--scoring" -> scoring = ScoringRule.parse(value(args, ++i));
                case "--seed" -> seed = Long.parseLong(value(args, ++i));
                case "--output" -> i++; // consumed but stored separately
                case "--player" -> {
                    Player p = parsePlayer(value(args, ++i));
                    if (players.putIfAbsent(p.id(), p) != null) {
                        throw new IllegalArgumentException("Duplicate player: " + p.name());
                    }
                }
                case "--partner" -> {
                    String spec = value(args, ++i);
                    int eq = spec.indexOf('=');
                    if (eq < 0) {
                        throw new IllegalArgumentException("Invalid partner spec: " + spec);
                    }
                    partners.add(new String[] {spec.substring(0, eq).toLowerCase(), spec.substring(eq + 1).toLowerCase()});
                }
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        if (name == null || rounds == null) {
            throw new IllegalArgumentException("Missing required arguments: --name, --rounds");
        }
        if (rounds < 1 || courts < 1) {
            throw new IllegalArgumentException("--rounds and --courts must be at least 1");
        }
        if (players.size() < 4) {
            throw new IllegalArgumentException("Need at least 4 players for doubles");
        }

        for (String[] pair : partners) {
            if (!players.containsKey(pair[0]) || !players.containsKey(pair[1])) {
                throw new IllegalArgumentException("Partner names must match players: " + pair[0] + "=" + pair[1]);
            }
            players.computeIfPresent(pair[0], (id, p) -> p.toBuilder().partnerId(pair[1]).build());
            players.computeIfPresent(pair[1], (id, p) -> p.toBuilder().partnerId(pair[0]).build());
        }

        return new SimulationConfig(name, rounds, courts, format, gender, scoring,
            List.copyOf(players.values()), seed);
    }

    /**
     * Parses {@code Name=rating[:male|female]}. The id is the lowercased name.
     */
    static Player parsePlayer(String spec) {
        int eq = spec.indexOf('=');
        if (eq <= 0) {
            throw new IllegalArgumentException("Invalid player spec: " + spec);
        }
        String playerName = spec.substring(0, eq);
        String rest = spec.substring(eq + 1);
        Gender gender = Gender.UNSPECIFIED;
        int colon = rest.indexOf(':');
        if (colon >= 0) {
            gender = switch (rest.substring(colon + 1).trim().toLowerCase()) {
                case "male", "m" -> Gender.MALE;
                case "female", "f" -> Gender.FEMALE;
                default -> throw new IllegalArgumentException("Invalid gender in player spec: " + spec);
            };
            rest = rest.substring(0, colon);
        }
        double rating;
        try {
            rating = Double.parseDouble(rest.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid rating in player spec: " + spec, e);
        }
        return Player.of(playerName.toLowerCase(), playerName, rating, gender);
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[i - 1]);
        }
        return args[i];
    }

    private static Path parseOutputDir(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--output".equals(args[i])) {
                return Path.of(args[i + 1]);
            }
        }
        return Path.of("./data");
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar courtster-pairing.jar [options]");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --name <name>                   Tournament name (required)");
        System.err.println("  --rounds <n>                    Number of rounds to play (required)");
        System.err.println("  --courts <n>                    Courts available per round (default: 1)");
        System.err.println("  --format <format>               mexicano, americano, fixed_partner, mixed_mexicano (default: mexicano)");
        System.err.println("  --gender <preference>           any, mixed_only, randomized_modes (default: any)");
        System.err.println("  --scoring <mode:target[:winBy]> points:21, first_to:6, first_to:15:2, total_games:8 (default: points:21)");
        System.err.println("  --output <dir>                  Output directory (default: ./data)");
        System.err.println("  --player <Name>=<rating>[:g]    Add a player, g is male or female (at least 4 required)");
        System.err.println("  --partner <Name>=<Name>         Register fixed partners");
        System.err.println("  --seed <n>                      Random seed for a repeatable run");
        System.err.println();
        System.err.println("Example:");
        System.err.println("  java -jar courtster-pairing.jar \\");
        System.err.println("    --name test --rounds 5 --courts 2 --format americano \\");
        System.err.println("    --player Alice=6:female --player Bob=5:male \\");
        System.err.println("    --player Carol=4.5:female --player Dan=4:male \\");
        System.err.println("    --player Eve=3.5 --player Frank=3 --player Gina=5.5 --player Hal=4.2");
    }
}
