package com.courtster.pairing.selection;

import com.courtster.pairing.model.Gender;
import com.courtster.pairing.model.Player;
import com.courtster.pairing.roster.Roster;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Decides who is eligible for a round and who of them plays or sits.
 *
 * <p>Key fairness rules:
 * <ul>
 *   <li>Whole rounds rest the players who have sat least, preferring those on the longest
 *       run of consecutive plays, so sit counts stay within one of each other. Gender caps
 *       give way when honouring them would make someone sit twice ahead of another player</li>
 *   <li>Single-court calls pick the players who have played least, preferring those who
 *       have sat longest, and only charge plays (a player not picked may still go to
 *       another court in the same round)</li>
 *   <li>Remaining ties are broken randomly</li>
 * </ul>
 *
 * <p>Players are grouped into units before picking. Units are taken whole when the open
 * seats allow it, so fixed partners play or sit together.
 */
public class CandidateSelector {

    // Most deserving of a seat first.
    private static final Comparator<List<Player>> ROUND_PRIORITY =
        Comparator.comparingDouble(average(Player::sitCount)).reversed()
            .thenComparingDouble(average(Player::consecutivePlays))
            .thenComparingDouble(average(Player::playCount));

    private static final Comparator<List<Player>> COURT_PRIORITY =
        Comparator.comparingDouble(average(Player::playCount))
            .thenComparing(Comparator.comparingDouble(average(Player::consecutiveSits)).reversed())
            .thenComparing(Comparator.comparingDouble(average(Player::sitCount)).reversed());

    private final Roster roster;
    private final Random random;

    public CandidateSelector(Roster roster, Random random) {
        this.roster = roster;
        this.random = random;
    }

    /**
     * All roster players minus those skipping this round minus the excluded ids, in roster order.
     */
    public ImmutableList<Player> eligible(int roundNumber, Collection<String> excludedIds) {
        Set<String> excluded = new HashSet<>(excludedIds);
        return roster.snapshot().stream()
            .filter(p -> !p.skips(roundNumber))
            .filter(p -> !excluded.contains(p.id()))
            .collect(ImmutableList.toImmutableList());
    }

    /**
     * Matches that can be filled: {@code min(requestedCourts, floor(eligible / 4))}.
     */
    public static int matchCount(int eligibleCount, int requestedCourts) {
        return Math.max(0, Math.min(requestedCourts, eligibleCount / 4));
    }

    /**
     * Picks the players for a whole round, everybody else sits.
     *
     * @param roundNumber round being generated
     * @param eligible    eligible pool
     * @param matchCount  matches to fill
     * @param units       splits the pool into units that should play or sit together
     * @param caps        gender limits for the playing set, relaxed when seats would stay empty
     */
    public Selection selectRound(int roundNumber, List<Player> eligible, int matchCount,
                                 Function<List<Player>, List<List<Player>>> units, GenderCaps caps) {
        return select(roundNumber, eligible, matchCount, units, caps, ROUND_PRIORITY, true);
    }

    /**
     * Picks four players for a single court.
     */
    public Selection selectCourt(int roundNumber, List<Player> eligible,
                                 Function<List<Player>, List<List<Player>>> units, GenderCaps caps) {
        return select(roundNumber, eligible, matchCount(eligible.size(), 1), units, caps, COURT_PRIORITY, false);
    }

    /**
     * Advances counters after a whole round: players on court play, the rest of the pool sits.
     */
    public void applyRound(Selection selection) {
        Set<String> playing = ids(selection.playing());
        for (Player p : selection.eligible()) {
            if (playing.contains(p.id())) {
                roster.update(p.id(), Player::withPlayed);
            } else {
                roster.update(p.id(), Player::withSat);
            }
        }
    }

    /**
     * Advances play counters of a single court's players only.
     */
    public void applyCourt(Selection selection) {
        for (Player p : selection.playing()) {
            roster.update(p.id(), Player::withPlayed);
        }
    }

    private Selection select(int roundNumber, List<Player> eligible, int matchCount,
                             Function<List<Player>, List<List<Player>>> units, GenderCaps caps,
                             Comparator<List<Player>> priority, boolean chargesSits) {
        List<List<Player>> ordered = new ArrayList<>(units.apply(eligible));
        Collections.shuffle(ordered, random);
        ordered.sort(priority);

        // A player already one sit ahead of the least-rested must not sit again
        int fewestSits = eligible.stream().mapToInt(Player::sitCount).min().orElse(0);
        Predicate<List<Player>> overdue = unit -> chargesSits
            && unit.stream().anyMatch(p -> p.sitCount() > fewestSits);

        List<Player> playing = pick(ordered, matchCount * 4, caps, overdue);
        Set<String> playingIds = ids(playing);
        ImmutableList<Player> sitting = eligible.stream()
            .filter(p -> !playingIds.contains(p.id()))
            .collect(ImmutableList.toImmutableList());

        return new Selection(roundNumber, ImmutableList.copyOf(eligible),
            ImmutableList.copyOf(playing), sitting, matchCount);
    }

    private static List<Player> pick(List<List<Player>> ordered, int seats, GenderCaps caps,
                                     Predicate<List<Player>> overdue) {
        List<Player> picked = new ArrayList<>();
        Set<String> pickedIds = new HashSet<>();

        // Sit fairness outranks the caps; the grouping reports the composition it loses
        for (List<Player> unit : ordered) {
            if (overdue.test(unit) && picked.size() + unit.size() <= seats) {
                for (Player p : unit) {
                    picked.add(p);
                    pickedIds.add(p.id());
                }
            }
        }

        // Whole units within the caps
        for (List<Player> unit : ordered) {
            if (!pickedIds.contains(unit.get(0).id())
                    && picked.size() + unit.size() <= seats && unitFits(unit, picked, caps)) {
                for (Player p : unit) {
                    picked.add(p);
                    pickedIds.add(p.id());
                }
            }
        }

        // Split units when seats remain
        for (List<Player> unit : ordered) {
            for (Player p : unit) {
                if (picked.size() < seats && !pickedIds.contains(p.id())
                        && caps.admits(p, GenderCaps.count(picked, Gender.MALE), GenderCaps.count(picked, Gender.FEMALE))) {
                    picked.add(p);
                    pickedIds.add(p.id());
                }
            }
        }

        // Caps are a preference, never leave a seat empty
        for (List<Player> unit : ordered) {
            for (Player p : unit) {
                if (picked.size() < seats && !pickedIds.contains(p.id())) {
                    picked.add(p);
                    pickedIds.add(p.id());
                }
            }
        }
        return picked;
    }

    private static boolean unitFits(List<Player> unit, List<Player> picked, GenderCaps caps) {
        int males = GenderCaps.count(picked, Gender.MALE) + GenderCaps.count(unit, Gender.MALE);
        int females = GenderCaps.count(picked, Gender.FEMALE) + GenderCaps.count(unit, Gender.FEMALE);
        return males <= caps.male() && females <= caps.female();
    }

    private static Set<String> ids(Collection<Player> players) {
        Set<String> ids = new HashSet<>();
        for (Player p : players) {
            ids.add(p.id());
        }
        return ids;
    }

    private static ToDoubleFunction<List<Player>> average(ToDoubleFunction<Player> field) {
        return unit -> unit.stream().mapToDouble(field).average().orElse(0);
    }
}
