package com.courtster.pairing.history;

import com.google.common.collect.ImmutableMap;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Partner and opponent counters for one engine's lifetime.
 *
 * <p>Counts are keyed by canonical {@link PairKey} in flat maps and are incremented
 * once per recorded match. Separately, the most recent scheduled partner of each
 * player is remembered at generation time so that back-to-back repeat partnerships
 * can be avoided before any result has been entered.
 */
public class PairHistory {
    private final Map<PairKey, Integer> partnerCounts = new HashMap<>();
    private final Map<PairKey, Integer> opponentCounts = new HashMap<>();
    private final Map<String, String> lastPartners = new HashMap<>();

    public int partnerCount(String a, String b) {
        return partnerCounts.getOrDefault(PairKey.of(a, b), 0);
    }

    public int opponentCount(String a, String b) {
        return opponentCounts.getOrDefault(PairKey.of(a, b), 0);
    }

    /**
     * Counts one completed match: each team's pair as partners, every cross-team pair as opponents.
     *
     * @param team1 ids of the first team
     * @param team2 ids of the second team
     */
    public void recordMatch(List<String> team1, List<String> team2) {
        partnerCounts.merge(PairKey.of(team1.get(0), team1.get(1)), 1, Integer::sum);
        partnerCounts.merge(PairKey.of(team2.get(0), team2.get(1)), 1, Integer::sum);
        for (String a : team1) {
            for (String b : team2) {
                opponentCounts.merge(PairKey.of(a, b), 1, Integer::sum);
            }
        }
    }

    /**
     * Remembers a freshly scheduled team as each member's latest partner.
     */
    public void recordScheduledTeam(String a, String b) {
        lastPartners.put(a, b);
        lastPartners.put(b, a);
    }

    /**
     * Whether {@code a} and {@code b} were each other's most recent scheduled partner.
     */
    public boolean wereLastPartners(String a, String b) {
        return b.equals(lastPartners.get(a)) && a.equals(lastPartners.get(b));
    }

    public int maxOpponentCount() {
        return opponentCounts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    public int maxPartnerCount() {
        return partnerCounts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    /**
     * @return immutable snapshot of partner counts
     */
    public Map<PairKey, Integer> partnerCounts() {
        return ImmutableMap.copyOf(partnerCounts);
    }

    /**
     * @return immutable snapshot of opponent counts
     */
    public Map<PairKey, Integer> opponentCounts() {
        return ImmutableMap.copyOf(opponentCounts);
    }
}
