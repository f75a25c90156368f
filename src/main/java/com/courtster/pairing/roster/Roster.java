package com.courtster.pairing.roster;

import com.courtster.pairing.history.PairHistory;
import com.courtster.pairing.model.Player;
import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Authoritative player collection plus pair history, owned by one engine.
 * Players keep their insertion order; updates replace a player with a new copy.
 */
public class Roster {
    private final Map<String, Player> players = new LinkedHashMap<>();
    private final PairHistory history;

    /**
     * @throws IllegalArgumentException if two players share an id
     */
    public Roster(Collection<Player> initialPlayers, PairHistory history) {
        for (Player p : initialPlayers) {
            if (players.putIfAbsent(p.id(), p) != null) {
                throw new IllegalArgumentException("Duplicate player id: " + p.id());
            }
        }
        this.history = history;
    }

    public Roster(Collection<Player> initialPlayers) {
        this(initialPlayers, new PairHistory());
    }

    public PairHistory history() {
        return history;
    }

    public int size() {
        return players.size();
    }

    /**
     * @throws IllegalArgumentException if the id is not on the roster
     */
    public Player get(String id) {
        Player p = players.get(id);
        if (p == null) {
            throw new IllegalArgumentException("Unknown player: " + id);
        }
        return p;
    }

    /**
     * Replaces a player with the result of {@code change}. The id must not change.
     */
    public Player update(String id, UnaryOperator<Player> change) {
        Player updated = change.apply(get(id));
        if (!updated.id().equals(id)) {
            throw new IllegalStateException("Player id changed from " + id + " to " + updated.id());
        }
        players.put(id, updated);
        return updated;
    }

    /**
     * @return immutable snapshot in roster order
     */
    public ImmutableList<Player> snapshot() {
        return ImmutableList.copyOf(players.values());
    }
}
