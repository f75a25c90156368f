package com.courtster.pairing.history;

/**
 * Unordered pair of player ids in canonical order, so {@code of(a, b).equals(of(b, a))}.
 */
public record PairKey(String first, String second) {

    public PairKey {
        if (first.compareTo(second) > 0) {
            throw new IllegalArgumentException("PairKey ids must be in canonical order, use PairKey.of");
        }
    }

    public static PairKey of(String a, String b) {
        if (a.equals(b)) {
            throw new IllegalArgumentException("A player cannot pair with themselves: " + a);
        }
        return a.compareTo(b) < 0 ? new PairKey(a, b) : new PairKey(b, a);
    }

    public boolean contains(String playerId) {
        return first.equals(playerId) || second.equals(playerId);
    }
}
