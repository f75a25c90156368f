package com.courtster.pairing.strategy;

import com.courtster.pairing.history.PairHistory;
import com.courtster.pairing.model.Degradation;

import java.util.List;
import java.util.Random;

/**
 * What a strategy may read while grouping, plus a sink for fallbacks it had to take.
 */
public class GroupingContext {
    private final PairHistory history;
    private final Random random;
    private final List<Degradation> degradations;

    public GroupingContext(PairHistory history, Random random, List<Degradation> degradations) {
        this.history = history;
        this.random = random;
        this.degradations = degradations;
    }

    public PairHistory history() {
        return history;
    }

    public Random random() {
        return random;
    }

    public List<Degradation> degradations() {
        return degradations;
    }

    public void report(Degradation.Kind kind, String detail) {
        degradations.add(new Degradation(kind, detail));
    }
}
