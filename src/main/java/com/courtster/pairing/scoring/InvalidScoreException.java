package com.courtster.pairing.scoring;

/**
 * A score pair that the tournament's scoring rule does not allow.
 */
public class InvalidScoreException extends Exception {

    private final ScoringRule rule;

    public InvalidScoreException(ScoringRule rule, String message) {
        super(message);
        this.rule = rule;
    }

    public ScoringRule getRule() {
        return rule;
    }
}
