package com.tournamenttables.allocation;

/**
 * Raised when greedy generation is asked to seat more pairings than there are free tables.
 * This is a caller contract violation, not a soft conflict.
 */
public class InsufficientTablesException extends RuntimeException {

    private final int roundNumber;
    private final int pairingsRemaining;
    private final int tablesRemaining;

    public InsufficientTablesException(int roundNumber, int pairingsRemaining, int tablesRemaining) {
        super("Round " + roundNumber + " has " + pairingsRemaining
                + " pairing(s) left to seat but only " + tablesRemaining + " free table(s)");
        this.roundNumber = roundNumber;
        this.pairingsRemaining = pairingsRemaining;
        this.tablesRemaining = tablesRemaining;
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public int getPairingsRemaining() {
        return pairingsRemaining;
    }

    public int getTablesRemaining() {
        return tablesRemaining;
    }
}
