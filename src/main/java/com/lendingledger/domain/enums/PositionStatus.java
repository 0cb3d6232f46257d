package com.lendingledger.domain.enums;

/**
 * Lifecycle of a lending position. {@link #REPAID} and {@link #LIQUIDATED} are terminal.
 */
public enum PositionStatus {
    ACTIVE,
    REPAID,
    LIQUIDATED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
