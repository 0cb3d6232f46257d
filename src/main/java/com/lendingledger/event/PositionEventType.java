package com.lendingledger.event;

/**
 * Classifies the lifecycle transition that triggered a {@link PositionEvent}.
 */
public enum PositionEventType {

    /** A loan was issued and the position entered ACTIVE. */
    OPENED,

    /** The borrower settled principal plus interest. */
    REPAID,

    /** A health check found the position at or below the liquidation threshold. */
    LIQUIDATED
}
