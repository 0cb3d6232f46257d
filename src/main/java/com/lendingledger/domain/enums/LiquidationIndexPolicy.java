package com.lendingledger.domain.enums;

/**
 * What a liquidation does to the borrower's active-position index.
 */
public enum LiquidationIndexPolicy {

    /** Remove only the liquidated position id; the borrower's other active ids stay indexed. */
    REMOVE_POSITION,

    /**
     * Clear the borrower's whole index entry. Compatible with the original ledger, but drops
     * bookkeeping for the borrower's other still-active positions.
     */
    CLEAR_ALL
}
