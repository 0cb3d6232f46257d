package com.lendingledger.clock;

/**
 * External logical clock. Heights only move forward and the ledger never advances them itself.
 */
public interface LedgerClock {

    long currentHeight();
}
