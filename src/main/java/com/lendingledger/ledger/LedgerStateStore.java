package com.lendingledger.ledger;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Owns the {@link LedgerState} and runs every ledger operation as one serialized transaction.
 *
 * <p>Writers hold the exclusive lock for the whole operation, so no two mutations interleave
 * and readers never observe a half-applied transition. Operations validate every precondition
 * (and evaluate every overflow-checked sum) before their first write; a thrown exception
 * therefore leaves the state exactly as it was.
 *
 * <p>The lock is fair so that a steady stream of reads (health checks, dashboards) cannot
 * starve a repayment or a liquidation.
 */
public class LedgerStateStore {

    private final LedgerState ledgerState;
    private final ReadWriteLock lock = new ReentrantReadWriteLock(true);

    public LedgerStateStore(LedgerState ledgerState) {
        this.ledgerState = ledgerState;
    }

    public <T> T read(Function<LedgerState, T> query) {
        lock.readLock().lock();
        try {
            return query.apply(ledgerState);
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(Function<LedgerState, T> transaction) {
        lock.writeLock().lock();
        try {
            return transaction.apply(ledgerState);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
