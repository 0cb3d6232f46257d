package com.lendingledger.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock advanced explicitly by the chain-progress feed (or by tests).
 */
public class ManualLedgerClock implements LedgerClock {

    private final AtomicLong height;

    public ManualLedgerClock() {
        this(0);
    }

    public ManualLedgerClock(long startHeight) {
        if (startHeight < 0) {
            throw new IllegalArgumentException("startHeight must not be negative: " + startHeight);
        }
        this.height = new AtomicLong(startHeight);
    }

    @Override
    public long currentHeight() {
        return height.get();
    }

    /**
     * Moves the clock forward and returns the new height.
     *
     * @throws IllegalArgumentException if units is not positive
     */
    public long advance(long units) {
        if (units <= 0) {
            throw new IllegalArgumentException("units must be positive: " + units);
        }
        return height.updateAndGet(current -> Math.addExact(current, units));
    }
}
