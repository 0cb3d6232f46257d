package com.lendingledger.clock;

import com.lendingledger.exception.ErrorCode;
import com.lendingledger.exception.LedgerException;
import com.lendingledger.ledger.LedgerStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for the chain-progress feed. Only the administrator identity may advance time.
 */
@Service
public class ClockService {

    private static final Logger log = LoggerFactory.getLogger(ClockService.class);

    private final ManualLedgerClock ledgerClock;
    private final LedgerStateStore ledgerStateStore;

    public ClockService(ManualLedgerClock ledgerClock, LedgerStateStore ledgerStateStore) {
        this.ledgerClock = ledgerClock;
        this.ledgerStateStore = ledgerStateStore;
    }

    public long currentHeight() {
        return ledgerClock.currentHeight();
    }

    public long advance(String caller, long units) {
        ledgerStateStore.read(state -> {
            state.requireAdministrator(caller);
            return null;
        });
        if (units <= 0) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "Clock can only advance by a positive amount: " + units);
        }
        long height;
        try {
            height = ledgerClock.advance(units);
        } catch (ArithmeticException e) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "Clock height overflow", e);
        }
        log.debug("Clock advanced by {} to height {}", units, height);
        return height;
    }
}
