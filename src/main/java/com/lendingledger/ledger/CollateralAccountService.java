package com.lendingledger.ledger;

import com.lendingledger.clock.LedgerClock;
import com.lendingledger.domain.model.LedgerStats;
import com.lendingledger.engine.LedgerMath;
import com.lendingledger.exception.ErrorCode;
import com.lendingledger.exception.LedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Collateral deposits and the protocol-wide aggregates.
 *
 * <p>A deposit records that the custody bridge has already moved the collateral in; the
 * ledger does not verify the transfer. Deposits feed {@code totalCollateralDeposited} and
 * the depositor's balance. {@code totalCollateralLocked} is owned by the position lifecycle
 * in {@link PositionLedgerService} and only read here.
 */
@Service
public class CollateralAccountService {

    private static final Logger log = LoggerFactory.getLogger(CollateralAccountService.class);

    private final LedgerStateStore ledgerStateStore;
    private final LedgerClock ledgerClock;

    public CollateralAccountService(LedgerStateStore ledgerStateStore, LedgerClock ledgerClock) {
        this.ledgerStateStore = ledgerStateStore;
        this.ledgerClock = ledgerClock;
    }

    /**
     * Records a custody-confirmed deposit for the caller.
     *
     * @return the caller's deposited balance after this deposit
     */
    public long depositCollateral(String caller, long amount) {
        String depositor = LedgerState.requireCaller(caller);

        long balance = ledgerStateStore.write(state -> {
            state.requireInitialized();
            if (amount <= 0) {
                throw new LedgerException(ErrorCode.INVALID_AMOUNT, "Deposit amount must be positive: " + amount);
            }
            long newBalance = LedgerMath.add(state.getCollateralBalance(depositor), amount);
            long newTotal = LedgerMath.add(state.getTotalCollateralDeposited(), amount);

            state.setCollateralBalance(depositor, newBalance);
            state.setTotalCollateralDeposited(newTotal);
            return newBalance;
        });

        log.info("Collateral deposit of {} recorded for {} (balance {})", amount, depositor, balance);
        return balance;
    }

    public long getCollateralBalance(String user) {
        return ledgerStateStore.read(state -> state.getCollateralBalance(user));
    }

    public LedgerStats getStats() {
        return ledgerStateStore.read(state -> LedgerStats.builder()
                .totalCollateralLocked(state.getTotalCollateralLocked())
                .totalCollateralDeposited(state.getTotalCollateralDeposited())
                .totalPositionsIssued(state.getTotalPositionsIssued())
                .activePositionCount(state.getActivePositions().size())
                .currentHeight(ledgerClock.currentHeight())
                .build());
    }
}
