package com.lendingledger.domain.model;

import com.lendingledger.domain.enums.PositionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A collateral/debt pair owned by one borrower.
 *
 * <p>Positions are never deleted: once {@link PositionStatus#REPAID} or
 * {@link PositionStatus#LIQUIDATED} they stay in the ledger for audit. {@code debtAmount}
 * is the principal issued at origination and is never reduced, because only full
 * settlement is supported.
 *
 * <p>{@code openedAt}, {@code lastAccrualAt} and {@code closedAt} are logical clock
 * heights, not wall-clock times.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private long id;

    /** External identity of the account that opened the position. */
    private String borrower;

    private long collateralAmount;
    private long debtAmount;

    /** Captured at origination; immutable afterwards. */
    private long interestRate;

    private long openedAt;
    private long lastAccrualAt;

    /** Height of the repay/liquidation transition. Null while active. */
    private Long closedAt;

    private PositionStatus status;

    /** Starts at 1 on issuance and increases with every status transition. */
    private long revision;

    public boolean isActive() {
        return status == PositionStatus.ACTIVE;
    }

    public Position snapshot() {
        return toBuilder().build();
    }
}
