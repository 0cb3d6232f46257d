package com.lendingledger.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Protocol-wide aggregates at a single clock height.
 */
@Value
@Builder
public class LedgerStats {

    /** Sum of collateral over ACTIVE positions. */
    long totalCollateralLocked;

    /** Sum of all custody-confirmed deposits. */
    long totalCollateralDeposited;

    long totalPositionsIssued;
    long activePositionCount;
    long currentHeight;
}
