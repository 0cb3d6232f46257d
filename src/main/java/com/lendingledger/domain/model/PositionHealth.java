package com.lendingledger.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only health projection of an active position at the current clock height.
 */
@Value
@Builder
public class PositionHealth {

    long positionId;
    long collateralRatio;
    long liquidationThreshold;
    boolean healthy;
    long elapsedUnits;
    long interestOwed;
    long amountOwed;
}
