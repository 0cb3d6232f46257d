package com.lendingledger.domain.model;

import com.lendingledger.domain.enums.PositionStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a liquidation check. {@code liquidated} is true only when this call performed
 * the transition; checking an already-liquidated position reports false with status
 * LIQUIDATED and no ratio.
 */
@Value
@Builder
public class LiquidationCheckResult {

    long positionId;
    PositionStatus status;
    Long collateralRatio;
    Long liquidationThreshold;
    boolean liquidated;
}
