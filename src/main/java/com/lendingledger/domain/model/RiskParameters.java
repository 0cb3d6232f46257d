package com.lendingledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Global risk parameters. Ratios are percentages (150 = collateral must be worth 1.5x the debt).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RiskParameters {

    private long minimumCollateralRatio;
    private long liquidationThreshold;
    private long feeRate;

    /** Read-side flag; false until the administrator has run initialize. */
    private boolean initialized;
}
