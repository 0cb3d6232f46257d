package com.lendingledger.engine;

import com.lendingledger.domain.model.Position;
import java.math.BigInteger;

/**
 * Collateral-ratio, interest and liquidation math shared by the ledger operations.
 *
 * <p>All methods are pure. Divisions truncate toward zero, so rounding loss always
 * favours the protocol: the ratio is floored before scaling to a percentage, and
 * per-unit interest is floored before being multiplied by elapsed units.
 *
 * <p>Ratios and thresholds are percentages. A ratio of 150 means the collateral is
 * worth 1.5 times the debt at the quoted price.
 */
public class HealthEngine {

    public static final long DEFAULT_UNITS_PER_PERIOD = 144;

    private static final BigInteger PERCENT = BigInteger.valueOf(100);

    private final long unitsPerPeriod;

    public HealthEngine() {
        this(DEFAULT_UNITS_PER_PERIOD);
    }

    public HealthEngine(long unitsPerPeriod) {
        if (unitsPerPeriod <= 0) {
            throw new IllegalArgumentException("unitsPerPeriod must be positive: " + unitsPerPeriod);
        }
        this.unitsPerPeriod = unitsPerPeriod;
    }

    public long getUnitsPerPeriod() {
        return unitsPerPeriod;
    }

    /**
     * {@code floor(collateral * price / debt) * 100}.
     *
     * @throws IllegalArgumentException if debt is not positive; positions always carry debt
     */
    public long collateralRatio(long collateral, long debt, long price) {
        if (debt <= 0) {
            throw new IllegalArgumentException("debt must be positive: " + debt);
        }
        BigInteger ratio = BigInteger.valueOf(collateral)
                .multiply(BigInteger.valueOf(price))
                .divide(BigInteger.valueOf(debt))
                .multiply(PERCENT);
        // Saturates: a ratio past the long range is above any configurable threshold.
        return ratio.bitLength() < Long.SIZE ? ratio.longValue() : Long.MAX_VALUE;
    }

    /**
     * Admission rule for a new position: {@code collateral * price * 100 >= debt * minimumRatio}.
     * The comparison is non-strict, so a position exactly at the minimum is admitted.
     */
    public boolean meetsMinimumRatio(long collateral, long price, long debt, long minimumRatio) {
        long collateralValuePercent = LedgerMath.multiply(LedgerMath.multiply(collateral, price), 100);
        long requiredValuePercent = LedgerMath.multiply(debt, minimumRatio);
        return collateralValuePercent >= requiredValuePercent;
    }

    /**
     * Simple interest at one-unit resolution:
     * {@code floor(principal * rate / (100 * unitsPerPeriod)) * elapsedUnits}.
     */
    public long interestOwed(long principal, long rate, long elapsedUnits) {
        if (elapsedUnits < 0) {
            throw new IllegalArgumentException("elapsedUnits must not be negative: " + elapsedUnits);
        }
        long perUnit = LedgerMath.multiply(principal, rate) / LedgerMath.multiply(100, unitsPerPeriod);
        return LedgerMath.multiply(perUnit, elapsedUnits);
    }

    /** Principal plus interest accrued since the position's last accrual marker. */
    public long amountOwed(Position position, long currentHeight) {
        long elapsed = elapsedUnits(position, currentHeight);
        return LedgerMath.add(
                position.getDebtAmount(),
                interestOwed(position.getDebtAmount(), position.getInterestRate(), elapsed));
    }

    public long elapsedUnits(Position position, long currentHeight) {
        return Math.max(0, currentHeight - position.getLastAccrualAt());
    }

    /** Healthy means strictly above the threshold; a ratio equal to the threshold is liquidatable. */
    public boolean isHealthy(Position position, long price, long liquidationThreshold) {
        return collateralRatio(position.getCollateralAmount(), position.getDebtAmount(), price) > liquidationThreshold;
    }
}
