package com.lendingledger.ledger;

import com.lendingledger.clock.LedgerClock;
import com.lendingledger.config.LedgerProperties;
import com.lendingledger.domain.enums.LiquidationIndexPolicy;
import com.lendingledger.domain.enums.PositionStatus;
import com.lendingledger.domain.model.LiquidationCheckResult;
import com.lendingledger.domain.model.Position;
import com.lendingledger.domain.model.PositionHealth;
import com.lendingledger.engine.HealthEngine;
import com.lendingledger.engine.LedgerMath;
import com.lendingledger.event.EventPublisherHelper;
import com.lendingledger.exception.ErrorCode;
import com.lendingledger.exception.LedgerException;
import com.lendingledger.exception.UnauthorizedException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The position state machine: loan issuance, repayment and health-triggered liquidation.
 *
 * <p>Transitions: {@code ACTIVE -> REPAID} (borrower settles principal plus interest) and
 * {@code ACTIVE -> LIQUIDATED} (ratio at or below the liquidation threshold). Both targets
 * are terminal.
 *
 * <p>Every public operation runs as a single {@link LedgerStateStore#write} transaction:
 * all preconditions and overflow-checked sums are evaluated first, then the position, the
 * borrower index and the aggregates are updated together. Events are published after the
 * transaction returns, carrying a snapshot of the position.
 *
 * <p>{@code totalCollateralLocked} follows the position lifecycle: it grows by the
 * position's collateral on issuance and shrinks by the same amount on repayment or
 * liquidation, so it always equals the collateral held by ACTIVE positions.
 */
@Service
public class PositionLedgerService {

    private static final Logger log = LoggerFactory.getLogger(PositionLedgerService.class);

    private final LedgerStateStore ledgerStateStore;
    private final HealthEngine healthEngine;
    private final LedgerClock ledgerClock;
    private final LedgerProperties ledgerProperties;
    private final EventPublisherHelper eventPublisherHelper;

    public PositionLedgerService(
            LedgerStateStore ledgerStateStore,
            HealthEngine healthEngine,
            LedgerClock ledgerClock,
            LedgerProperties ledgerProperties,
            EventPublisherHelper eventPublisherHelper) {
        this.ledgerStateStore = ledgerStateStore;
        this.healthEngine = healthEngine;
        this.ledgerClock = ledgerClock;
        this.ledgerProperties = ledgerProperties;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // ISSUANCE
    // ========================

    /**
     * Opens a new position for the caller.
     *
     * <p>Admission requires {@code collateral * price * 100 >= debt * minimumRatio} at the
     * current collateral-asset quote, and room in the caller's active index.
     *
     * @return snapshot of the new ACTIVE position
     */
    public Position requestLoan(String caller, long collateralAmount, long debtAmount) {
        String borrower = LedgerState.requireCaller(caller);

        Position opened = ledgerStateStore.write(state -> {
            state.requireInitialized();
            if (collateralAmount <= 0 || debtAmount <= 0) {
                throw new LedgerException(
                        ErrorCode.INVALID_AMOUNT,
                        "Collateral and debt must both be positive",
                        Map.of("collateralAmount", collateralAmount, "debtAmount", debtAmount));
            }
            if (debtAmount < ledgerProperties.getMinDebtAmount()) {
                throw new LedgerException(
                        ErrorCode.BELOW_MINIMUM,
                        "Debt " + debtAmount + " is below the minimum loan size " + ledgerProperties.getMinDebtAmount());
            }

            long price = state.requirePrice(collateralAsset(state));
            long minimumRatio = state.getRiskParameters().getMinimumCollateralRatio();
            if (!healthEngine.meetsMinimumRatio(collateralAmount, price, debtAmount, minimumRatio)) {
                throw new LedgerException(
                        ErrorCode.INSUFFICIENT_COLLATERAL,
                        "Collateral value does not cover " + minimumRatio + "% of the requested debt",
                        Map.of(
                                "collateralAmount", collateralAmount,
                                "price", price,
                                "debtAmount", debtAmount,
                                "minimumCollateralRatio", minimumRatio));
            }

            int activeCount = state.getUserPositionIds(borrower).size();
            if (activeCount >= ledgerProperties.getMaxActivePositionsPerUser()) {
                throw new LedgerException(
                        ErrorCode.INVALID_AMOUNT,
                        "Borrower already holds the maximum of " + ledgerProperties.getMaxActivePositionsPerUser()
                                + " active positions",
                        Map.of("borrower", borrower, "activePositions", activeCount));
            }

            long id = state.nextPositionId();
            long newLocked = LedgerMath.add(state.getTotalCollateralLocked(), collateralAmount);
            long newIssued = LedgerMath.add(state.getTotalPositionsIssued(), 1);
            long height = ledgerClock.currentHeight();

            Position position = Position.builder()
                    .id(id)
                    .borrower(borrower)
                    .collateralAmount(collateralAmount)
                    .debtAmount(debtAmount)
                    .interestRate(ledgerProperties.getDefaultInterestRate())
                    .openedAt(height)
                    .lastAccrualAt(height)
                    .status(PositionStatus.ACTIVE)
                    .revision(1)
                    .build();

            state.insertPosition(position);
            state.appendToUserIndex(borrower, id);
            state.setTotalCollateralLocked(newLocked);
            state.setTotalPositionsIssued(newIssued);
            return position.snapshot();
        });

        log.info(
                "Position {} opened for {}: collateral={}, debt={}, rate={}",
                opened.getId(),
                borrower,
                opened.getCollateralAmount(),
                opened.getDebtAmount(),
                opened.getInterestRate());
        eventPublisherHelper.publishPositionOpened(this, opened);
        return opened;
    }

    // ========================
    // SETTLEMENT
    // ========================

    /**
     * Settles an ACTIVE position in full. {@code amount} must cover principal plus the
     * interest accrued since the position's last accrual marker; any excess is not tracked.
     *
     * @return snapshot of the REPAID position
     */
    public Position repay(String caller, long positionId, long amount) {
        String borrower = LedgerState.requireCaller(caller);

        Position repaid = ledgerStateStore.write(state -> {
            state.requireInitialized();
            Position position = state.requirePosition(positionId);
            requireActive(position);
            if (!position.getBorrower().equals(borrower)) {
                throw UnauthorizedException.notBorrower(borrower, positionId);
            }

            long height = ledgerClock.currentHeight();
            long owed = healthEngine.amountOwed(position, height);
            if (amount < owed) {
                throw new LedgerException(
                        ErrorCode.INVALID_AMOUNT,
                        "Repayment of " + amount + " does not cover the " + owed + " owed",
                        Map.of("amount", amount, "amountOwed", owed));
            }
            long newLocked = LedgerMath.subtract(state.getTotalCollateralLocked(), position.getCollateralAmount());

            position.setStatus(PositionStatus.REPAID);
            position.setRevision(position.getRevision() + 1);
            position.setLastAccrualAt(height);
            position.setClosedAt(height);
            state.setTotalCollateralLocked(newLocked);
            state.removeFromUserIndex(borrower, positionId, LiquidationIndexPolicy.REMOVE_POSITION);
            return position.snapshot();
        });

        log.info("Position {} repaid by {} at height {}", positionId, borrower, repaid.getClosedAt());
        eventPublisherHelper.publishPositionRepaid(this, repaid);
        return repaid;
    }

    // ========================
    // LIQUIDATION
    // ========================

    /**
     * Evaluates the position against the liquidation threshold and liquidates it when the
     * ratio is at or below the threshold. Healthy positions are left untouched. Checking a
     * position that is already LIQUIDATED is a no-op, so the call is idempotent.
     *
     * @throws LedgerException LOAN_NOT_ACTIVE if the position was repaid
     */
    public LiquidationCheckResult checkLiquidation(long positionId) {
        return evaluateLiquidation(positionId, false);
    }

    /**
     * Strict variant for keepers: liquidates or fails. A healthy position is rejected with
     * INVALID_LIQUIDATION and a terminal one with LOAN_NOT_ACTIVE.
     */
    public LiquidationCheckResult liquidate(long positionId) {
        return evaluateLiquidation(positionId, true);
    }

    private LiquidationCheckResult evaluateLiquidation(long positionId, boolean strict) {
        LiquidationOutcome outcome = ledgerStateStore.write(state -> {
            state.requireInitialized();
            Position position = state.requirePosition(positionId);

            if (position.getStatus() == PositionStatus.LIQUIDATED && !strict) {
                return new LiquidationOutcome(
                        LiquidationCheckResult.builder()
                                .positionId(positionId)
                                .status(PositionStatus.LIQUIDATED)
                                .liquidated(false)
                                .build(),
                        null);
            }
            requireActive(position);

            long price = state.requirePrice(collateralAsset(state));
            long threshold = state.getRiskParameters().getLiquidationThreshold();
            long ratio = healthEngine.collateralRatio(
                    position.getCollateralAmount(), position.getDebtAmount(), price);

            if (ratio > threshold) {
                if (strict) {
                    throw new LedgerException(
                            ErrorCode.INVALID_LIQUIDATION,
                            "Position " + positionId + " is healthy",
                            Map.of("collateralRatio", ratio, "liquidationThreshold", threshold));
                }
                return new LiquidationOutcome(
                        LiquidationCheckResult.builder()
                                .positionId(positionId)
                                .status(PositionStatus.ACTIVE)
                                .collateralRatio(ratio)
                                .liquidationThreshold(threshold)
                                .liquidated(false)
                                .build(),
                        null);
            }

            long newLocked = LedgerMath.subtract(state.getTotalCollateralLocked(), position.getCollateralAmount());
            position.setStatus(PositionStatus.LIQUIDATED);
            position.setRevision(position.getRevision() + 1);
            position.setClosedAt(ledgerClock.currentHeight());
            state.setTotalCollateralLocked(newLocked);
            state.removeFromUserIndex(
                    position.getBorrower(), positionId, ledgerProperties.getLiquidationIndexPolicy());

            return new LiquidationOutcome(
                    LiquidationCheckResult.builder()
                            .positionId(positionId)
                            .status(PositionStatus.LIQUIDATED)
                            .collateralRatio(ratio)
                            .liquidationThreshold(threshold)
                            .liquidated(true)
                            .build(),
                    position.snapshot());
        });

        if (outcome.liquidatedPosition() != null) {
            LiquidationCheckResult result = outcome.result();
            log.warn(
                    "Position {} liquidated: ratio {} <= threshold {}",
                    positionId,
                    result.getCollateralRatio(),
                    result.getLiquidationThreshold());
            eventPublisherHelper.publishPositionLiquidated(this, outcome.liquidatedPosition());
        }
        return outcome.result();
    }

    // ========================
    // QUERIES
    // ========================

    public Position getPosition(long positionId) {
        return ledgerStateStore.read(state -> state.requirePosition(positionId).snapshot());
    }

    /** Ids of the user's indexed active positions, in issuance order. Empty for unknown users. */
    public List<Long> getUserPositions(String user) {
        return ledgerStateStore.read(state -> state.getUserPositionIds(user));
    }

    public List<Long> getActivePositionIds() {
        return ledgerStateStore.read(state -> state.getActivePositions().stream()
                .map(Position::getId)
                .toList());
    }

    /** Principal plus interest accrued up to the current clock height. */
    public long getAmountOwed(long positionId) {
        return ledgerStateStore.read(state -> {
            Position position = state.requirePosition(positionId);
            requireActive(position);
            return healthEngine.amountOwed(position, ledgerClock.currentHeight());
        });
    }

    /** Non-mutating health projection of an ACTIVE position. */
    public PositionHealth getHealth(long positionId) {
        return ledgerStateStore.read(state -> {
            Position position = state.requirePosition(positionId);
            requireActive(position);
            long price = state.requirePrice(collateralAsset(state));
            long threshold = state.getRiskParameters().getLiquidationThreshold();
            long ratio = healthEngine.collateralRatio(
                    position.getCollateralAmount(), position.getDebtAmount(), price);
            long height = ledgerClock.currentHeight();
            long elapsed = healthEngine.elapsedUnits(position, height);
            long interest = healthEngine.interestOwed(position.getDebtAmount(), position.getInterestRate(), elapsed);
            return PositionHealth.builder()
                    .positionId(positionId)
                    .collateralRatio(ratio)
                    .liquidationThreshold(threshold)
                    .healthy(ratio > threshold)
                    .elapsedUnits(elapsed)
                    .interestOwed(interest)
                    .amountOwed(LedgerMath.add(position.getDebtAmount(), interest))
                    .build();
        });
    }

    private void requireActive(Position position) {
        if (!position.isActive()) {
            throw new LedgerException(
                    ErrorCode.LOAN_NOT_ACTIVE,
                    "Position " + position.getId() + " is " + position.getStatus(),
                    Map.of("status", position.getStatus().name()));
        }
    }

    private String collateralAsset(LedgerState state) {
        return state.requireRecognizedAsset(ledgerProperties.getCollateralAsset());
    }

    private record LiquidationOutcome(LiquidationCheckResult result, Position liquidatedPosition) {}
}
