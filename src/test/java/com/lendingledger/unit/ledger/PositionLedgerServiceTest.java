package com.lendingledger.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.lendingledger.clock.ManualLedgerClock;
import com.lendingledger.config.LedgerProperties;
import com.lendingledger.domain.enums.LiquidationIndexPolicy;
import com.lendingledger.domain.enums.PositionStatus;
import com.lendingledger.domain.model.LiquidationCheckResult;
import com.lendingledger.domain.model.Position;
import com.lendingledger.domain.model.PositionHealth;
import com.lendingledger.domain.model.RiskParameters;
import com.lendingledger.engine.HealthEngine;
import com.lendingledger.event.EventPublisherHelper;
import com.lendingledger.exception.BaseException;
import com.lendingledger.exception.ErrorCode;
import com.lendingledger.ledger.CollateralAccountService;
import com.lendingledger.ledger.LedgerState;
import com.lendingledger.ledger.LedgerStateStore;
import com.lendingledger.ledger.PositionLedgerService;
import com.lendingledger.oracle.OracleFeedService;
import com.lendingledger.risk.RiskParameterPersistenceService;
import com.lendingledger.risk.RiskParameterService;
import java.util.List;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for PositionLedgerService covering admission control, repayment with accrued
 * interest, liquidation boundaries and idempotence, the bounded borrower index, id
 * monotonicity and aggregate consistency.
 */
@ExtendWith(MockitoExtension.class)
class PositionLedgerServiceTest {

    private static final String ADMIN = "admin";
    private static final String ALICE = "alice";
    private static final String BOB = "bob";

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private RiskParameterPersistenceService riskParameterPersistenceService;

    private LedgerProperties ledgerProperties;
    private ManualLedgerClock ledgerClock;
    private LedgerStateStore ledgerStateStore;
    private RiskParameterService riskParameterService;
    private OracleFeedService oracleFeedService;
    private CollateralAccountService collateralAccountService;
    private PositionLedgerService positionLedgerService;

    @BeforeEach
    void setUp() {
        ledgerProperties = new LedgerProperties();
        ledgerClock = new ManualLedgerClock();
        buildServices();
    }

    private void buildServices() {
        ledgerStateStore = new LedgerStateStore(new LedgerState(
                ADMIN,
                List.of("BTC", "STX"),
                RiskParameters.builder()
                        .minimumCollateralRatio(150)
                        .liquidationThreshold(120)
                        .feeRate(1)
                        .build()));
        riskParameterService =
                new RiskParameterService(ledgerStateStore, ledgerProperties, riskParameterPersistenceService);
        oracleFeedService = new OracleFeedService(ledgerStateStore, ledgerProperties);
        collateralAccountService = new CollateralAccountService(ledgerStateStore, ledgerClock);
        positionLedgerService = new PositionLedgerService(
                ledgerStateStore, new HealthEngine(), ledgerClock, ledgerProperties, eventPublisherHelper);
    }

    private void initializeWithBtcPrice(long price) {
        riskParameterService.initialize(ADMIN);
        oracleFeedService.setPrice(ADMIN, "BTC", price);
    }

    private static void assertRejected(ThrowingCallable call, ErrorCode expected) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(BaseException.class, e -> assertThat(e.getErrorCode())
                        .isEqualTo(expected));
    }

    private long sumOfActiveCollateral() {
        long sum = 0;
        for (long id = 1; id <= collateralAccountService.getStats().getTotalPositionsIssued(); id++) {
            Position position = positionLedgerService.getPosition(id);
            if (position.isActive()) {
                sum += position.getCollateralAmount();
            }
        }
        return sum;
    }

    // ==============================
    // ISSUANCE
    // ==============================

    @Nested
    @DisplayName("Loan Issuance")
    class Issuance {

        @Test
        @DisplayName("Request before initialize fails with NOT_INITIALIZED")
        void beforeInitialize_rejected() {
            assertRejected(() -> positionLedgerService.requestLoan(ALICE, 10, 300_000), ErrorCode.NOT_INITIALIZED);
        }

        @Test
        @DisplayName("Request without a collateral price fails with NOT_INITIALIZED")
        void withoutPrice_rejected() {
            riskParameterService.initialize(ADMIN);

            assertRejected(() -> positionLedgerService.requestLoan(ALICE, 10, 300_000), ErrorCode.NOT_INITIALIZED);
        }

        @Test
        @DisplayName("Worked example: 10 BTC at 50000 backs a 300000 loan at 150%")
        void workedExample_opensFirstPosition() {
            initializeWithBtcPrice(50_000);
            ledgerClock.advance(7);

            Position position = positionLedgerService.requestLoan(ALICE, 10, 300_000);

            assertThat(position.getId()).isEqualTo(1L);
            assertThat(position.getBorrower()).isEqualTo(ALICE);
            assertThat(position.getStatus()).isEqualTo(PositionStatus.ACTIVE);
            assertThat(position.getInterestRate()).isEqualTo(5L);
            assertThat(position.getOpenedAt()).isEqualTo(7L);
            assertThat(position.getLastAccrualAt()).isEqualTo(7L);
            assertThat(position.getClosedAt()).isNull();
            assertThat(position.getRevision()).isEqualTo(1L);
            assertThat(positionLedgerService.getUserPositions(ALICE)).containsExactly(1L);
            assertThat(collateralAccountService.getStats().getTotalPositionsIssued()).isEqualTo(1L);
            assertThat(collateralAccountService.getStats().getTotalCollateralLocked()).isEqualTo(10L);
            verify(eventPublisherHelper).publishPositionOpened(any(), eq(position));
        }

        @Test
        @DisplayName("Collateral exactly at the minimum ratio is admitted")
        void exactlyAtMinimum_admitted() {
            initializeWithBtcPrice(50_000);

            // 3 * 50000 * 100 == 100000 * 150
            Position position = positionLedgerService.requestLoan(ALICE, 3, 100_000);

            assertThat(position.getStatus()).isEqualTo(PositionStatus.ACTIVE);
        }

        @Test
        @DisplayName("One unit of debt above the minimum ratio is rejected with INSUFFICIENT_COLLATERAL")
        void justBelowMinimum_rejected() {
            initializeWithBtcPrice(50_000);

            assertRejected(
                    () -> positionLedgerService.requestLoan(ALICE, 3, 100_001), ErrorCode.INSUFFICIENT_COLLATERAL);
        }

        @Test
        @DisplayName("Rejected request leaves no trace in ledger state")
        void rejectedRequest_noPartialWrite() {
            initializeWithBtcPrice(50_000);

            assertRejected(
                    () -> positionLedgerService.requestLoan(ALICE, 1, 1_000_000), ErrorCode.INSUFFICIENT_COLLATERAL);

            assertThat(positionLedgerService.getUserPositions(ALICE)).isEmpty();
            assertThat(collateralAccountService.getStats().getTotalPositionsIssued()).isZero();
            assertThat(collateralAccountService.getStats().getTotalCollateralLocked()).isZero();
            assertThat(positionLedgerService.requestLoan(ALICE, 10, 1_000).getId()).isEqualTo(1L);
            verify(eventPublisherHelper, times(1)).publishPositionOpened(any(), any());
        }

        @Test
        @DisplayName("Zero collateral or zero debt is rejected with INVALID_AMOUNT")
        void zeroAmounts_rejected() {
            initializeWithBtcPrice(50_000);

            assertRejected(() -> positionLedgerService.requestLoan(ALICE, 0, 1_000), ErrorCode.INVALID_AMOUNT);
            assertRejected(() -> positionLedgerService.requestLoan(ALICE, 10, 0), ErrorCode.INVALID_AMOUNT);
        }

        @Test
        @DisplayName("Debt below the configured minimum loan size is rejected with BELOW_MINIMUM")
        void belowMinimumLoanSize_rejected() {
            ledgerProperties.setMinDebtAmount(500);
            initializeWithBtcPrice(50_000);

            assertRejected(() -> positionLedgerService.requestLoan(ALICE, 10, 499), ErrorCode.BELOW_MINIMUM);
            assertThat(positionLedgerService.requestLoan(ALICE, 10, 500).getDebtAmount()).isEqualTo(500L);
        }

        @Test
        @DisplayName("Overflowing collateral value is rejected with INVALID_AMOUNT and nothing is written")
        void overflow_rejected() {
            initializeWithBtcPrice(1_000_000_000_000L);

            assertRejected(
                    () -> positionLedgerService.requestLoan(ALICE, Long.MAX_VALUE / 2, 1_000), ErrorCode.INVALID_AMOUNT);
            assertThat(collateralAccountService.getStats().getTotalPositionsIssued()).isZero();
        }

        @Test
        @DisplayName("Blank caller is rejected with UNAUTHORIZED")
        void blankCaller_rejected() {
            initializeWithBtcPrice(50_000);

            assertRejected(() -> positionLedgerService.requestLoan(" ", 10, 1_000), ErrorCode.UNAUTHORIZED);
        }

        @Test
        @DisplayName("Position ids are strictly increasing and never reused")
        void idsMonotonic() {
            initializeWithBtcPrice(50_000);

            long first = positionLedgerService.requestLoan(ALICE, 10, 1_000).getId();
            long second = positionLedgerService.requestLoan(BOB, 10, 1_000).getId();
            positionLedgerService.repay(ALICE, first, 1_000);
            long third = positionLedgerService.requestLoan(ALICE, 10, 1_000).getId();

            assertThat(List.of(first, second, third)).containsExactly(1L, 2L, 3L);
        }
    }

    // ==============================
    // BORROWER INDEX
    // ==============================

    @Nested
    @DisplayName("Bounded Borrower Index")
    class BorrowerIndex {

        @Test
        @DisplayName("Eleventh concurrently active position is rejected; closing one frees a slot")
        void eleventhPosition_rejectedUntilOneCloses() {
            initializeWithBtcPrice(50_000);
            for (int i = 0; i < 10; i++) {
                positionLedgerService.requestLoan(ALICE, 10, 1_000);
            }

            assertRejected(() -> positionLedgerService.requestLoan(ALICE, 10, 1_000), ErrorCode.INVALID_AMOUNT);
            assertThat(positionLedgerService.getUserPositions(ALICE)).hasSize(10);

            positionLedgerService.repay(ALICE, 4, 1_000);
            Position reopened = positionLedgerService.requestLoan(ALICE, 10, 1_000);

            assertThat(reopened.getId()).isEqualTo(11L);
            assertThat(positionLedgerService.getUserPositions(ALICE))
                    .containsExactly(1L, 2L, 3L, 5L, 6L, 7L, 8L, 9L, 10L, 11L);
        }

        @Test
        @DisplayName("Index capacity is per borrower")
        void capacityIsPerBorrower() {
            initializeWithBtcPrice(50_000);
            for (int i = 0; i < 10; i++) {
                positionLedgerService.requestLoan(ALICE, 10, 1_000);
            }

            assertThat(positionLedgerService.requestLoan(BOB, 10, 1_000).getBorrower()).isEqualTo(BOB);
        }

        @Test
        @DisplayName("Unknown user has an empty index")
        void unknownUser_empty() {
            assertThat(positionLedgerService.getUserPositions("nobody")).isEmpty();
        }
    }

    // ==============================
    // REPAYMENT
    // ==============================

    @Nested
    @DisplayName("Repayment")
    class Repayment {

        @Test
        @DisplayName("Repaying principal plus accrued interest settles the position")
        void exactAmount_repaid() {
            initializeWithBtcPrice(50_000);
            Position opened = positionLedgerService.requestLoan(ALICE, 10, 300_000);
            ledgerClock.advance(10);

            // floor(300000 * 5 / 14400) = 104 per unit, 10 units
            long owed = 300_000 + 1_040;
            assertThat(positionLedgerService.getAmountOwed(opened.getId())).isEqualTo(owed);

            Position repaid = positionLedgerService.repay(ALICE, opened.getId(), owed);

            assertThat(repaid.getStatus()).isEqualTo(PositionStatus.REPAID);
            assertThat(repaid.getLastAccrualAt()).isEqualTo(10L);
            assertThat(repaid.getClosedAt()).isEqualTo(10L);
            assertThat(repaid.getRevision()).isEqualTo(2L);
            assertThat(positionLedgerService.getUserPositions(ALICE)).isEmpty();
            assertThat(collateralAccountService.getStats().getTotalCollateralLocked()).isZero();
            verify(eventPublisherHelper).publishPositionRepaid(any(), eq(repaid));
        }

        @Test
        @DisplayName("One unit short of principal plus interest is rejected with INVALID_AMOUNT")
        void oneUnitShort_rejected() {
            initializeWithBtcPrice(50_000);
            Position opened = positionLedgerService.requestLoan(ALICE, 10, 300_000);
            ledgerClock.advance(10);

            assertRejected(
                    () -> positionLedgerService.repay(ALICE, opened.getId(), 301_039), ErrorCode.INVALID_AMOUNT);
            assertThat(positionLedgerService.getPosition(opened.getId()).getStatus())
                    .isEqualTo(PositionStatus.ACTIVE);
            verify(eventPublisherHelper, never()).publishPositionRepaid(any(), any());
        }

        @Test
        @DisplayName("Overpayment is accepted")
        void overpayment_accepted() {
            initializeWithBtcPrice(50_000);
            Position opened = positionLedgerService.requestLoan(ALICE, 10, 300_000);

            assertThat(positionLedgerService.repay(ALICE, opened.getId(), 400_000).getStatus())
                    .isEqualTo(PositionStatus.REPAID);
        }

        @Test
        @DisplayName("Only the borrower may repay")
        void otherCaller_unauthorized() {
            initializeWithBtcPrice(50_000);
            Position opened = positionLedgerService.requestLoan(ALICE, 10, 300_000);

            assertRejected(() -> positionLedgerService.repay(BOB, opened.getId(), 400_000), ErrorCode.UNAUTHORIZED);
        }

        @Test
        @DisplayName("Repaying a settled position fails with LOAN_NOT_ACTIVE")
        void repayTwice_notActive() {
            initializeWithBtcPrice(50_000);
            Position opened = positionLedgerService.requestLoan(ALICE, 10, 300_000);
            positionLedgerService.repay(ALICE, opened.getId(), 300_000);

            assertRejected(
                    () -> positionLedgerService.repay(ALICE, opened.getId(), 300_000), ErrorCode.LOAN_NOT_ACTIVE);
        }

        @Test
        @DisplayName("Unknown and non-positive ids are rejected")
        void unknownIds_rejected() {
            initializeWithBtcPrice(50_000);

            assertRejected(() -> positionLedgerService.repay(ALICE, 42, 1_000), ErrorCode.LOAN_NOT_FOUND);
            assertRejected(() -> positionLedgerService.repay(ALICE, 0, 1_000), ErrorCode.INVALID_LOAN_ID);
        }

        @Test
        @DisplayName("Repayment keeps the order of the borrower's other positions")
        void repay_preservesIndexOrder() {
            initializeWithBtcPrice(50_000);
            positionLedgerService.requestLoan(ALICE, 10, 1_000);
            positionLedgerService.requestLoan(ALICE, 10, 1_000);
            positionLedgerService.requestLoan(ALICE, 10, 1_000);

            positionLedgerService.repay(ALICE, 2, 1_000);

            assertThat(positionLedgerService.getUserPositions(ALICE)).containsExactly(1L, 3L);
        }
    }

    // ==============================
    // LIQUIDATION
    // ==============================

    @Nested
    @DisplayName("Liquidation")
    class Liquidation {

        @Test
        @DisplayName("Worked example: price drop to 30000 puts the ratio at 100 and liquidates")
        void workedExample_liquidates() {
            initializeWithBtcPrice(50_000);
            positionLedgerService.requestLoan(ALICE, 10, 300_000);
            oracleFeedService.setPrice(ADMIN, "BTC", 30_000);

            LiquidationCheckResult result = positionLedgerService.checkLiquidation(1);

            assertThat(result.isLiquidated()).isTrue();
            assertThat(result.getCollateralRatio()).isEqualTo(100L);
            assertThat(result.getLiquidationThreshold()).isEqualTo(120L);
            assertThat(positionLedgerService.getPosition(1).getStatus()).isEqualTo(PositionStatus.LIQUIDATED);
            assertThat(positionLedgerService.getPosition(1).getRevision()).isEqualTo(2L);
            assertThat(positionLedgerService.getUserPositions(ALICE)).isEmpty();
            assertThat(collateralAccountService.getStats().getTotalCollateralLocked()).isZero();
            verify(eventPublisherHelper).publishPositionLiquidated(any(), any(Position.class));
        }

        @Test
        @DisplayName("Ratio exactly at the threshold liquidates")
        void ratioEqualToThreshold_liquidates() {
            initializeWithBtcPrice(50_000);
            // floor(10 * 50000 / 250000) * 100 = 200
            positionLedgerService.requestLoan(ALICE, 10, 250_000);
            riskParameterService.setLiquidationThreshold(ADMIN, 200);

            assertThat(positionLedgerService.checkLiquidation(1).isLiquidated()).isTrue();
        }

        @Test
        @DisplayName("Ratio one point above the threshold stays active")
        void ratioAboveThreshold_noop() {
            initializeWithBtcPrice(50_000);
            positionLedgerService.requestLoan(ALICE, 10, 250_000);
            riskParameterService.setLiquidationThreshold(ADMIN, 199);

            LiquidationCheckResult result = positionLedgerService.checkLiquidation(1);

            assertThat(result.isLiquidated()).isFalse();
            assertThat(result.getStatus()).isEqualTo(PositionStatus.ACTIVE);
            assertThat(result.getCollateralRatio()).isEqualTo(200L);
            verify(eventPublisherHelper, never()).publishPositionLiquidated(any(), any());
        }

        @Test
        @DisplayName("Price rise that pushes the ratio past the long range leaves the position healthy")
        void priceRiseBeyondLongRange_staysHealthy() {
            initializeWithBtcPrice(1);
            positionLedgerService.requestLoan(ALICE, 1_000_000, 1);
            oracleFeedService.setPrice(ADMIN, "BTC", 1_000_000_000_000L);

            LiquidationCheckResult result = positionLedgerService.checkLiquidation(1);

            assertThat(result.isLiquidated()).isFalse();
            assertThat(result.getStatus()).isEqualTo(PositionStatus.ACTIVE);
            assertThat(result.getCollateralRatio()).isEqualTo(Long.MAX_VALUE);
            assertThat(positionLedgerService.getHealth(1).isHealthy()).isTrue();
            assertRejected(() -> positionLedgerService.liquidate(1), ErrorCode.INVALID_LIQUIDATION);
            verify(eventPublisherHelper, never()).publishPositionLiquidated(any(), any());
        }

        @Test
        @DisplayName("Second check on a liquidated position is a no-op")
        void secondCheck_idempotent() {
            initializeWithBtcPrice(50_000);
            positionLedgerService.requestLoan(ALICE, 10, 300_000);
            positionLedgerService.requestLoan(ALICE, 100, 300_000);
            oracleFeedService.setPrice(ADMIN, "BTC", 30_000);
            positionLedgerService.checkLiquidation(1);

            LiquidationCheckResult second = positionLedgerService.checkLiquidation(1);

            assertThat(second.isLiquidated()).isFalse();
            assertThat(second.getStatus()).isEqualTo(PositionStatus.LIQUIDATED);
            assertThat(positionLedgerService.getUserPositions(ALICE)).containsExactly(2L);
            assertThat(collateralAccountService.getStats().getTotalCollateralLocked()).isEqualTo(100L);
            verify(eventPublisherHelper, times(1)).publishPositionLiquidated(any(), any());
        }

        @Test
        @DisplayName("Checking a repaid position fails with LOAN_NOT_ACTIVE")
        void repaidPosition_notActive() {
            initializeWithBtcPrice(50_000);
            positionLedgerService.requestLoan(ALICE, 10, 300_000);
            positionLedgerService.repay(ALICE, 1, 300_000);

            assertRejected(() -> positionLedgerService.checkLiquidation(1), ErrorCode.LOAN_NOT_ACTIVE);
        }

        @Test
        @DisplayName("Strict liquidation of a healthy position fails with INVALID_LIQUIDATION")
        void strictOnHealthy_invalidLiquidation() {
            initializeWithBtcPrice(50_000);
            positionLedgerService.requestLoan(ALICE, 100, 300_000);

            assertRejected(() -> positionLedgerService.liquidate(1), ErrorCode.INVALID_LIQUIDATION);
            assertThat(positionLedgerService.getPosition(1).isActive()).isTrue();
        }

        @Test
        @DisplayName("Strict liquidation of an already liquidated position fails with LOAN_NOT_ACTIVE")
        void strictOnLiquidated_notActive() {
            initializeWithBtcPrice(50_000);
            positionLedgerService.requestLoan(ALICE, 10, 300_000);
            oracleFeedService.setPrice(ADMIN, "BTC", 30_000);

            assertThat(positionLedgerService.liquidate(1).isLiquidated()).isTrue();
            assertRejected(() -> positionLedgerService.liquidate(1), ErrorCode.LOAN_NOT_ACTIVE);
        }

        @Test
        @DisplayName("Default policy removes only the liquidated id from the borrower index")
        void removePositionPolicy_keepsOtherIds() {
            initializeWithBtcPrice(50_000);
            positionLedgerService.requestLoan(ALICE, 10, 300_000);
            positionLedgerService.requestLoan(ALICE, 100, 300_000);
            oracleFeedService.setPrice(ADMIN, "BTC", 30_000);

            positionLedgerService.checkLiquidation(1);

            assertThat(positionLedgerService.getUserPositions(ALICE)).containsExactly(2L);
        }

        @Test
        @DisplayName("CLEAR_ALL policy drops the whole borrower index entry")
        void clearAllPolicy_clearsIndex() {
            ledgerProperties.setLiquidationIndexPolicy(LiquidationIndexPolicy.CLEAR_ALL);
            buildServices();
            initializeWithBtcPrice(50_000);
            positionLedgerService.requestLoan(ALICE, 10, 300_000);
            positionLedgerService.requestLoan(ALICE, 100, 300_000);
            oracleFeedService.setPrice(ADMIN, "BTC", 30_000);

            positionLedgerService.checkLiquidation(1);

            assertThat(positionLedgerService.getUserPositions(ALICE)).isEmpty();
            assertThat(positionLedgerService.getPosition(2).isActive()).isTrue();
        }
    }

    // ==============================
    // QUERIES AND AGGREGATES
    // ==============================

    @Nested
    @DisplayName("Queries and Aggregates")
    class QueriesAndAggregates {

        @Test
        @DisplayName("Health projection reports ratio, interest and owed amount without mutating")
        void health_projection() {
            initializeWithBtcPrice(50_000);
            positionLedgerService.requestLoan(ALICE, 10, 300_000);
            ledgerClock.advance(3);

            PositionHealth health = positionLedgerService.getHealth(1);

            assertThat(health.getCollateralRatio()).isEqualTo(100L);
            assertThat(health.isHealthy()).isFalse();
            assertThat(health.getElapsedUnits()).isEqualTo(3L);
            assertThat(health.getInterestOwed()).isEqualTo(312L);
            assertThat(health.getAmountOwed()).isEqualTo(300_312L);
            assertThat(positionLedgerService.getPosition(1).isActive()).isTrue();
        }

        @Test
        @DisplayName("Returned positions are snapshots, detached from ledger state")
        void getPosition_returnsSnapshot() {
            initializeWithBtcPrice(50_000);
            positionLedgerService.requestLoan(ALICE, 10, 300_000);

            Position copy = positionLedgerService.getPosition(1);
            copy.setStatus(PositionStatus.REPAID);

            assertThat(positionLedgerService.getPosition(1).getStatus()).isEqualTo(PositionStatus.ACTIVE);
        }

        @Test
        @DisplayName("Locked collateral equals the collateral of active positions after mixed operations")
        void lockedCollateral_matchesActivePositions() {
            initializeWithBtcPrice(50_000);
            positionLedgerService.requestLoan(ALICE, 10, 300_000);
            positionLedgerService.requestLoan(ALICE, 100, 300_000);
            positionLedgerService.requestLoan(BOB, 40, 20_000);
            collateralAccountService.depositCollateral(BOB, 500);
            positionLedgerService.repay(BOB, 3, 20_000);
            assertRejected(() -> positionLedgerService.repay(ALICE, 2, 1), ErrorCode.INVALID_AMOUNT);
            oracleFeedService.setPrice(ADMIN, "BTC", 30_000);
            positionLedgerService.checkLiquidation(1);
            positionLedgerService.checkLiquidation(2);
            positionLedgerService.requestLoan(BOB, 7, 1_000);

            assertThat(collateralAccountService.getStats().getTotalCollateralLocked())
                    .isEqualTo(sumOfActiveCollateral())
                    .isEqualTo(107L);
            assertThat(collateralAccountService.getStats().getActivePositionCount()).isEqualTo(2L);
            assertThat(collateralAccountService.getStats().getTotalCollateralDeposited()).isEqualTo(500L);
            assertThat(positionLedgerService.getActivePositionIds()).containsExactly(2L, 4L);
        }
    }
}
