package com.lendingledger.risk;

import com.lendingledger.config.LedgerProperties;
import com.lendingledger.domain.model.RiskParameters;
import com.lendingledger.exception.ErrorCode;
import com.lendingledger.exception.LedgerException;
import com.lendingledger.ledger.LedgerStateStore;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.ToLongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Administrator operations over the global risk parameters and the one-time initialization.
 *
 * <p>Both ratio parameters have a floor ({@code ledger.ratio-floor}, 110 by default) so a
 * liquidation threshold can never make a freshly admitted position instantly liquidatable
 * through a near-zero margin. Every accepted change is handed to
 * {@link RiskParameterPersistenceService} for the audit trail after it has been applied.
 */
@Service
public class RiskParameterService {

    private static final Logger log = LoggerFactory.getLogger(RiskParameterService.class);

    static final String MINIMUM_RATIO = "minimumCollateralRatio";
    static final String LIQUIDATION_THRESHOLD = "liquidationThreshold";
    static final String FEE_RATE = "feeRate";

    private final LedgerStateStore ledgerStateStore;
    private final LedgerProperties ledgerProperties;
    private final RiskParameterPersistenceService riskParameterPersistenceService;

    public RiskParameterService(
            LedgerStateStore ledgerStateStore,
            LedgerProperties ledgerProperties,
            RiskParameterPersistenceService riskParameterPersistenceService) {
        this.ledgerStateStore = ledgerStateStore;
        this.ledgerProperties = ledgerProperties;
        this.riskParameterPersistenceService = riskParameterPersistenceService;
    }

    /**
     * One-time transition to the initialized state. Position-affecting operations fail with
     * NOT_INITIALIZED until this has run.
     */
    public RiskParameters initialize(String caller) {
        RiskParameters parameters = ledgerStateStore.write(state -> {
            state.requireAdministrator(caller);
            if (state.isInitialized()) {
                throw new LedgerException(ErrorCode.ALREADY_INITIALIZED, "Ledger is already initialized");
            }
            state.markInitialized();
            return state.getRiskParameters();
        });
        log.info("Ledger initialized by {} with parameters {}", caller, parameters);
        return parameters;
    }

    public RiskParameters getRiskParameters() {
        return ledgerStateStore.read(state -> state.getRiskParameters());
    }

    public RiskParameters setMinimumRatio(String caller, long value) {
        return update(
                caller,
                MINIMUM_RATIO,
                RiskParameters::getMinimumCollateralRatio,
                (current, v) -> current.toBuilder().minimumCollateralRatio(v).build(),
                value,
                this::requireAboveFloor);
    }

    public RiskParameters setLiquidationThreshold(String caller, long value) {
        return update(
                caller,
                LIQUIDATION_THRESHOLD,
                RiskParameters::getLiquidationThreshold,
                (current, v) -> current.toBuilder().liquidationThreshold(v).build(),
                value,
                this::requireAboveFloor);
    }

    /** Stored and reported only; this ledger charges no fee. */
    public RiskParameters setFeeRate(String caller, long value) {
        return update(
                caller,
                FEE_RATE,
                RiskParameters::getFeeRate,
                (current, v) -> current.toBuilder().feeRate(v).build(),
                value,
                (name, v) -> {
                    if (v < 0) {
                        throw new LedgerException(ErrorCode.INVALID_AMOUNT, "Fee rate must not be negative: " + v);
                    }
                });
    }

    private RiskParameters update(
            String caller,
            String parameterName,
            ToLongFunction<RiskParameters> getter,
            BiFunction<RiskParameters, Long, RiskParameters> setter,
            long value,
            ParameterValidator validator) {
        ParameterChange change = ledgerStateStore.write(state -> {
            state.requireAdministrator(caller);
            validator.validate(parameterName, value);
            RiskParameters current = state.getRiskParameters();
            state.setRiskParameters(setter.apply(current, value));
            return new ParameterChange(getter.applyAsLong(current), state.getRiskParameters());
        });

        log.info("Risk parameter {} changed {} -> {} by {}", parameterName, change.oldValue(), value, caller);
        riskParameterPersistenceService.recordChange(
                parameterName, String.valueOf(change.oldValue()), String.valueOf(value), caller);
        return change.updated();
    }

    private void requireAboveFloor(String parameterName, long value) {
        long floor = ledgerProperties.getRatioFloor();
        if (value < floor) {
            throw new LedgerException(
                    ErrorCode.INVALID_AMOUNT,
                    parameterName + " must be at least " + floor + ": " + value,
                    Map.of("parameter", parameterName, "value", value, "floor", floor));
        }
    }

    @FunctionalInterface
    private interface ParameterValidator {
        void validate(String parameterName, long value);
    }

    private record ParameterChange(long oldValue, RiskParameters updated) {}
}
