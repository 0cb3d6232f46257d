package com.lendingledger.config;

import com.lendingledger.clock.ManualLedgerClock;
import com.lendingledger.domain.model.RiskParameters;
import com.lendingledger.engine.HealthEngine;
import com.lendingledger.ledger.LedgerState;
import com.lendingledger.ledger.LedgerStateStore;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the ledger core from {@link LedgerProperties}: the owned state (with the configured
 * administrator and recognized asset pair), its transaction store, the health math and
 * the logical clock.
 */
@Configuration
public class LedgerConfig {

    @Bean
    public LedgerStateStore ledgerStateStore(LedgerProperties ledgerProperties) {
        RiskParameters initialParameters = RiskParameters.builder()
                .minimumCollateralRatio(ledgerProperties.getDefaultMinimumRatio())
                .liquidationThreshold(ledgerProperties.getDefaultLiquidationThreshold())
                .feeRate(ledgerProperties.getDefaultFeeRate())
                .build();
        LedgerState ledgerState = new LedgerState(
                ledgerProperties.getAdministrator(),
                List.of(ledgerProperties.getCollateralAsset(), ledgerProperties.getSecondaryAsset()),
                initialParameters);
        return new LedgerStateStore(ledgerState);
    }

    @Bean
    public HealthEngine healthEngine(LedgerProperties ledgerProperties) {
        return new HealthEngine(ledgerProperties.getUnitsPerPeriod());
    }

    @Bean
    public ManualLedgerClock ledgerClock() {
        return new ManualLedgerClock();
    }
}
