package com.lendingledger.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name and the ledger's collateral asset, so the
 * {@code ledger.*} meters from {@link com.lendingledger.observability.LedgerMetricsService}
 * can be told apart when several ledgers report to one backend.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> ledgerCommonTags(LedgerProperties ledgerProperties) {
        Tags tags = Tags.of("application", "lending-ledger", "collateral.asset", ledgerProperties.getCollateralAsset());
        return registry -> registry.config().commonTags(tags);
    }
}
