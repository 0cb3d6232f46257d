package com.lendingledger.config;

import com.lendingledger.domain.enums.LiquidationIndexPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the lending ledger, loaded from application.properties.
 *
 * <p>Properties prefix: {@code ledger.*}. The administrator identity is handed to the
 * state store once at startup; the risk parameter defaults seed the parameter store
 * and are mutable afterwards only through the administrator operations.
 *
 * <p>Defaults:
 * <ul>
 *   <li>collateralAsset / secondaryAsset: BTC / STX</li>
 *   <li>defaultInterestRate: 5 (percent per accrual period, fixed at origination)</li>
 *   <li>defaultMinimumRatio: 150, defaultLiquidationThreshold: 120 (percent)</li>
 *   <li>ratioFloor: 110 (neither ratio parameter may be set below this)</li>
 *   <li>maxPrice: 1e12 (oracle sanity ceiling)</li>
 *   <li>unitsPerPeriod: 144 (clock units per accrual period)</li>
 *   <li>maxActivePositionsPerUser: 10</li>
 *   <li>liquidationSweep.intervalMs: 60000, persistence.flushIntervalMs: 5000 (read by the
 *       {@code @Scheduled} sweep and audit flush)</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private String administrator = "admin";
    private String collateralAsset = "BTC";
    private String secondaryAsset = "STX";

    private long defaultInterestRate = 5;
    private long defaultMinimumRatio = 150;
    private long defaultLiquidationThreshold = 120;
    private long defaultFeeRate = 1;
    private long ratioFloor = 110;

    private long maxPrice = 1_000_000_000_000L;
    private long unitsPerPeriod = 144;
    private int maxActivePositionsPerUser = 10;

    /** Smallest debt a new position may carry. */
    private long minDebtAmount = 1;

    private LiquidationIndexPolicy liquidationIndexPolicy = LiquidationIndexPolicy.REMOVE_POSITION;

    private LiquidationSweep liquidationSweep = new LiquidationSweep();
    private Persistence persistence = new Persistence();

    @Data
    public static class LiquidationSweep {
        private boolean enabled = false;
        private long intervalMs = 60_000;
    }

    @Data
    public static class Persistence {
        private long flushIntervalMs = 5_000;
    }
}
