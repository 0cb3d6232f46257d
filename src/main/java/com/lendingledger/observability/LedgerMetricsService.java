package com.lendingledger.observability;

import com.lendingledger.event.PositionEvent;
import com.lendingledger.ledger.CollateralAccountService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer metrics for the ledger.
 * <ul>
 *   <li><b>ledger.loans.opened</b> / <b>ledger.loans.repaid</b> / <b>ledger.loans.liquidated</b>
 *       (counters): incremented from {@link PositionEvent}s</li>
 *   <li><b>ledger.collateral.locked</b> (gauge): collateral held by active positions</li>
 *   <li><b>ledger.positions.active</b> (gauge): number of active positions</li>
 * </ul>
 *
 * <p>Gauges are evaluated lazily by Micrometer when scraped.
 */
@Service
public class LedgerMetricsService {

    private final Counter loansOpenedCounter;
    private final Counter loansRepaidCounter;
    private final Counter loansLiquidatedCounter;

    public LedgerMetricsService(MeterRegistry meterRegistry, CollateralAccountService collateralAccountService) {
        this.loansOpenedCounter = Counter.builder("ledger.loans.opened")
                .description("Positions opened")
                .register(meterRegistry);

        this.loansRepaidCounter = Counter.builder("ledger.loans.repaid")
                .description("Positions settled by their borrower")
                .register(meterRegistry);

        this.loansLiquidatedCounter = Counter.builder("ledger.loans.liquidated")
                .description("Positions liquidated at or below the liquidation threshold")
                .register(meterRegistry);

        meterRegistry.gauge(
                "ledger.collateral.locked",
                collateralAccountService,
                service -> service.getStats().getTotalCollateralLocked());

        meterRegistry.gauge(
                "ledger.positions.active",
                collateralAccountService,
                service -> service.getStats().getActivePositionCount());
    }

    @EventListener
    public void onPositionEvent(PositionEvent event) {
        switch (event.getEventType()) {
            case OPENED -> loansOpenedCounter.increment();
            case REPAID -> loansRepaidCounter.increment();
            case LIQUIDATED -> loansLiquidatedCounter.increment();
        }
    }
}
