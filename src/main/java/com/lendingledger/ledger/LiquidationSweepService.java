package com.lendingledger.ledger;

import com.lendingledger.config.LedgerProperties;
import com.lendingledger.domain.model.LiquidationCheckResult;
import com.lendingledger.exception.BaseException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic external health sweep over every active position.
 *
 * <p>Sits outside the ledger core: it only calls {@link PositionLedgerService#checkLiquidation}
 * one position at a time, so each check is its own transaction and the sweep never holds
 * the ledger lock across positions. A position that cannot be checked (for example because
 * the collateral price is not yet published) is logged and skipped; the sweep moves on.
 *
 * <p>Disabled unless {@code ledger.liquidation-sweep.enabled=true}.
 */
@Service
public class LiquidationSweepService {

    private static final Logger log = LoggerFactory.getLogger(LiquidationSweepService.class);

    private final PositionLedgerService positionLedgerService;
    private final LedgerProperties ledgerProperties;

    public LiquidationSweepService(PositionLedgerService positionLedgerService, LedgerProperties ledgerProperties) {
        this.positionLedgerService = positionLedgerService;
        this.ledgerProperties = ledgerProperties;
    }

    @Scheduled(fixedDelayString = "#{@ledgerProperties.liquidationSweep.intervalMs}")
    public void scheduledSweep() {
        if (!ledgerProperties.getLiquidationSweep().isEnabled()) {
            return;
        }
        sweep();
    }

    /**
     * Checks every currently active position once.
     *
     * @return number of positions liquidated by this sweep
     */
    public int sweep() {
        List<Long> activeIds = positionLedgerService.getActivePositionIds();
        int liquidated = 0;
        for (Long positionId : activeIds) {
            try {
                LiquidationCheckResult result = positionLedgerService.checkLiquidation(positionId);
                if (result.isLiquidated()) {
                    liquidated++;
                }
            } catch (BaseException e) {
                log.warn("Liquidation check skipped for position {}: [{}] {}", positionId, e.getErrorCode(), e.getMessage());
            }
        }
        if (liquidated > 0) {
            log.info("Liquidation sweep checked {} positions, liquidated {}", activeIds.size(), liquidated);
        }
        return liquidated;
    }
}
