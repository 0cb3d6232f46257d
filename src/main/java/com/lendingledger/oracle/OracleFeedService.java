package com.lendingledger.oracle;

import com.lendingledger.config.LedgerProperties;
import com.lendingledger.exception.ErrorCode;
import com.lendingledger.exception.LedgerException;
import com.lendingledger.ledger.LedgerStateStore;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Latest authoritative price per recognized asset.
 *
 * <p>Single writer (the administrator), last write wins, no history and no staleness
 * check. Prices must lie in {@code (0, maxPrice]}.
 */
@Service
public class OracleFeedService {

    private static final Logger log = LoggerFactory.getLogger(OracleFeedService.class);

    private final LedgerStateStore ledgerStateStore;
    private final LedgerProperties ledgerProperties;

    public OracleFeedService(LedgerStateStore ledgerStateStore, LedgerProperties ledgerProperties) {
        this.ledgerStateStore = ledgerStateStore;
        this.ledgerProperties = ledgerProperties;
    }

    public void setPrice(String caller, String asset, long price) {
        String symbol = ledgerStateStore.write(state -> {
            state.requireAdministrator(caller);
            String recognized = state.requireRecognizedAsset(asset);
            if (price <= 0 || price > ledgerProperties.getMaxPrice()) {
                throw new LedgerException(
                        ErrorCode.INVALID_PRICE,
                        "Price must be in (0, " + ledgerProperties.getMaxPrice() + "]: " + price,
                        Map.of("asset", recognized, "price", price));
            }
            state.putPrice(recognized, price);
            return recognized;
        });
        log.info("Price for {} set to {}", symbol, price);
    }

    /** @throws LedgerException NOT_INITIALIZED if the asset has never been quoted */
    public long getPrice(String asset) {
        return ledgerStateStore.read(state -> state.requirePrice(state.requireRecognizedAsset(asset)));
    }
}
