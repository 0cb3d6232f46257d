package com.lendingledger.event;

import com.lendingledger.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a position transition has committed.
 *
 * <p>The carried position is a snapshot taken inside the transaction; listeners may read it
 * freely without touching ledger state.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>LedgerSyncService -- queues the snapshot for write-behind persistence</li>
 *   <li>LedgerMetricsService -- counts openings, repayments and liquidations</li>
 * </ul>
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;

    public PositionEvent(Object source, Position position, PositionEventType eventType) {
        super(source);
        this.position = position;
        this.eventType = eventType;
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }
}
