package com.lendingledger.event;

import com.lendingledger.domain.model.Position;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for ledger events.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishPositionOpened(Object source, Position position) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position, PositionEventType.OPENED));
    }

    public void publishPositionRepaid(Object source, Position position) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position, PositionEventType.REPAID));
    }

    public void publishPositionLiquidated(Object source, Position position) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position, PositionEventType.LIQUIDATED));
    }
}
