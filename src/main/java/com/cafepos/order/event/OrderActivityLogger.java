package com.cafepos.order.event;

import com.cafepos.activity.service.ActivityLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Audits order lifecycle events once the order transaction has committed.
 * Audit failures are logged and never reach the caller: the order is already durable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderActivityLogger {

    static final String ENTITY_TYPE = "ORDER";

    private final ActivityLogService activityLogService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderCreated(OrderCreatedEvent event) {
        log.info("[AUDIT] order created: orderNumber={}, total={}, customerId={}, points={}, by={}",
                event.orderNumber(), event.total(), event.customerId(),
                event.loyaltyPointsEarned(), event.createdBy());
        record(event.createdBy(), "ORDER_CREATED", event.orderId(),
                "orderNumber=" + event.orderNumber() + ", total=" + event.total());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onStatusChanged(OrderStatusChangedEvent event) {
        log.info("[AUDIT] order status changed: orderNumber={}, {} -> {}, by={}",
                event.orderNumber(), event.previousStatus(), event.newStatus(), event.changedBy());
        record(event.changedBy(), "ORDER_" + event.newStatus(), event.orderId(),
                event.previousStatus() + " -> " + event.newStatus()
                        + (event.reason() == null ? "" : ": " + event.reason()));
    }

    private void record(Long userId, String action, Long orderId, String details) {
        try {
            activityLogService.record(userId, action, ENTITY_TYPE, orderId, details);
        } catch (RuntimeException e) {
            log.warn("Failed to write activity log: action={}, orderId={}", action, orderId, e);
        }
    }
}
