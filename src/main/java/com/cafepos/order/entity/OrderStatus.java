package com.cafepos.order.entity;

/**
 * Order lifecycle.
 * <pre>
 *   CONFIRMED → PENDING_CANCELLATION → CANCELLED
 *                       └──(rejected)──→ CONFIRMED
 * </pre>
 */
public enum OrderStatus {
    CONFIRMED,
    PENDING_CANCELLATION,
    CANCELLED;

    public boolean canTransitionTo(OrderStatus next) {
        return switch (this) {
            case CONFIRMED -> next == PENDING_CANCELLATION;
            case PENDING_CANCELLATION -> next == CONFIRMED || next == CANCELLED;
            case CANCELLED -> false;
        };
    }
}
