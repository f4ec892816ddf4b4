package com.cafepos.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(ErrorKind.INVALID_REQUEST, "Invalid input value"),
    DATA_CONFLICT(ErrorKind.CONFLICT, "Concurrent update conflict, please retry"),
    INTERNAL_ERROR(ErrorKind.INTERNAL, "Internal server error"),

    // Auth
    UNAUTHENTICATED(ErrorKind.UNAUTHORIZED, "Authenticated principal required"),
    ACCESS_DENIED(ErrorKind.FORBIDDEN, "Insufficient role for this operation"),

    // Menu
    MENU_ITEM_NOT_FOUND(ErrorKind.NOT_FOUND, "Menu item not found or not available"),
    VARIANT_REQUIRED(ErrorKind.INVALID_REQUEST, "Variant selection is required for this item"),
    VARIANT_UNAVAILABLE(ErrorKind.INVALID_REQUEST, "Selected variant is not available"),
    PRICE_NOT_CONFIGURED(ErrorKind.INVALID_REQUEST, "Menu item has no price configured"),
    ADDON_NOT_ALLOWED(ErrorKind.INVALID_REQUEST, "Addon not available for this item"),
    INVALID_ADDON_QUANTITY(ErrorKind.INVALID_REQUEST, "Addon quantity out of bounds"),

    // Order
    ORDER_NOT_FOUND(ErrorKind.NOT_FOUND, "Order not found"),
    INVALID_ORDER_QUANTITY(ErrorKind.INVALID_REQUEST, "Order line quantity out of bounds"),
    INVALID_ORDER_STATUS(ErrorKind.INVALID_STATE, "Invalid order status transition"),
    INVALID_CANCELLATION_REASON(ErrorKind.INVALID_REQUEST, "Cancellation reason must be 5 to 500 characters"),

    // Customer
    CUSTOMER_NOT_FOUND(ErrorKind.NOT_FOUND, "Customer not found"),
    INSUFFICIENT_LOYALTY_POINTS(ErrorKind.INVALID_REQUEST, "Insufficient loyalty points"),
    LOYALTY_CUSTOMER_REQUIRED(ErrorKind.INVALID_REQUEST, "Loyalty payment requires a customer"),

    // Settings
    UNKNOWN_SETTING(ErrorKind.INVALID_REQUEST, "Unknown setting key"),
    INVALID_SETTING_VALUE(ErrorKind.INVALID_REQUEST, "Invalid setting value");

    private final ErrorKind kind;
    private final String message;

    public HttpStatus getStatus() {
        return kind.getStatus();
    }
}
