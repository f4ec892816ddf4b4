package com.cafepos.customer.dto;

import com.cafepos.customer.entity.Customer;
import com.cafepos.customer.entity.Tier;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record CustomerResponse(
        Long id,
        String firstName,
        String lastName,
        String phone,
        String email,
        int totalOrders,
        BigDecimal totalSpent,
        int loyaltyPoints,
        Tier tier,
        boolean vip,
        boolean active,
        LocalDateTime createdAt
) {
    public static CustomerResponse of(Customer customer, LoyaltyStatus status) {
        return new CustomerResponse(
                customer.getId(),
                customer.getFirstName(),
                customer.getLastName(),
                customer.getPhone(),
                customer.getEmail(),
                customer.getTotalOrders(),
                customer.getTotalSpent(),
                customer.getLoyaltyPoints(),
                status.tier(),
                status.vip(),
                customer.isActive(),
                customer.getCreatedAt());
    }
}
