package com.cafepos.customer.dto;

import com.cafepos.customer.entity.Tier;

public record LoyaltyStatus(Tier tier, boolean vip) {
}
