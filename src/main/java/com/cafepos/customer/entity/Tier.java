package com.cafepos.customer.entity;

public enum Tier {
    BRONZE,
    SILVER,
    GOLD,
    PLATINUM
}
