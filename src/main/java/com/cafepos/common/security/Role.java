package com.cafepos.common.security;

public enum Role {
    ADMIN,
    MANAGER
}
