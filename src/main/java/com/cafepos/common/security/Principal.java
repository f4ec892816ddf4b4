package com.cafepos.common.security;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;

import java.util.Arrays;

/**
 * Authenticated staff member on whose behalf a core operation runs.
 * Passed explicitly into every mutating service call.
 */
public record Principal(Long userId, Role role) {

    public boolean hasAnyRole(Role... roles) {
        return Arrays.asList(roles).contains(role);
    }

    public void requireAnyRole(Role... roles) {
        if (!hasAnyRole(roles)) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED,
                    "Role " + role + " is not permitted, requires one of " + Arrays.toString(roles));
        }
    }

    /** Guards service entry points against calls without an authenticated principal. */
    public static Principal require(Principal principal) {
        if (principal == null || principal.userId() == null || principal.role() == null) {
            throw new BusinessException(ErrorCode.UNAUTHENTICATED);
        }
        return principal;
    }
}
