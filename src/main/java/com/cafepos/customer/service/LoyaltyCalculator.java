package com.cafepos.customer.service;

import com.cafepos.customer.dto.LoyaltyStatus;
import com.cafepos.customer.entity.Tier;
import com.cafepos.settings.dto.LoyaltyRatio;
import com.cafepos.settings.dto.TierThresholds;
import com.cafepos.settings.dto.VipThreshold;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Stateless loyalty math. Every result is derived from the arguments alone, so tier and
 * VIP status can be recomputed from stored aggregates at any time.
 */
@Component
public class LoyaltyCalculator {

    /**
     * floor(total / spendAmount) * pointsEarned, or 0 without a ratio or a positive total.
     *
     * @throws ArithmeticException if the result does not fit in an int
     */
    public int pointsEarned(BigDecimal orderTotal, LoyaltyRatio ratio) {
        if (ratio == null || orderTotal == null || orderTotal.signum() <= 0
                || ratio.spendAmount() == null || ratio.spendAmount().signum() <= 0) {
            return 0;
        }
        BigDecimal blocks = orderTotal.divide(ratio.spendAmount(), 0, RoundingMode.FLOOR);
        return Math.multiplyExact(blocks.intValueExact(), ratio.pointsEarned());
    }

    /** Points a LOYALTY payment consumes: one point per currency unit, rounded up. */
    public int pointsToRedeem(BigDecimal orderTotal) {
        return orderTotal.setScale(0, RoundingMode.CEILING).intValueExact();
    }

    public Tier tierFor(BigDecimal totalSpent, TierThresholds thresholds) {
        BigDecimal spent = totalSpent == null ? BigDecimal.ZERO : totalSpent;
        if (spent.compareTo(thresholds.platinum()) >= 0) {
            return Tier.PLATINUM;
        }
        if (spent.compareTo(thresholds.gold()) >= 0) {
            return Tier.GOLD;
        }
        if (spent.compareTo(thresholds.silver()) >= 0) {
            return Tier.SILVER;
        }
        return Tier.BRONZE;
    }

    public boolean isVip(int totalOrders, VipThreshold threshold) {
        return totalOrders >= threshold.minOrders();
    }

    public LoyaltyStatus evaluate(int totalOrders, BigDecimal totalSpent,
                                  TierThresholds thresholds, VipThreshold vipThreshold) {
        return new LoyaltyStatus(tierFor(totalSpent, thresholds), isVip(totalOrders, vipThreshold));
    }
}
