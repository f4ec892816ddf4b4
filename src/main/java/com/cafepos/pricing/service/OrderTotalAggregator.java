package com.cafepos.pricing.service;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import com.cafepos.pricing.dto.LinePriceRequest;
import com.cafepos.pricing.dto.OrderQuote;
import com.cafepos.pricing.dto.PriceBreakdown;
import com.cafepos.pricing.dto.QuotedLine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Sums resolved lines into an order total. Tax is not computed: it is always zero
 * and the total equals the subtotal.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderTotalAggregator {

    public static final int MIN_LINE_QUANTITY = 1;
    public static final int MAX_LINE_QUANTITY = 100;

    private final PriceResolver priceResolver;

    public OrderQuote aggregate(List<LinePriceRequest> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Order must contain at least one item");
        }

        List<QuotedLine> quoted = new ArrayList<>(lines.size());
        BigDecimal subtotal = BigDecimal.ZERO;
        for (LinePriceRequest line : lines) {
            int quantity = line.quantityOrDefault();
            if (quantity < MIN_LINE_QUANTITY || quantity > MAX_LINE_QUANTITY) {
                throw new BusinessException(ErrorCode.INVALID_ORDER_QUANTITY,
                        "Quantity must be between " + MIN_LINE_QUANTITY + " and " + MAX_LINE_QUANTITY);
            }
            PriceBreakdown breakdown = priceResolver.calculateLinePrice(line);
            BigDecimal lineTotal = breakdown.unitPrice().multiply(BigDecimal.valueOf(quantity));
            quoted.add(new QuotedLine(breakdown, quantity, PriceResolver.money(lineTotal)));
            subtotal = subtotal.add(lineTotal);
        }

        BigDecimal total = PriceResolver.money(subtotal);
        return new OrderQuote(List.copyOf(quoted), total, PriceResolver.money(BigDecimal.ZERO), total);
    }
}
