package com.cafepos.order.service;

import com.cafepos.order.entity.Order;
import com.cafepos.order.repository.OrderRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Issues {@code ORD-yyyyMMdd-NNNN}, numbered per day. Two concurrent orders can draw the
 * same number; the unique constraint rejects the second and order creation is retried.
 */
@Component
public class OrderNumberGenerator {

    private static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final OrderRepository orderRepository;
    private final String prefix;

    public OrderNumberGenerator(OrderRepository orderRepository,
                                @Value("${cafe-pos.order.number-prefix:ORD}") String prefix) {
        this.orderRepository = orderRepository;
        this.prefix = prefix;
    }

    public String next(LocalDate date) {
        String dayPrefix = prefix + "-" + date.format(DATE) + "-";
        int sequence = orderRepository.findTopByOrderNumberStartingWithOrderByOrderNumberDesc(dayPrefix)
                .map(Order::getOrderNumber)
                .map(number -> Integer.parseInt(number.substring(dayPrefix.length())) + 1)
                .orElse(1);
        return dayPrefix + String.format("%04d", sequence);
    }
}
