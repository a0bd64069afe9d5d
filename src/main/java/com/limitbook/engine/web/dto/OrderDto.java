package com.limitbook.engine.web.dto;

import com.limitbook.engine.core.model.Order;
import com.limitbook.engine.core.model.OrderSide;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
public class OrderDto {
    private long id;
    private String symbol;
    private String accountId;
    private OrderSide side;
    private BigDecimal price;
    private long quantity;
    private long filledQuantity;
    private long remainingQuantity;
    private String status;
    private Instant createdAt;

    public static OrderDto from(Order order) {
        return OrderDto.builder()
                .id(order.getId())
                .symbol(order.getSymbol())
                .accountId(order.getAccountId())
                .side(order.getSide())
                .price(order.getPrice())
                .quantity(order.getQuantity())
                .filledQuantity(order.getFilledQuantity())
                .remainingQuantity(order.getRemainingQuantity())
                .status(order.getStatus().name())
                .createdAt(order.getCreatedAt())
                .build();
    }
}
